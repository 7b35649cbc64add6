package com.dwh.pipeline.config;

import com.zaxxer.hikari.HikariDataSource;
import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.io.IOException;

/**
 * Warehouse DataSource
 * <p>
 * pipeline.datasource.url 이 설정되어 있으면 외부 PostgreSQL (HikariCP),
 * 없으면 Embedded PostgreSQL 을 띄워 사용합니다.
 */
@Slf4j
@Configuration
public class WarehouseDataSourceConfig {

    private EmbeddedPostgres embeddedPostgres;

    @Bean
    public DataSource dataSource(PipelineProperties properties) throws IOException {
        PipelineProperties.Datasource external = properties.getDatasource();
        if (external.getUrl() != null && !external.getUrl().isBlank()) {
            log.info("Using external PostgreSQL: {}", external.getUrl());
            HikariDataSource dataSource = new HikariDataSource();
            dataSource.setDriverClassName("org.postgresql.Driver");
            dataSource.setJdbcUrl(external.getUrl());
            dataSource.setUsername(external.getUsername());
            dataSource.setPassword(external.getPassword());
            return dataSource;
        }

        log.info("Starting Embedded PostgreSQL...");
        embeddedPostgres = EmbeddedPostgres.builder()
                .start();
        log.info("Embedded PostgreSQL started on port: {}", embeddedPostgres.getPort());
        return embeddedPostgres.getPostgresDatabase();
    }

    @PreDestroy
    public void stop() throws IOException {
        if (embeddedPostgres != null) {
            log.info("Stopping Embedded PostgreSQL...");
            embeddedPostgres.close();
        }
    }
}
