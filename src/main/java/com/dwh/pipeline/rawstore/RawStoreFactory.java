package com.dwh.pipeline.rawstore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.stereotype.Component;

/**
 * RawStoreLocation → RawStore
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RawStoreFactory {

    private final JdbcTemplate jdbcTemplate;

    public RawStore open(RawStoreLocation location) {
        if (location.isLocal()) {
            return new JdbcRawStore(jdbcTemplate, location.schema());
        }
        log.info("Opening external raw store {}", location);
        DriverManagerDataSource dataSource =
                new DriverManagerDataSource(location.jdbcUrl(), location.username(), location.password());
        return new JdbcRawStore(new JdbcTemplate(dataSource), location.schema());
    }
}
