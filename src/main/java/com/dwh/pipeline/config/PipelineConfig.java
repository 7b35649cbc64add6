package com.dwh.pipeline.config;

import com.dwh.pipeline.assembly.DenseKeyAssigner;
import com.dwh.pipeline.assembly.KeyAssigner;
import com.dwh.pipeline.assembly.PersistedKeyAssigner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * 파이프라인 공통 Bean (실행 스레드 풀, key 할당 전략, Clock)
 */
@Slf4j
@Configuration
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * familyFlows split 실행용. 스레드가 패밀리 수보다 적으면 일부 Flow 는 순차 실행됩니다.
     */
    @Bean
    public ThreadPoolTaskExecutor pipelineTaskExecutor(PipelineProperties properties) {
        int threads = Math.max(properties.getThreads(), 1);
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("pipeline-");
        return executor;
    }

    @Bean
    public KeyAssigner keyAssigner(PipelineProperties properties, JdbcTemplate jdbcTemplate) {
        log.info("Surrogate key strategy: {}", properties.getKeyStrategy());
        if (properties.getKeyStrategy() == PipelineProperties.KeyStrategy.PERSISTED) {
            return new PersistedKeyAssigner(jdbcTemplate, properties.getTargetSchema());
        }
        return new DenseKeyAssigner();
    }
}
