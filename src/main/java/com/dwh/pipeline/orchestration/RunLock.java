package com.dwh.pipeline.orchestration;

import com.dwh.pipeline.config.PipelineProperties;
import com.dwh.pipeline.exception.RunInProgressException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * 출력 스키마 단일 writer 보장 (PostgreSQL session advisory lock)
 * <p>
 * run 마다 전용 커넥션에서 lock 을 잡고, run 이 끝나면 해제 후 커넥션을 반환합니다.
 * 같은 DB 를 쓰는 다른 프로세스의 run 도 같은 lock 이름으로 경쟁하므로 {@code <table>__next} 를
 * 두 run 이 동시에 쓰는 일은 없습니다.
 */
@Slf4j
@Component
public class RunLock {

    private final DataSource dataSource;
    private final String lockName;

    public RunLock(DataSource dataSource, PipelineProperties properties) {
        this.dataSource = dataSource;
        this.lockName = "sales-dwh-pipeline:" + properties.getTargetSchema();
    }

    /**
     * @throws RunInProgressException 다른 run 이 lock 을 보유 중일 때
     */
    public Lease acquire(String runId) {
        Connection connection;
        try {
            connection = dataSource.getConnection();
        } catch (SQLException e) {
            throw new CannotGetJdbcConnectionException("Could not open a connection for the run lock", e);
        }

        JdbcTemplate session = new JdbcTemplate(new SingleConnectionDataSource(connection, true));
        Boolean acquired;
        try {
            acquired = session.queryForObject("SELECT pg_try_advisory_lock(hashtext(?))", Boolean.class, lockName);
        } catch (DataAccessException e) {
            DataSourceUtils.releaseConnection(connection, dataSource);
            throw e;
        }
        if (!Boolean.TRUE.equals(acquired)) {
            DataSourceUtils.releaseConnection(connection, dataSource);
            throw new RunInProgressException(runId);
        }
        log.info("[{}] Run lock '{}' acquired", runId, lockName);
        return new Lease(runId, connection, session);
    }

    /**
     * 보유 중인 lock. close 시 해제됩니다.
     */
    public final class Lease implements AutoCloseable {

        private final String runId;
        private final Connection connection;
        private final JdbcTemplate session;

        private Lease(String runId, Connection connection, JdbcTemplate session) {
            this.runId = runId;
            this.connection = connection;
            this.session = session;
        }

        public String runId() {
            return runId;
        }

        @Override
        public void close() {
            try {
                session.queryForObject("SELECT pg_advisory_unlock(hashtext(?))", Boolean.class, lockName);
                log.info("[{}] Run lock '{}' released", runId, lockName);
            } finally {
                DataSourceUtils.releaseConnection(connection, dataSource);
            }
        }
    }
}
