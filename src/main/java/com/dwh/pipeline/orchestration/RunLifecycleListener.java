package com.dwh.pipeline.orchestration;

import com.dwh.pipeline.config.PipelineProperties;
import com.dwh.pipeline.domain.EntityFamily;
import com.dwh.pipeline.output.StarSchemaPublisher;
import com.dwh.pipeline.rawstore.RawStore;
import com.dwh.pipeline.rawstore.RawStoreFactory;
import com.dwh.pipeline.rawstore.RawStoreLocation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.job.JobExecution;
import org.springframework.batch.core.job.parameters.JobParameters;
import org.springframework.batch.core.listener.JobExecutionListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * run 시작/종료 처리
 * <p>
 * beforeJob: run lock 획득 → 출력 스키마 준비 → Raw Store 연결 → RunContext 등록
 * <p>
 * afterJob: publish 까지 가지 못한 run 의 staging 정리 → RunContext 해제 → run lock 반환
 * <p>
 * lock 을 얻지 못하면 beforeJob 이 {@link com.dwh.pipeline.exception.RunInProgressException} 을 던지고
 * Job 은 Step 없이 FAILED 로 끝납니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RunLifecycleListener implements JobExecutionListener {

    public static final String RUN_ID = "runId";
    public static final String RAW_SCHEMA = "rawSchema";
    public static final String RAW_STORE_URL = "rawStoreUrl";
    public static final String RAW_STORE_USERNAME = "rawStoreUsername";
    public static final String RAW_STORE_PASSWORD = "rawStorePassword";

    private final RunLock runLock;
    private final RunRegistry registry;
    private final RawStoreFactory rawStoreFactory;
    private final StarSchemaPublisher publisher;
    private final PipelineSteps steps;
    private final PipelineProperties properties;
    private final Clock clock;

    private final Map<Long, RunLock.Lease> leases = new ConcurrentHashMap<>();

    @Override
    public void beforeJob(JobExecution jobExecution) {
        long executionId = jobExecution.getId();
        JobParameters params = jobExecution.getJobParameters();
        String runId = Optional.ofNullable(params.getString(RUN_ID))
                .filter(id -> !id.isBlank())
                .orElse("run-" + executionId);
        String rawSchema = params.getString(RAW_SCHEMA);
        RawStoreLocation location = new RawStoreLocation(params.getString(RAW_STORE_URL),
                params.getString(RAW_STORE_USERNAME), params.getString(RAW_STORE_PASSWORD),
                rawSchema == null || rawSchema.isBlank() ? properties.getRawSchema() : rawSchema);

        RunLock.Lease lease = runLock.acquire(runId);
        leases.put(executionId, lease);
        try {
            publisher.prepareSchema();
            RawStore rawStore = rawStoreFactory.open(location);
            registry.register(executionId, new RunContext(runId, rawStore, clock.instant()));
        } catch (RuntimeException e) {
            leases.remove(executionId).close();
            throw e;
        }
        log.info("[{}] Pipeline run started (raw store: {})", runId, location);
    }

    @Override
    public void afterJob(JobExecution jobExecution) {
        long executionId = jobExecution.getId();
        try {
            registry.complete(executionId).ifPresent(run -> {
                if (run.report() == null) {
                    log.warn("[{}] Run ended before publish ({}), dropping staging tables",
                            run.runId(), jobExecution.getStatus());
                    for (EntityFamily family : EntityFamily.values()) {
                        steps.discardQuietly(run, family);
                    }
                }
            });
        } finally {
            RunLock.Lease lease = leases.remove(executionId);
            if (lease != null) {
                lease.close();
            }
        }
    }
}
