package com.dwh.pipeline.orchestration;

import com.dwh.pipeline.exception.ErrorKind;
import com.dwh.pipeline.exception.PipelineException;
import com.dwh.pipeline.exception.RunInProgressException;
import com.dwh.pipeline.rawstore.RawStoreLocation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.job.Job;
import org.springframework.batch.core.job.JobExecution;
import org.springframework.batch.core.job.parameters.JobParameters;
import org.springframework.batch.core.job.parameters.JobParametersBuilder;
import org.springframework.batch.core.launch.JobOperator;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 파이프라인 run 프로그래밍 진입점
 * <p>
 * warehousePipelineJob 을 동기 실행하고 RunReport 를 돌려줍니다. 실제 처리 순서와 병렬화는 Job 의 Flow 가,
 * 출력 단일 writer 보장은 {@link RunLock} 이 담당합니다.
 */
@Slf4j
@Component
public class PipelineOrchestrator {

    private final JobOperator jobOperator;
    private final Job warehousePipelineJob;
    private final RunRegistry registry;

    public PipelineOrchestrator(JobOperator jobOperator,
                                @Qualifier("warehousePipelineJob") Job warehousePipelineJob,
                                RunRegistry registry) {
        this.jobOperator = jobOperator;
        this.warehousePipelineJob = warehousePipelineJob;
        this.registry = registry;
    }

    /**
     * @throws RunInProgressException 이 프로세스 또는 같은 DB 를 쓰는 다른 프로세스에서 run 이 진행 중일 때
     */
    public RunReport run(RunRequest request) {
        Optional<String> active = registry.activeRunId();
        if (active.isPresent()) {
            throw new RunInProgressException(request.runId(), active.get());
        }

        JobExecution execution;
        try {
            execution = jobOperator.start(warehousePipelineJob, parameters(request));
        } catch (PipelineException e) {
            throw e;
        } catch (Exception e) {
            throw new PipelineException(ErrorKind.INTERNAL, "Could not launch run '" + request.runId() + "'", e);
        }

        for (Throwable failure : execution.getAllFailureExceptions()) {
            if (failure instanceof RunInProgressException) {
                throw (RunInProgressException) failure;
            }
        }
        return registry.takeReport(execution.getId())
                .orElseThrow(() -> new PipelineException(ErrorKind.INTERNAL, "Run '" + request.runId()
                        + "' ended as " + execution.getStatus() + " without a report: "
                        + execution.getAllFailureExceptions()));
    }

    /**
     * 진행 중인 run 에 취소를 요청합니다. 다음 Stage 경계에서 반영됩니다.
     *
     * @return 해당 run 이 진행 중이었으면 true
     */
    public boolean cancel(String runId) {
        Optional<RunContext> run = registry.findByRunId(runId);
        if (run.isEmpty()) {
            return false;
        }
        log.warn("[{}] Cancellation requested", runId);
        run.get().cancel();
        return true;
    }

    public boolean isRunning() {
        return registry.activeRunId().isPresent();
    }

    static JobParameters parameters(RunRequest request) {
        RawStoreLocation location = request.rawStore();
        JobParametersBuilder builder = new JobParametersBuilder()
                .addString(RunLifecycleListener.RUN_ID, request.runId(), true);
        addIfPresent(builder, RunLifecycleListener.RAW_SCHEMA, location.schema());
        addIfPresent(builder, RunLifecycleListener.RAW_STORE_URL, location.jdbcUrl());
        addIfPresent(builder, RunLifecycleListener.RAW_STORE_USERNAME, location.username());
        addIfPresent(builder, RunLifecycleListener.RAW_STORE_PASSWORD, location.password());
        return builder.toJobParameters();
    }

    private static void addIfPresent(JobParametersBuilder builder, String key, String value) {
        if (value != null) {
            builder.addString(key, value, false);
        }
    }
}
