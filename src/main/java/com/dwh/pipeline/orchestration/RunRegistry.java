package com.dwh.pipeline.orchestration;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 이 프로세스에서 실행 중인 run (JobExecution id 기준)
 * <p>
 * Step 들은 JobExecution id 로 자신의 {@link RunContext} 를 찾습니다. 끝난 run 의 RunReport 는
 * {@link #takeReport} 로 한 번 꺼낼 수 있습니다.
 */
@Component
public class RunRegistry {

    private final Map<Long, RunContext> active = new ConcurrentHashMap<>();
    private final Map<Long, RunReport> finished = new ConcurrentHashMap<>();

    public void register(long executionId, RunContext run) {
        active.put(executionId, run);
    }

    public RunContext get(long executionId) {
        RunContext run = active.get(executionId);
        if (run == null) {
            throw new IllegalStateException("No active pipeline run for job execution " + executionId);
        }
        return run;
    }

    public Optional<RunContext> findByRunId(String runId) {
        return active.values().stream()
                .filter(run -> run.runId().equals(runId))
                .findFirst();
    }

    public Optional<String> activeRunId() {
        return active.values().stream().map(RunContext::runId).findFirst();
    }

    /**
     * 실행 종료 처리. RunReport 가 만들어졌다면 보관합니다.
     */
    public Optional<RunContext> complete(long executionId) {
        RunContext run = active.remove(executionId);
        if (run != null && run.report() != null) {
            finished.put(executionId, run.report());
        }
        return Optional.ofNullable(run);
    }

    public Optional<RunReport> takeReport(long executionId) {
        return Optional.ofNullable(finished.remove(executionId));
    }
}
