package com.dwh.pipeline.orchestration;

import com.dwh.pipeline.domain.EntityFamily;
import com.dwh.pipeline.exception.ErrorKind;
import com.dwh.pipeline.exception.PipelineException;
import com.dwh.pipeline.quality.QualityCheck;
import com.dwh.pipeline.quality.StageIssues;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Function;

/**
 * Stage 실행 경계
 * <p>
 * 모든 Stage 는 여기서만 예외가 처리됩니다. 실행 → 사후 품질 검증 → 경과 시간/issue 수 기록 후
 * {@link StageResult} 로 반환하며, FATAL issue 가 하나라도 있으면 FAILED 입니다.
 * 취소 요청은 Stage 시작 전에만 확인합니다.
 */
@Slf4j
@Component
public class StageRunner {

    public <T> StageResult<T> run(RunContext run, EntityFamily family, String stage,
                                  Function<StageIssues, T> body, QualityCheck<? super T> validation) {
        if (run.isCancelled()) {
            log.warn("[{}] {}/{} skipped: run cancelled", run.runId(), family, stage);
            return finish(run, new StageReport(family, stage, StageStatus.CANCELLED, Duration.ZERO, 0,
                    "run cancelled"), null);
        }

        StageIssues issues = run.issues().forStage(family, stage);
        long started = System.nanoTime();
        try {
            T output = body.apply(issues);
            validation.check(output, issues);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
            if (issues.hasFatal()) {
                log.error("[{}] {}/{} failed validation ({} issues) in {} ms",
                        run.runId(), family, stage, issues.count(), elapsed.toMillis());
                return finish(run, new StageReport(family, stage, StageStatus.FAILED, elapsed, issues.count(),
                        "fatal quality issue"), null);
            }
            log.info("[{}] {}/{} completed ({} issues) in {} ms",
                    run.runId(), family, stage, issues.count(), elapsed.toMillis());
            return finish(run, new StageReport(family, stage, StageStatus.SUCCEEDED, elapsed, issues.count(),
                    null), output);
        } catch (PipelineException e) {
            issues.fatal(stage, null, "stage:" + stage, e.getKind(), e.getMessage());
            return failed(run, family, stage, started, issues, e);
        } catch (RuntimeException e) {
            issues.fatal(stage, null, "stage:" + stage, ErrorKind.INTERNAL, String.valueOf(e));
            return failed(run, family, stage, started, issues, e);
        }
    }

    private <T> StageResult<T> failed(RunContext run, EntityFamily family, String stage, long started,
                                      StageIssues issues, RuntimeException error) {
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        log.error("[{}] {}/{} aborted after {} ms", run.runId(), family, stage, elapsed.toMillis(), error);
        return finish(run, new StageReport(family, stage, StageStatus.FAILED, elapsed, issues.count(),
                error.getClass().getSimpleName() + ": " + error.getMessage()), null);
    }

    private <T> StageResult<T> finish(RunContext run, StageReport report, T output) {
        run.record(report);
        return new StageResult<>(report, output);
    }
}
