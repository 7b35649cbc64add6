package com.dwh.pipeline.orchestration;

import com.dwh.pipeline.domain.EntityFamily;
import com.dwh.pipeline.exception.ErrorKind;
import com.dwh.pipeline.output.StarSchemaPublisher;
import com.dwh.pipeline.quality.Severity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * warehousePipelineJob 의 Step 본문
 * <p>
 * 메서드 하나가 Step 하나에 대응하며 결과는 {@link RunContext} 에 남깁니다. 패밀리 실패는 예외가 아닌
 * {@link FamilyOutcome} 으로 전달되므로 패밀리 Step 은 항상 완료되고, run 성공 여부는 {@link #publish} 가 정합니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineSteps {

    private final CustomerChain customerChain;
    private final ProductChain productChain;
    private final SalesChain salesChain;
    private final StarSchemaPublisher publisher;
    private final Clock clock;

    public FamilyStatus customers(RunContext run) {
        run.customers(guarded(EntityFamily.CUSTOMER, () -> customerChain.run(run, run.rawStore())));
        return run.customers().status();
    }

    public FamilyStatus products(RunContext run) {
        run.products(guarded(EntityFamily.PRODUCT, () -> productChain.run(run, run.rawStore())));
        return run.products().status();
    }

    /**
     * SALES read → cleanse → rules. 고객/상품 Step 과 병렬로 실행됩니다.
     */
    public FamilyStatus prepareSales(RunContext run) {
        run.preparedSales(guarded(EntityFamily.SALES, () -> salesChain.prepare(run, run.rawStore())));
        return run.preparedSales().status();
    }

    /**
     * SALES assemble → stage-output. 병렬 구간이 모두 끝난 뒤에만 실행됩니다.
     */
    public FamilyStatus assembleSales(RunContext run) {
        run.sales(guarded(EntityFamily.SALES,
                () -> salesChain.assemble(run, run.preparedSales(), run.customers(), run.products())));
        log.info("[{}] {} finished as {}", run.runId(), EntityFamily.SALES, run.sales().status());
        return run.sales().status();
    }

    /**
     * 성공한 패밀리만 swap 하고 나머지 staging 은 정리한 뒤 RunReport 를 만듭니다.
     */
    public RunReport publish(RunContext run) {
        List<FamilyOutcome<?>> outcomes = List.of(run.customers(), run.products(), run.sales());
        List<FamilyOutcome<?>> published = swap(run, outcomes);

        Map<EntityFamily, FamilyStatus> statuses = new EnumMap<>(EntityFamily.class);
        Map<EntityFamily, Integer> rowCounts = new EnumMap<>(EntityFamily.class);
        for (FamilyOutcome<?> outcome : published) {
            statuses.put(outcome.family(), outcome.status());
            rowCounts.put(outcome.family(), outcome.rowCount());
        }

        RunReport report = new RunReport(run.runId(), run.startedAt(), clock.instant(), statuses, rowCounts,
                run.stages(), run.issues().countBySeverity(), run.issues().snapshot());
        if (report.succeeded()) {
            log.info("[{}] Pipeline run completed\n{}", run.runId(), report.summary());
        } else {
            log.warn("[{}] Pipeline run finished with failures\n{}", run.runId(), report.summary());
        }
        run.report(report);
        return report;
    }

    private List<FamilyOutcome<?>> swap(RunContext run, List<FamilyOutcome<?>> outcomes) {
        List<FamilyOutcome<?>> result = new ArrayList<>(outcomes.size());
        List<EntityFamily> publishable = new ArrayList<>();
        for (FamilyOutcome<?> outcome : outcomes) {
            if (outcome.succeeded() && run.isCancelled()) {
                outcome = outcome.withStatus(FamilyStatus.CANCELLED, "run cancelled before publish");
            }
            if (outcome.succeeded()) {
                publishable.add(outcome.family());
            } else {
                discardQuietly(run, outcome.family());
            }
            result.add(outcome);
        }

        try {
            publisher.swap(publishable);
            return result;
        } catch (DataAccessException e) {
            log.error("[{}] Swap of {} failed, previous outputs are kept", run.runId(), publishable, e);
            List<FamilyOutcome<?>> failed = new ArrayList<>(result.size());
            for (FamilyOutcome<?> outcome : result) {
                if (publishable.contains(outcome.family())) {
                    run.issues().forStage(outcome.family(), "publish").record(
                            publisher.qualifiedName(outcome.family()), null, "publish:swap", Severity.FATAL,
                            ErrorKind.STRUCTURAL, e.getMessage());
                    outcome = outcome.withStatus(FamilyStatus.FAILED, "publish: " + e.getMessage());
                }
                failed.add(outcome);
            }
            return failed;
        }
    }

    /**
     * 실패한 패밀리의 staging 정리 실패는 run 결과를 바꾸지 않습니다. 다음 run 이 staging 을 다시 만듭니다.
     */
    void discardQuietly(RunContext run, EntityFamily family) {
        try {
            publisher.discard(family);
        } catch (DataAccessException e) {
            log.warn("[{}] Could not drop staging table for {}: {}", run.runId(), family, e.getMessage());
        }
    }

    private <T> FamilyOutcome<T> guarded(EntityFamily family, Supplier<FamilyOutcome<T>> chain) {
        try {
            return chain.get();
        } catch (RuntimeException e) {
            log.error("{} chain crashed outside a stage boundary", family, e);
            return FamilyOutcome.crashed(family, e);
        }
    }
}
