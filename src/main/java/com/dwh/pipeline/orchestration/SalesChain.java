package com.dwh.pipeline.orchestration;

import com.dwh.pipeline.assembly.SalesFactAssembler;
import com.dwh.pipeline.cleansing.SalesCleanser;
import com.dwh.pipeline.domain.CustomerDimension;
import com.dwh.pipeline.domain.EntityFamily;
import com.dwh.pipeline.domain.ProductDimension;
import com.dwh.pipeline.domain.RawTable;
import com.dwh.pipeline.domain.SalesFact;
import com.dwh.pipeline.domain.SalesLineRecord;
import com.dwh.pipeline.exception.ErrorKind;
import com.dwh.pipeline.output.StarSchemaPublisher;
import com.dwh.pipeline.quality.QualityCheck;
import com.dwh.pipeline.quality.RowChecks;
import com.dwh.pipeline.quality.Severity;
import com.dwh.pipeline.rawstore.RawStore;
import com.dwh.pipeline.rules.MeasureReconciler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 판매 패밀리 체인
 * <p>
 * - {@link #prepare}: read → cleanse → rules (고객/상품 체인과 병렬)
 * - {@link #assemble}: assemble → stage-output (고객/상품 dimension 이 모두 준비된 뒤)
 * <p>
 * 고객/상품 체인 중 하나라도 성공하지 못하면 assemble 이후를 실행하지 않고 BLOCKED 로 끝납니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SalesChain {

    private static final EntityFamily FAMILY = EntityFamily.SALES;

    private final StageRunner runner;
    private final SalesCleanser cleanser;
    private final MeasureReconciler measureReconciler;
    private final SalesFactAssembler assembler;
    private final StarSchemaPublisher publisher;

    public FamilyOutcome<List<SalesLineRecord>> prepare(RunContext run, RawStore rawStore) {
        StageResult<RawTable> raw = runner.run(run, FAMILY, "read",
                issues -> rawStore.read(SalesCleanser.TABLE), QualityCheck.none());
        if (!raw.succeeded()) {
            return FamilyOutcome.stoppedAt(raw);
        }

        StageResult<List<SalesLineRecord>> cleansed = runner.run(run, FAMILY, "cleanse",
                issues -> cleanser.cleanse(raw.output(), issues),
                RowChecks.<SalesLineRecord>required(SalesCleanser.TABLE, "sls_ord_num",
                        SalesLineRecord::lineKey, SalesLineRecord::orderNumber, Severity.WARNING));
        if (!cleansed.succeeded()) {
            return FamilyOutcome.stoppedAt(cleansed);
        }

        StageResult<List<SalesLineRecord>> reconciled = runner.run(run, FAMILY, "rules",
                issues -> measureReconciler.reconcile(cleansed.output(), issues),
                RowChecks.<SalesLineRecord>consistentMeasures(SalesCleanser.TABLE, SalesLineRecord::lineKey,
                                SalesLineRecord::amount, SalesLineRecord::quantity, SalesLineRecord::price,
                                SalesLineRecord::reconciliationFailed, Severity.WARNING)
                        .and(RowChecks.<SalesLineRecord>ordered(SalesCleanser.TABLE, "order_date<=ship_date",
                                SalesLineRecord::lineKey, SalesLineRecord::orderDate, SalesLineRecord::shipDate, Severity.WARNING))
                        .and(RowChecks.<SalesLineRecord>ordered(SalesCleanser.TABLE, "order_date<=due_date",
                                SalesLineRecord::lineKey, SalesLineRecord::orderDate, SalesLineRecord::dueDate, Severity.WARNING)));
        if (!reconciled.succeeded()) {
            return FamilyOutcome.stoppedAt(reconciled);
        }
        return FamilyOutcome.succeeded(FAMILY, reconciled.output(), 0);
    }

    public FamilyOutcome<List<SalesFact>> assemble(RunContext run,
                                                   FamilyOutcome<List<SalesLineRecord>> prepared,
                                                   FamilyOutcome<List<CustomerDimension>> customerOutcome,
                                                   FamilyOutcome<List<ProductDimension>> productOutcome) {
        if (!prepared.succeeded()) {
            return prepared.stopped();
        }
        if (!customerOutcome.succeeded() || !productOutcome.succeeded()) {
            return blocked(run, customerOutcome, productOutcome);
        }

        List<SalesLineRecord> lines = prepared.output();
        List<CustomerDimension> customerRows = customerOutcome.output();
        List<ProductDimension> productRows = productOutcome.output();
        int lineCount = lines.size();
        StageResult<List<SalesFact>> facts = runner.run(run, FAMILY, "assemble",
                issues -> assembler.assemble(lines, customerRows, productRows, issues),
                QualityCheck.<List<SalesFact>>none()
                        .and((rows, issues) -> {
                            if (rows.size() != lineCount) {
                                issues.fatal(SalesCleanser.TABLE, null, "grain:one-row-per-line", ErrorKind.STRUCTURAL,
                                        rows.size() + " facts for " + lineCount + " sales lines");
                            }
                        })
                        .and(RowChecks.<SalesFact>references("fact_sales", "product_key", SalesFact::orderNumber,
                                SalesFact::productKey, SalesFact.UNRESOLVED,
                                () -> keys(productRows.stream().map(ProductDimension::productKey)), Severity.FATAL))
                        .and(RowChecks.<SalesFact>references("fact_sales", "customer_key", SalesFact::orderNumber,
                                SalesFact::customerKey, SalesFact.UNRESOLVED,
                                () -> keys(customerRows.stream().map(CustomerDimension::customerKey)), Severity.FATAL)));
        if (!facts.succeeded()) {
            return FamilyOutcome.stoppedAt(facts);
        }

        StageResult<Integer> staged = runner.run(run, FAMILY, "stage-output",
                issues -> publisher.stageSales(facts.output()), QualityCheck.none());
        if (!staged.succeeded()) {
            return FamilyOutcome.stoppedAt(staged);
        }
        return FamilyOutcome.succeeded(FAMILY, facts.output(), staged.output());
    }

    private FamilyOutcome<List<SalesFact>> blocked(RunContext run,
                                                   FamilyOutcome<?> customerOutcome,
                                                   FamilyOutcome<?> productOutcome) {
        String detail = "upstream " + EntityFamily.CUSTOMER + "=" + customerOutcome.status()
                + ", " + EntityFamily.PRODUCT + "=" + productOutcome.status();
        run.issues().forStage(FAMILY, "assemble").fatal(SalesCleanser.TABLE, null, "dependency:dimensions",
                ErrorKind.STRUCTURAL, detail);
        StageReport report = new StageReport(FAMILY, "assemble", StageStatus.BLOCKED, Duration.ZERO, 1, detail);
        run.record(report);
        log.warn("[{}] {} blocked: {}", run.runId(), FAMILY, detail);
        return FamilyOutcome.stoppedAt(new StageResult<>(report, null));
    }

    private static Set<Integer> keys(Stream<Integer> keys) {
        return keys.collect(Collectors.toSet());
    }
}
