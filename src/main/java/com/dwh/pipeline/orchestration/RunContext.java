package com.dwh.pipeline.orchestration;

import com.dwh.pipeline.domain.CustomerDimension;
import com.dwh.pipeline.domain.ProductDimension;
import com.dwh.pipeline.domain.SalesFact;
import com.dwh.pipeline.domain.SalesLineRecord;
import com.dwh.pipeline.quality.QualityIssueLog;
import com.dwh.pipeline.rawstore.RawStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 진행 중인 run 1건의 공유 상태
 * <p>
 * issue 로그, stage 기록, 취소 요청과 함께 Step 사이에 넘겨지는 패밀리 결과를 보관합니다.
 * 패밀리 Step 들은 서로 다른 스레드에서 실행되므로 결과 필드는 volatile 입니다.
 */
public class RunContext {

    private final String runId;
    private final RawStore rawStore;
    private final Instant startedAt;
    private final QualityIssueLog issues = new QualityIssueLog();
    private final List<StageReport> stages = new ArrayList<>();
    private final AtomicBoolean cancelled = new AtomicBoolean();

    private volatile FamilyOutcome<List<CustomerDimension>> customers;
    private volatile FamilyOutcome<List<ProductDimension>> products;
    private volatile FamilyOutcome<List<SalesLineRecord>> preparedSales;
    private volatile FamilyOutcome<List<SalesFact>> sales;
    private volatile RunReport report;

    public RunContext(String runId) {
        this(runId, null, Instant.EPOCH);
    }

    public RunContext(String runId, RawStore rawStore, Instant startedAt) {
        this.runId = runId;
        this.rawStore = rawStore;
        this.startedAt = startedAt;
    }

    public String runId() {
        return runId;
    }

    public RawStore rawStore() {
        return rawStore;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public QualityIssueLog issues() {
        return issues;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public synchronized void record(StageReport report) {
        stages.add(report);
    }

    public synchronized List<StageReport> stages() {
        return List.copyOf(stages);
    }

    public FamilyOutcome<List<CustomerDimension>> customers() {
        return customers;
    }

    public void customers(FamilyOutcome<List<CustomerDimension>> outcome) {
        this.customers = outcome;
    }

    public FamilyOutcome<List<ProductDimension>> products() {
        return products;
    }

    public void products(FamilyOutcome<List<ProductDimension>> outcome) {
        this.products = outcome;
    }

    public FamilyOutcome<List<SalesLineRecord>> preparedSales() {
        return preparedSales;
    }

    public void preparedSales(FamilyOutcome<List<SalesLineRecord>> outcome) {
        this.preparedSales = outcome;
    }

    public FamilyOutcome<List<SalesFact>> sales() {
        return sales;
    }

    public void sales(FamilyOutcome<List<SalesFact>> outcome) {
        this.sales = outcome;
    }

    public RunReport report() {
        return report;
    }

    public void report(RunReport report) {
        this.report = report;
    }
}
