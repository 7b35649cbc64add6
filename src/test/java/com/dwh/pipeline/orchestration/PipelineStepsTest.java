package com.dwh.pipeline.orchestration;

import com.dwh.pipeline.assembly.CustomerDimensionAssembler;
import com.dwh.pipeline.assembly.DenseKeyAssigner;
import com.dwh.pipeline.assembly.KeyAssigner;
import com.dwh.pipeline.assembly.ProductDimensionAssembler;
import com.dwh.pipeline.assembly.SalesFactAssembler;
import com.dwh.pipeline.cleansing.CustomerCleanser;
import com.dwh.pipeline.cleansing.FieldNormalizer;
import com.dwh.pipeline.cleansing.ProductCleanser;
import com.dwh.pipeline.cleansing.SalesCleanser;
import com.dwh.pipeline.dedup.CustomerReconciler;
import com.dwh.pipeline.dedup.DeduplicationEngine;
import com.dwh.pipeline.domain.EntityFamily;
import com.dwh.pipeline.output.StarSchemaPublisher;
import com.dwh.pipeline.quality.QualityIssue;
import com.dwh.pipeline.quality.Severity;
import com.dwh.pipeline.rawstore.RawStore;
import com.dwh.pipeline.rules.MeasureReconciler;
import com.dwh.pipeline.rules.ProductCategorizer;
import com.dwh.pipeline.rules.ValidityWindowDeriver;
import com.dwh.pipeline.support.InMemoryRawStore;
import com.dwh.pipeline.support.SampleRawTables;
import com.dwh.pipeline.support.TestNormalizers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * warehousePipelineJob Step 본문 테스트
 *
 * Job 의 Flow 순서 (customer / product / salesPrepare → salesAssemble → publish) 대로 호출합니다.
 */
@ExtendWith(MockitoExtension.class)
class PipelineStepsTest {

    @Mock
    private StarSchemaPublisher publisher;

    private PipelineSteps steps;

    @BeforeEach
    void setUp() {
        FieldNormalizer normalizer = TestNormalizers.normalizer();
        StageRunner runner = new StageRunner();
        DeduplicationEngine deduplication = new DeduplicationEngine();
        KeyAssigner keys = new DenseKeyAssigner();

        CustomerChain customerChain = new CustomerChain(runner, new CustomerCleanser(normalizer), deduplication,
                new CustomerReconciler(), new CustomerDimensionAssembler(keys), publisher);
        ProductChain productChain = new ProductChain(runner, new ProductCleanser(normalizer), deduplication,
                new ProductCategorizer(), new ValidityWindowDeriver(), new ProductDimensionAssembler(keys), publisher);
        SalesChain salesChain = new SalesChain(runner, new SalesCleanser(normalizer), new MeasureReconciler(),
                new SalesFactAssembler(), publisher);

        steps = new PipelineSteps(customerChain, productChain, salesChain, publisher, TestNormalizers.FIXED_CLOCK);

        lenient().when(publisher.stageCustomers(anyList())).thenAnswer(inv -> inv.<List<?>>getArgument(0).size());
        lenient().when(publisher.stageProducts(anyList())).thenAnswer(inv -> inv.<List<?>>getArgument(0).size());
        lenient().when(publisher.stageSales(anyList())).thenAnswer(inv -> inv.<List<?>>getArgument(0).size());
    }

    private static RunContext run(String runId, RawStore store) {
        return new RunContext(runId, store, TestNormalizers.FIXED_CLOCK.instant());
    }

    private RunReport runAll(RunContext run) {
        steps.customers(run);
        steps.products(run);
        steps.prepareSales(run);
        steps.assembleSales(run);
        return steps.publish(run);
    }

    @Test
    @DisplayName("세 패밀리가 모두 성공하면 한 번에 swap 되고 행 수가 보고된다")
    void 전체성공() {
        // when
        RunContext run = run("run-ok", SampleRawTables.complete());
        RunReport report = runAll(run);

        // then
        assertThat(report.succeeded()).isTrue();
        assertThat(run.report()).isSameAs(report);
        assertThat(report.rowCounts())
                .containsEntry(EntityFamily.CUSTOMER, 2)
                .containsEntry(EntityFamily.PRODUCT, 2)
                .containsEntry(EntityFamily.SALES, 3);
        assertThat(report.issueCount(Severity.FATAL)).isZero();
        assertThat(report.issues())
                .filteredOn(issue -> "lookup:product_key".equals(issue.rule()))
                .extracting(QualityIssue::businessKey)
                .containsExactly("SO43699#2");
        verify(publisher).swap(List.of(EntityFamily.CUSTOMER, EntityFamily.PRODUCT, EntityFamily.SALES));
    }

    @Test
    @DisplayName("상품 원천 테이블이 없으면 PRODUCT 는 FAILED, SALES 는 BLOCKED, CUSTOMER 만 게시된다")
    void 상품실패_판매차단() {
        // given
        InMemoryRawStore store = new InMemoryRawStore()
                .with(SampleRawTables.customers())
                .with(SampleRawTables.erpCustomers())
                .with(SampleRawTables.locations())
                .with(SampleRawTables.products())
                .with(SampleRawTables.sales());

        // when
        RunReport report = runAll(run("run-blocked", store));

        // then
        assertThat(report.succeeded()).isFalse();
        assertThat(report.statusOf(EntityFamily.CUSTOMER)).isEqualTo(FamilyStatus.SUCCEEDED);
        assertThat(report.statusOf(EntityFamily.PRODUCT)).isEqualTo(FamilyStatus.FAILED);
        assertThat(report.statusOf(EntityFamily.SALES)).isEqualTo(FamilyStatus.BLOCKED);
        assertThat(report.stages())
                .filteredOn(stage -> stage.family() == EntityFamily.SALES)
                .extracting(StageReport::stage)
                .containsExactly("read", "cleanse", "rules", "assemble");
        verify(publisher).swap(List.of(EntityFamily.CUSTOMER));
        verify(publisher).discard(EntityFamily.PRODUCT);
        verify(publisher).discard(EntityFamily.SALES);
        verify(publisher, never()).stageSales(anyList());
    }

    @Test
    @DisplayName("판매 원천이 없으면 SALES 는 BLOCKED 가 아니라 FAILED 다")
    void 판매원천누락_FAILED() {
        // given
        InMemoryRawStore store = new InMemoryRawStore()
                .with(SampleRawTables.customers())
                .with(SampleRawTables.erpCustomers())
                .with(SampleRawTables.locations())
                .with(SampleRawTables.products())
                .with(SampleRawTables.categories());

        // when
        RunReport report = runAll(run("run-no-sales", store));

        // then
        assertThat(report.statusOf(EntityFamily.SALES)).isEqualTo(FamilyStatus.FAILED);
        assertThat(report.stages())
                .filteredOn(stage -> stage.family() == EntityFamily.SALES)
                .extracting(StageReport::stage)
                .containsExactly("read");
        verify(publisher).swap(List.of(EntityFamily.CUSTOMER, EntityFamily.PRODUCT));
    }

    @Test
    @DisplayName("취소된 run 은 다음 Stage 부터 실행되지 않고 아무것도 게시되지 않는다")
    void 취소() {
        // given
        RunContext run = run("run-cancel", SampleRawTables.complete());
        steps.customers(run);

        // when
        run.cancel();
        steps.products(run);
        steps.prepareSales(run);
        steps.assembleSales(run);
        RunReport report = steps.publish(run);

        // then
        assertThat(report.familyStatuses()).containsOnlyKeys(EntityFamily.values());
        assertThat(report.familyStatuses().values()).containsOnly(FamilyStatus.CANCELLED);
        verify(publisher).swap(List.of());
        verify(publisher).discard(EntityFamily.CUSTOMER);
        verify(publisher, never()).stageProducts(anyList());
        verify(publisher, never()).stageSales(anyList());
    }

    @Test
    @DisplayName("Stage 안에서 발생한 예외는 Step 밖으로 새지 않고 해당 패밀리의 FAILED 로 기록된다")
    void 체인예외_FAILED() {
        // given
        RunContext run = run("run-crash", null);

        // when
        FamilyStatus status = steps.customers(run);

        // then
        assertThat(status).isEqualTo(FamilyStatus.FAILED);
        assertThat(run.customers().detail()).contains("NullPointerException");
    }

    @Test
    @DisplayName("swap 이 실패하면 게시 대상 패밀리는 모두 FAILED 로 보고된다")
    void swap실패() {
        // given
        doThrow(new DataAccessResourceFailureException("connection lost")).when(publisher).swap(anyList());

        // when
        RunReport report = runAll(run("run-swap", SampleRawTables.complete()));

        // then
        assertThat(report.familyStatuses().values()).containsOnly(FamilyStatus.FAILED);
        assertThat(report.issues())
                .filteredOn(issue -> "publish:swap".equals(issue.rule()))
                .hasSize(3);
    }
}
