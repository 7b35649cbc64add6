package com.dwh.pipeline.config;

import com.dwh.pipeline.domain.EntityFamily;
import com.dwh.pipeline.exception.RunInProgressException;
import com.dwh.pipeline.orchestration.PipelineOrchestrator;
import com.dwh.pipeline.orchestration.RunLock;
import com.dwh.pipeline.orchestration.RunReport;
import com.dwh.pipeline.orchestration.RunRequest;
import com.dwh.pipeline.rawstore.RawStoreLocation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.job.Job;
import org.springframework.batch.core.job.JobExecution;
import org.springframework.batch.core.job.parameters.JobParameters;
import org.springframework.batch.core.job.parameters.JobParametersBuilder;
import org.springframework.batch.core.step.StepExecution;
import org.springframework.batch.test.JobLauncherTestUtils;
import org.springframework.batch.test.JobRepositoryTestUtils;
import org.springframework.batch.test.MetaDataInstanceFactory;
import org.springframework.batch.test.context.SpringBatchTest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.test.context.ActiveProfiles;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * warehousePipelineJob 테스트
 *
 * Embedded PostgreSQL 의 raw 스키마에 샘플 CRM/ERP 데이터를 적재한 뒤 Job 을 실행합니다:
 * - 세 패밀리 성공 시 gold star schema 게시
 * - 상품 원천 누락 시 고객만 게시, 판매는 BLOCKED
 * - 실패한 run 은 이전 run 의 출력을 건드리지 않음
 * - 같은 입력으로 두 번 실행하면 같은 출력
 * - 다른 run 이 run lock 을 보유 중이면 아무것도 실행하지 않음
 */
@SpringBatchTest
@SpringBootTest
@ActiveProfiles("test")
class WarehousePipelineJobTest {

    @Autowired
    private JobLauncherTestUtils jobLauncherTestUtils;

    @Autowired
    private JobRepositoryTestUtils jobRepositoryTestUtils;

    @Autowired
    private Job warehousePipelineJob;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private DataSource dataSource;

    @Autowired
    private RunLock runLock;

    @Autowired
    private PipelineOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        jobRepositoryTestUtils.removeJobExecutions();
        jobLauncherTestUtils.setJob(warehousePipelineJob);
        // 테스트 전 raw 샘플 재적재, 출력 스키마 초기화
        new ResourceDatabasePopulator(new ClassPathResource("raw/sample-data.sql")).execute(dataSource);
        jdbcTemplate.execute("DROP SCHEMA IF EXISTS gold CASCADE");
    }

    private JobExecution launch() throws Exception {
        JobParameters params = new JobParametersBuilder()
                .addString("runId", "test-" + UUID.randomUUID(), true)
                .addString("rawSchema", "raw", false)
                .toJobParameters();
        return jobLauncherTestUtils.launchJob(params);
    }

    private Integer count(String table) {
        return jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
    }

    // @SpringBatchTest 의 Job/StepScopeTestExecutionListener 가 launch()/step(..) 헬퍼 대신 사용할 기본 실행 객체
    public JobExecution getJobExecution() {
        return MetaDataInstanceFactory.createJobExecution();
    }

    public StepExecution getStepExecution() {
        return MetaDataInstanceFactory.createStepExecution();
    }

    private static StepExecution step(JobExecution execution, String stepName) {
        return execution.getStepExecutions().stream()
                .filter(step -> stepName.equals(step.getStepName()))
                .findFirst()
                .orElseThrow(() -> new AssertionError("step not executed: " + stepName));
    }

    private boolean exists(String table) {
        return jdbcTemplate.queryForObject("SELECT to_regclass(?) IS NOT NULL", Boolean.class, table);
    }

    @Test
    @DisplayName("샘플 데이터로 gold star schema 가 게시된다")
    void 전체_게시_성공() throws Exception {
        // when
        JobExecution execution = launch();

        // then
        assertThat(execution.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(count("gold.dim_customers")).isEqualTo(2);
        assertThat(count("gold.dim_products")).isEqualTo(2);
        assertThat(count("gold.fact_sales")).isEqualTo(3);

        // CRM 성별 n/a → ERP Female
        String gender = jdbcTemplate.queryForObject(
                "SELECT gender FROM gold.dim_customers WHERE customer_id = 11001", String.class);
        assertThat(gender).isEqualTo("Female");

        // amount 0 → quantity * price
        BigDecimal amount = jdbcTemplate.queryForObject(
                "SELECT sales_amount FROM gold.fact_sales WHERE order_number = 'SO43698'", BigDecimal.class);
        assertThat(amount).isEqualByComparingTo("30");

        // 알 수 없는 상품 → -1
        Integer productKey = jdbcTemplate.queryForObject(
                "SELECT product_key FROM gold.fact_sales WHERE order_number = 'SO43699'", Integer.class);
        assertThat(productKey).isEqualTo(-1);

        assertThat(exists("gold.fact_sales__next")).isFalse();

        assertThat(execution.getStepExecutions())
                .extracting(StepExecution::getStepName)
                .containsExactlyInAnyOrder("customerStep", "productStep", "salesPrepareStep",
                        "salesAssembleStep", "publishStep");
        StepExecution stepExecution = step(execution, "publishStep");
        assertThat(stepExecution.getExecutionContext().getString("status.sales")).isEqualTo("SUCCEEDED");
        assertThat(stepExecution.getExecutionContext().getInt("rows.sales")).isEqualTo(3);
        assertThat(stepExecution.getExecutionContext().getLong("issues.fatal")).isZero();
    }

    @Test
    @DisplayName("상품 카테고리 원천이 없으면 Job 은 FAILED, 고객 dimension 만 게시된다")
    void 상품원천누락_부분게시() throws Exception {
        // given
        jdbcTemplate.execute("DROP TABLE raw.erp_px_cat_g1v2");

        // when
        JobExecution execution = launch();

        // then
        assertThat(execution.getStatus()).isEqualTo(BatchStatus.FAILED);
        assertThat(count("gold.dim_customers")).isEqualTo(2);
        assertThat(exists("gold.dim_products")).isFalse();
        assertThat(exists("gold.fact_sales")).isFalse();
        assertThat(exists("gold.dim_customers__next")).isFalse();
        assertThat(exists("gold.dim_products__next")).isFalse();
        assertThat(exists("gold.fact_sales__next")).isFalse();
        assertThat(step(execution, "productStep").getStatus()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(step(execution, "productStep").getExecutionContext().getString(PipelineJobConfig.FAMILY_STATUS))
                .isEqualTo("FAILED");
        assertThat(step(execution, "salesAssembleStep").getExecutionContext().getString(PipelineJobConfig.FAMILY_STATUS))
                .isEqualTo("BLOCKED");
        assertThat(step(execution, "publishStep").getStatus()).isEqualTo(BatchStatus.FAILED);
    }

    @Test
    @DisplayName("실패한 패밀리는 이전 run 의 출력을 그대로 유지한다")
    void 실패시_이전출력_유지() throws Exception {
        // given
        assertThat(launch().getStatus()).isEqualTo(BatchStatus.COMPLETED);
        jdbcTemplate.execute("DROP TABLE raw.erp_px_cat_g1v2");

        // when
        JobExecution execution = launch();

        // then
        assertThat(execution.getStatus()).isEqualTo(BatchStatus.FAILED);
        assertThat(count("gold.dim_products")).isEqualTo(2);
        assertThat(count("gold.fact_sales")).isEqualTo(3);
        assertThat(count("gold.dim_customers")).isEqualTo(2);
    }

    @Test
    @DisplayName("같은 입력으로 두 번 실행하면 출력이 같다")
    void 재실행_동일출력() throws Exception {
        // given
        assertThat(launch().getStatus()).isEqualTo(BatchStatus.COMPLETED);
        List<Map<String, Object>> customers = jdbcTemplate.queryForList("SELECT * FROM gold.dim_customers ORDER BY customer_key");
        List<Map<String, Object>> facts = jdbcTemplate.queryForList("SELECT * FROM gold.fact_sales ORDER BY order_number");

        // when
        JobExecution execution = launch();

        // then
        assertThat(execution.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(jdbcTemplate.queryForList("SELECT * FROM gold.dim_customers ORDER BY customer_key")).isEqualTo(customers);
        assertThat(jdbcTemplate.queryForList("SELECT * FROM gold.fact_sales ORDER BY order_number")).isEqualTo(facts);
    }

    @Test
    @DisplayName("다른 run 이 run lock 을 보유 중이면 Job 은 Step 없이 FAILED 로 끝나고 출력은 없다")
    void runLock_보유중_거부() throws Exception {
        // given
        JobExecution execution;
        try (RunLock.Lease ignored = runLock.acquire("other-process")) {
            // when
            execution = launch();
        }

        // then
        assertThat(execution.getStatus()).isEqualTo(BatchStatus.FAILED);
        assertThat(execution.getStepExecutions()).isEmpty();
        assertThat(execution.getAllFailureExceptions())
                .anySatisfy(e -> assertThat(e).isInstanceOf(RunInProgressException.class));
        assertThat(exists("gold.dim_customers")).isFalse();
    }

    @Test
    @DisplayName("PipelineOrchestrator 는 Job 을 실행하고 RunReport 를 돌려준다")
    void orchestrator_실행() {
        // when
        RunReport report = orchestrator.run(new RunRequest("orchestrated-" + UUID.randomUUID(), RawStoreLocation.local("raw")));

        // then
        assertThat(report.succeeded()).isTrue();
        assertThat(report.rowCounts()).containsEntry(EntityFamily.SALES, 3);
        assertThat(orchestrator.isRunning()).isFalse();
        assertThat(count("gold.fact_sales")).isEqualTo(3);
    }

    @Test
    @DisplayName("run lock 을 얻지 못하면 PipelineOrchestrator 는 RunInProgressException 을 던진다")
    void orchestrator_runLock_거부() {
        try (RunLock.Lease ignored = runLock.acquire("other-process")) {
            assertThatThrownBy(() -> orchestrator.run(new RunRequest("rejected-" + UUID.randomUUID(), RawStoreLocation.local("raw"))))
                    .isInstanceOf(RunInProgressException.class);
        }
    }
}
