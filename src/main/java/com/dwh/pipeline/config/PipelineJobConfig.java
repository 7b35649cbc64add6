package com.dwh.pipeline.config;

import com.dwh.pipeline.domain.EntityFamily;
import com.dwh.pipeline.exception.PipelineRunFailedException;
import com.dwh.pipeline.orchestration.FamilyStatus;
import com.dwh.pipeline.orchestration.PipelineSteps;
import com.dwh.pipeline.orchestration.RunContext;
import com.dwh.pipeline.orchestration.RunLifecycleListener;
import com.dwh.pipeline.orchestration.RunRegistry;
import com.dwh.pipeline.orchestration.RunReport;
import com.dwh.pipeline.quality.Severity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.job.Job;
import org.springframework.batch.core.job.builder.FlowBuilder;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.job.flow.Flow;
import org.springframework.batch.core.job.flow.support.SimpleFlow;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.Step;
import org.springframework.batch.core.step.StepExecution;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.infrastructure.item.ExecutionContext;
import org.springframework.batch.infrastructure.repeat.RepeatStatus;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.interceptor.DefaultTransactionAttribute;

import java.util.Locale;
import java.util.function.Function;

/**
 * warehousePipelineJob 설정 ("run pipeline" 진입점)
 * <p>
 * JobParameters:
 * - runId (String, identifying): run 식별자 (없으면 run-{jobExecutionId})
 * - rawSchema (String): Raw Store 스키마 (없으면 pipeline.raw-schema)
 * - rawStoreUrl / rawStoreUsername / rawStorePassword (String): 외부 Raw Store (없으면 애플리케이션 DataSource)
 * <p>
 * 처리 흐름:
 * <pre>
 * split(pipelineTaskExecutor)
 *   ├─ customerFlow:     customerStep      (read → cleanse → dedup → assemble → stage-output)
 *   ├─ productFlow:      productStep       (read → cleanse → dedup → rules → assemble → stage-output)
 *   └─ salesPrepareFlow: salesPrepareStep  (read → cleanse → rules)
 * → salesAssembleStep (assemble → stage-output, 고객/상품 미성공 시 BLOCKED)
 * → publishStep       (성공 패밀리 swap, 나머지 staging 정리, RunReport)
 * </pre>
 * 패밀리 Step 은 패밀리 상태와 무관하게 COMPLETED 로 끝나고 상태는 Step ExecutionContext 의 familyStatus 에 남습니다.
 * 패밀리 중 하나라도 SUCCEEDED 가 아니면 publishStep 이 FAILED 로 끝납니다.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class PipelineJobConfig {

    public static final String JOB_NAME = "warehousePipelineJob";
    public static final String FAMILY_STATUS = "familyStatus";

    private final PipelineSteps steps;
    private final RunRegistry registry;

    @Bean
    public Job warehousePipelineJob(JobRepository jobRepository,
                                    RunLifecycleListener runLifecycleListener,
                                    Flow familyFlows,
                                    Step salesAssembleStep,
                                    Step publishStep) {
        return new JobBuilder(JOB_NAME, jobRepository)
                .listener(runLifecycleListener)
                .start(familyFlows)
                .next(salesAssembleStep)
                .next(publishStep)
                .end()
                .build();
    }

    /**
     * 서로 독립인 패밀리 구간을 병렬로 실행합니다. 세 Flow 가 모두 끝나야 다음 Step 으로 넘어갑니다.
     */
    @Bean
    public Flow familyFlows(@Qualifier("pipelineTaskExecutor") TaskExecutor pipelineTaskExecutor,
                            Step customerStep,
                            Step productStep,
                            Step salesPrepareStep) {
        return new FlowBuilder<SimpleFlow>("familyFlows")
                .split(pipelineTaskExecutor)
                .add(flow("customerFlow", customerStep),
                        flow("productFlow", productStep),
                        flow("salesPrepareFlow", salesPrepareStep))
                .build();
    }

    private static Flow flow(String name, Step step) {
        return new FlowBuilder<SimpleFlow>(name).start(step).build();
    }

    @Bean
    public Step customerStep(JobRepository jobRepository, PlatformTransactionManager transactionManager) {
        return familyStep("customerStep", steps::customers, jobRepository, transactionManager);
    }

    @Bean
    public Step productStep(JobRepository jobRepository, PlatformTransactionManager transactionManager) {
        return familyStep("productStep", steps::products, jobRepository, transactionManager);
    }

    @Bean
    public Step salesPrepareStep(JobRepository jobRepository, PlatformTransactionManager transactionManager) {
        return familyStep("salesPrepareStep", steps::prepareSales, jobRepository, transactionManager);
    }

    @Bean
    public Step salesAssembleStep(JobRepository jobRepository, PlatformTransactionManager transactionManager) {
        return familyStep("salesAssembleStep", steps::assembleSales, jobRepository, transactionManager);
    }

    @Bean
    public Step publishStep(JobRepository jobRepository, PlatformTransactionManager transactionManager) {
        return new StepBuilder("publishStep", jobRepository)
                .tasklet(publishTasklet(), transactionManager)
                .build();
    }

    /**
     * 패밀리 Step 은 Step 트랜잭션 없이 실행합니다 (NOT_SUPPORTED).
     * Raw Store 조회 실패가 같은 커넥션의 staging 작성을 중단시키지 않도록 각 SQL 은 개별 커밋됩니다.
     */
    private Step familyStep(String name, Function<RunContext, FamilyStatus> body,
                            JobRepository jobRepository, PlatformTransactionManager transactionManager) {
        Tasklet tasklet = (contribution, chunkContext) -> {
            StepExecution stepExecution = chunkContext.getStepContext().getStepExecution();
            RunContext run = registry.get(stepExecution.getJobExecution().getId());
            FamilyStatus status = body.apply(run);
            stepExecution.getExecutionContext().putString(FAMILY_STATUS, status.name());
            return RepeatStatus.FINISHED;
        };
        return new StepBuilder(name, jobRepository)
                .tasklet(tasklet, transactionManager)
                .transactionAttribute(new DefaultTransactionAttribute(TransactionDefinition.PROPAGATION_NOT_SUPPORTED))
                .build();
    }

    private Tasklet publishTasklet() {
        return (contribution, chunkContext) -> {
            StepExecution stepExecution = chunkContext.getStepContext().getStepExecution();
            RunReport report = steps.publish(registry.get(stepExecution.getJobExecution().getId()));

            ExecutionContext executionContext = stepExecution.getExecutionContext();
            executionContext.putString("runSummary", report.summary());
            executionContext.putLong("issues.info", report.issueCount(Severity.INFO));
            executionContext.putLong("issues.warning", report.issueCount(Severity.WARNING));
            executionContext.putLong("issues.fatal", report.issueCount(Severity.FATAL));
            for (EntityFamily family : EntityFamily.values()) {
                executionContext.putString("status." + family.name().toLowerCase(Locale.ROOT), String.valueOf(report.statusOf(family)));
                executionContext.putInt("rows." + family.name().toLowerCase(Locale.ROOT), report.rowCounts().getOrDefault(family, 0));
            }

            if (!report.succeeded()) {
                throw new PipelineRunFailedException(report);
            }
            return RepeatStatus.FINISHED;
        };
    }
}
