package com.dwh.pipeline.exception;

import com.dwh.pipeline.orchestration.RunReport;

/**
 * 하나 이상의 엔티티 패밀리가 성공하지 못했을 때 Step 을 FAILED 로 끝내기 위한 예외
 */
public class PipelineRunFailedException extends PipelineException {

    private final transient RunReport report;

    public PipelineRunFailedException(RunReport report) {
        super(ErrorKind.INTERNAL, "Pipeline run '" + report.runId() + "' did not complete: " + report.familyStatuses());
        this.report = report;
    }

    public RunReport getReport() {
        return report;
    }
}
