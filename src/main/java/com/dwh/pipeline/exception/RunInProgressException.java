package com.dwh.pipeline.exception;

/**
 * 다른 run 이 출력 테이블을 재구성하는 중일 때 발생
 */
public class RunInProgressException extends PipelineException {

    public RunInProgressException(String requestedRunId) {
        super(ErrorKind.INTERNAL,
                "Run '" + requestedRunId + "' rejected: another run is still rebuilding the outputs");
    }

    public RunInProgressException(String requestedRunId, String activeRunId) {
        super(ErrorKind.INTERNAL,
                "Run '" + requestedRunId + "' rejected: run '" + activeRunId + "' is still rebuilding the outputs");
    }
}
