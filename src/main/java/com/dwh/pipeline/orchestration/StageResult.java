package com.dwh.pipeline.orchestration;

/**
 * Stage 실행 결과 값. 예외 대신 이 값으로 성공/실패가 체인에 전달됩니다.
 *
 * @param output 성공했을 때만 non-null
 */
public record StageResult<T>(
        StageReport report,
        T output
) {

    public boolean succeeded() {
        return report.status() == StageStatus.SUCCEEDED;
    }

    public StageStatus status() {
        return report.status();
    }
}
