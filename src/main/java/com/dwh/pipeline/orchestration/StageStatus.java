package com.dwh.pipeline.orchestration;

public enum StageStatus {
    SUCCEEDED,
    FAILED,
    CANCELLED,
    /**
     * 필요한 upstream 패밀리가 준비되지 않아 실행하지 않음
     */
    BLOCKED
}
