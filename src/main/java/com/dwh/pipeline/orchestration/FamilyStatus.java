package com.dwh.pipeline.orchestration;

/**
 * 엔티티 패밀리 체인의 최종 상태. SUCCEEDED 이외의 값은 모두 run 실패로 취급합니다.
 */
public enum FamilyStatus {
    SUCCEEDED,
    FAILED,
    BLOCKED,
    CANCELLED
}
