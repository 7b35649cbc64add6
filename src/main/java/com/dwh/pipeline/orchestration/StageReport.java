package com.dwh.pipeline.orchestration;

import com.dwh.pipeline.domain.EntityFamily;

import java.time.Duration;

/**
 * Stage 1회 실행 기록
 */
public record StageReport(
        EntityFamily family,
        String stage,
        StageStatus status,
        Duration elapsed,
        int issueCount,
        String errorDetail
) {
}
