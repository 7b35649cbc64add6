package com.dwh.pipeline.orchestration;

import com.dwh.pipeline.domain.EntityFamily;

/**
 * 패밀리 체인 종료 결과
 *
 * @param output   Dimensional Assembly 결과 (SUCCEEDED 일 때만 non-null)
 * @param rowCount staging 에 기록된 행 수
 */
public record FamilyOutcome<T>(
        EntityFamily family,
        FamilyStatus status,
        T output,
        int rowCount,
        String detail
) {

    public static <T> FamilyOutcome<T> succeeded(EntityFamily family, T output, int rowCount) {
        return new FamilyOutcome<>(family, FamilyStatus.SUCCEEDED, output, rowCount, null);
    }

    public static <T> FamilyOutcome<T> stoppedAt(StageResult<?> result) {
        StageReport report = result.report();
        FamilyStatus status = switch (report.status()) {
            case CANCELLED -> FamilyStatus.CANCELLED;
            case BLOCKED -> FamilyStatus.BLOCKED;
            default -> FamilyStatus.FAILED;
        };
        return new FamilyOutcome<>(report.family(), status, null, 0,
                report.stage() + ": " + report.errorDetail());
    }

    public static <T> FamilyOutcome<T> crashed(EntityFamily family, Throwable error) {
        return new FamilyOutcome<>(family, FamilyStatus.FAILED, null, 0, String.valueOf(error));
    }

    public boolean succeeded() {
        return status == FamilyStatus.SUCCEEDED;
    }

    public FamilyOutcome<T> withStatus(FamilyStatus newStatus, String newDetail) {
        return new FamilyOutcome<>(family, newStatus, newStatus == FamilyStatus.SUCCEEDED ? output : null,
                rowCount, newDetail);
    }

    /**
     * 중간 결과 타입을 버리고 상태만 옮깁니다 (성공하지 못한 결과 전용).
     */
    public <R> FamilyOutcome<R> stopped() {
        if (succeeded()) {
            throw new IllegalStateException(family + " succeeded, its output cannot be dropped");
        }
        return new FamilyOutcome<>(family, status, null, rowCount, detail);
    }
}
