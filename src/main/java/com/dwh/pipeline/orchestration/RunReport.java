package com.dwh.pipeline.orchestration;

import com.dwh.pipeline.domain.EntityFamily;
import com.dwh.pipeline.quality.QualityIssue;
import com.dwh.pipeline.quality.Severity;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Run 1회의 결과 요약 (패밀리 상태, stage 기록, 행 수, 전체 issue 목록)
 */
public record RunReport(
        String runId,
        Instant startedAt,
        Instant finishedAt,
        Map<EntityFamily, FamilyStatus> familyStatuses,
        Map<EntityFamily, Integer> rowCounts,
        List<StageReport> stages,
        Map<Severity, Long> issueTotals,
        List<QualityIssue> issues
) {

    public RunReport {
        familyStatuses = Map.copyOf(familyStatuses);
        rowCounts = Map.copyOf(rowCounts);
        stages = List.copyOf(stages);
        issueTotals = Map.copyOf(issueTotals);
        issues = List.copyOf(issues);
    }

    public boolean succeeded() {
        return familyStatuses.values().stream().allMatch(status -> status == FamilyStatus.SUCCEEDED);
    }

    public FamilyStatus statusOf(EntityFamily family) {
        return familyStatuses.get(family);
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }

    public long issueCount(Severity severity) {
        return issueTotals.getOrDefault(severity, 0L);
    }

    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append("run=").append(runId)
                .append(" duration=").append(duration().toMillis()).append("ms")
                .append(" issues[info=").append(issueCount(Severity.INFO))
                .append(", warning=").append(issueCount(Severity.WARNING))
                .append(", fatal=").append(issueCount(Severity.FATAL)).append("]");
        for (EntityFamily family : EntityFamily.values()) {
            sb.append(System.lineSeparator())
                    .append("  ").append(family).append(": ").append(familyStatuses.get(family))
                    .append(" rows=").append(rowCounts.getOrDefault(family, 0));
            for (StageReport stage : stages) {
                if (stage.family() == family) {
                    sb.append(System.lineSeparator())
                            .append("    - ").append(stage.stage()).append(' ').append(stage.status())
                            .append(' ').append(stage.elapsed().toMillis()).append("ms")
                            .append(" issues=").append(stage.issueCount());
                    if (stage.errorDetail() != null) {
                        sb.append(" (").append(stage.errorDetail()).append(')');
                    }
                }
            }
        }
        return sb.toString();
    }
}
