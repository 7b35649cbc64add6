package com.dwh.pipeline.quality;

import com.dwh.pipeline.domain.EntityFamily;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Run 단위 QualityIssue 저장소
 * <p>
 * 패밀리 체인들이 병렬로 기록하므로 모든 접근은 동기화됩니다. 삭제 연산은 제공하지 않습니다.
 */
public class QualityIssueLog {

    private final List<QualityIssue> issues = new ArrayList<>();

    public StageIssues forStage(EntityFamily family, String stage) {
        return new StageIssues(this, family, stage);
    }

    synchronized void append(QualityIssue issue) {
        issues.add(issue);
    }

    public synchronized List<QualityIssue> snapshot() {
        return List.copyOf(issues);
    }

    public synchronized int size() {
        return issues.size();
    }

    public synchronized Map<Severity, Long> countBySeverity() {
        Map<Severity, Long> counts = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            counts.put(severity, 0L);
        }
        for (QualityIssue issue : issues) {
            counts.merge(issue.severity(), 1L, Long::sum);
        }
        return counts;
    }
}
