package com.dwh.pipeline.quality;

import com.dwh.pipeline.domain.EntityFamily;
import com.dwh.pipeline.exception.ErrorKind;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 특정 (패밀리, Stage) 에 바인딩된 QualityIssue 기록기
 */
public class StageIssues {

    private final QualityIssueLog log;
    private final EntityFamily family;
    private final String stage;
    private final AtomicInteger count = new AtomicInteger();
    private final AtomicBoolean fatal = new AtomicBoolean();

    StageIssues(QualityIssueLog log, EntityFamily family, String stage) {
        this.log = log;
        this.family = family;
        this.stage = stage;
    }

    public void info(String entity, Object businessKey, String rule, ErrorKind kind, String message) {
        record(entity, businessKey, rule, Severity.INFO, kind, message);
    }

    public void warning(String entity, Object businessKey, String rule, ErrorKind kind, String message) {
        record(entity, businessKey, rule, Severity.WARNING, kind, message);
    }

    public void fatal(String entity, Object businessKey, String rule, ErrorKind kind, String message) {
        record(entity, businessKey, rule, Severity.FATAL, kind, message);
    }

    public void record(String entity, Object businessKey, String rule, Severity severity, ErrorKind kind, String message) {
        log.append(new QualityIssue(family, stage, entity, businessKey == null ? null : String.valueOf(businessKey),
                rule, severity, kind, message));
        count.incrementAndGet();
        if (severity == Severity.FATAL) {
            fatal.set(true);
        }
    }

    public int count() {
        return count.get();
    }

    public boolean hasFatal() {
        return fatal.get();
    }

    public EntityFamily family() {
        return family;
    }

    public String stage() {
        return stage;
    }
}
