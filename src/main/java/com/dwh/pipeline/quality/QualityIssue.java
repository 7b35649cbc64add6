package com.dwh.pipeline.quality;

import com.dwh.pipeline.domain.EntityFamily;
import com.dwh.pipeline.exception.ErrorKind;

/**
 * 한 run 안에서 기록되는 품질 위반 1건 (append-only)
 */
public record QualityIssue(
        EntityFamily family,
        String stage,
        String entity,
        String businessKey,
        String rule,
        Severity severity,
        ErrorKind kind,
        String message
) {

    @Override
    public String toString() {
        return "[" + severity + "] " + family + "/" + stage + " " + entity + "(" + businessKey + ") "
                + rule + ": " + message;
    }
}
