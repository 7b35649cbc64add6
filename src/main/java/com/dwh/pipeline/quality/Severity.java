package com.dwh.pipeline.quality;

public enum Severity {
    INFO,
    WARNING,
    /**
     * 구조적 위반. 해당 Stage 를 중단시킵니다.
     */
    FATAL
}
