package com.dwh.pipeline.domain;

import java.util.Map;

/**
 * Raw Store 의 한 행 (추출된 문자열 그대로)
 *
 * rowOffset 은 Raw Store 에서 읽힌 순서이며, dedup tie-break 에 사용됩니다.
 */
public record RawRecord(
        String table,
        long rowOffset,
        Map<String, String> fields
) {

    public RawRecord {
        fields = Map.copyOf(fields);
    }

    public String get(String column) {
        return fields.get(column);
    }
}
