package com.dwh.pipeline.domain;

import com.dwh.pipeline.exception.StructuralException;

import java.util.List;

/**
 * Raw Store 테이블 스냅샷 (컬럼 목록 + 행)
 */
public record RawTable(
        String name,
        List<String> columns,
        List<RawRecord> rows
) {

    public RawTable {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    /**
     * 필수 컬럼 검증. 하나라도 없으면 해당 패밀리 체인을 중단시키는 구조적 오류입니다.
     */
    public RawTable requireColumns(String... required) {
        for (String column : required) {
            if (!columns.contains(column)) {
                throw new StructuralException(
                        "Required column '" + column + "' is missing from raw table '" + name + "'");
            }
        }
        return this;
    }

    public int size() {
        return rows.size();
    }
}
