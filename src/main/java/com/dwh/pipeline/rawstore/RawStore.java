package com.dwh.pipeline.rawstore;

import com.dwh.pipeline.domain.RawTable;

/**
 * 이미 적재된 원본 테이블을 읽는 외부 협력자
 */
public interface RawStore {

    /**
     * @throws com.dwh.pipeline.exception.StructuralException 테이블이 없을 때
     */
    RawTable read(String table);
}
