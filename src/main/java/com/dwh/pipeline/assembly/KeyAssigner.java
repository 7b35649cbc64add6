package com.dwh.pipeline.assembly;

import java.util.List;
import java.util.Map;

/**
 * Surrogate key 할당 전략
 */
public interface KeyAssigner {

    /**
     * @param entityType          dimension 이름 (key 공간 구분)
     * @param orderedBusinessKeys 결정적 순서로 정렬된, 중복 없는 business key 목록
     * @return business key → surrogate key (entityType 안에서 유일)
     */
    Map<String, Integer> assign(String entityType, List<String> orderedBusinessKeys);
}
