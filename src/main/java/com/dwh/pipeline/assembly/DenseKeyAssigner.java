package com.dwh.pipeline.assembly;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * run 마다 1..n dense key 를 다시 계산합니다.
 * business key 집합이 바뀌면 run 간 key 가 달라질 수 있습니다.
 */
public class DenseKeyAssigner implements KeyAssigner {

    @Override
    public Map<String, Integer> assign(String entityType, List<String> orderedBusinessKeys) {
        Map<String, Integer> keys = new LinkedHashMap<>();
        int next = 1;
        for (String businessKey : orderedBusinessKeys) {
            if (keys.putIfAbsent(businessKey, next) == null) {
                next++;
            }
        }
        return keys;
    }
}
