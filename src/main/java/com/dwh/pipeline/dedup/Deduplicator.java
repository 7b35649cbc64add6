package com.dwh.pipeline.dedup;

import com.dwh.pipeline.exception.ErrorKind;
import com.dwh.pipeline.quality.StageIssues;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.ToLongFunction;

/**
 * Business key 별로 가장 최신 버전 1건만 남기는 정렬 기반 dedup
 * <p>
 * 순위: recency 내림차순 (null 은 가장 낮은 순위) → rowOffset 내림차순 (나중에 적재된 행 우선).
 * 그룹 내 정렬이므로 그룹당 O(n log n) 입니다.
 * business key 가 null 인 행은 어떤 key 에도 속할 수 없으므로 제외하고 경고를 남깁니다.
 *
 * @param <T> 레코드 타입
 * @param <K> business key 타입
 */
public final class Deduplicator<T, K> {

    private final String entity;
    private final Function<T, K> businessKey;
    private final Comparator<T> rank;

    private Deduplicator(String entity, Function<T, K> businessKey, Comparator<T> rank) {
        this.entity = entity;
        this.businessKey = businessKey;
        this.rank = rank;
    }

    /**
     * @param recency recency 값 추출 함수. recency 가 없는 엔티티는 {@code r -> null}
     */
    public static <T, K, C extends Comparable<? super C>> Deduplicator<T, K> of(String entity,
                                                                             Function<T, K> businessKey,
                                                                             Function<T, C> recency,
                                                                             ToLongFunction<T> rowOffset) {
        Comparator<T> rank = Comparator
                .comparing(recency, Comparator.nullsLast(Comparator.<C>reverseOrder()))
                .thenComparing(Comparator.comparingLong(rowOffset).reversed());
        return new Deduplicator<>(entity, businessKey, rank);
    }

    public List<T> deduplicate(List<T> records, StageIssues issues) {
        Map<K, List<T>> groups = new LinkedHashMap<>();
        for (T record : records) {
            K key = businessKey.apply(record);
            if (key == null) {
                issues.warning(entity, null, "dedup:business-key", ErrorKind.FORMAT,
                        "record without business key excluded: " + record);
                continue;
            }
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
        }

        List<T> survivors = new ArrayList<>(groups.size());
        for (List<T> group : groups.values()) {
            if (group.size() > 1) {
                group.sort(rank);
            }
            survivors.add(group.get(0));
        }
        return survivors;
    }
}
