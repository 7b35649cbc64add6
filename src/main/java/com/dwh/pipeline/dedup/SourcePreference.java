package com.dwh.pipeline.dedup;

import java.util.function.Predicate;

/**
 * 속성 단위 소스 우선순위 규칙
 * <p>
 * primary 값이 unknown 이 아니면 primary, 아니면 secondary, 둘 다 unknown 이면 null.
 *
 * @param <V> 속성 값 타입
 */
public final class SourcePreference<V> {

    private final String attribute;
    private final Predicate<V> unknown;

    private SourcePreference(String attribute, Predicate<V> unknown) {
        this.attribute = attribute;
        this.unknown = unknown;
    }

    public static <V> SourcePreference<V> primaryThenSecondary(String attribute, Predicate<V> unknown) {
        return new SourcePreference<>(attribute, v -> v == null || unknown.test(v));
    }

    public V resolve(V primary, V secondary) {
        if (!unknown.test(primary)) {
            return primary;
        }
        if (!unknown.test(secondary)) {
            return secondary;
        }
        return null;
    }

    public String attribute() {
        return attribute;
    }
}
