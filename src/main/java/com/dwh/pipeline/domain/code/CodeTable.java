package com.dwh.pipeline.domain.code;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 코드 lookup 테이블
 * <p>
 * 인식할 수 없는 코드는 실패시키지 않고 fallback 값으로 대체합니다.
 * fallback 적용 여부에 대한 QualityIssue 기록은 호출하는 Cleanser 의 책임입니다.
 */
public final class CodeTable<E extends Enum<E> & CodedValue> {

    private final Map<String, E> byCode;
    private final E fallback;

    private CodeTable(Map<String, E> byCode, E fallback) {
        this.byCode = Collections.unmodifiableMap(byCode);
        this.fallback = fallback;
    }

    public static <E extends Enum<E> & CodedValue> CodeTable<E> of(Class<E> type, E fallback) {
        Map<String, E> byCode = new HashMap<>();
        for (E value : type.getEnumConstants()) {
            for (String code : value.codes()) {
                E previous = byCode.put(normalize(code), value);
                if (previous != null && previous != value) {
                    throw new IllegalStateException(
                            "Code '" + code + "' is mapped to both " + previous + " and " + value);
                }
            }
        }
        return new CodeTable<>(byCode, fallback);
    }

    public Optional<E> lookup(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byCode.get(normalize(code)));
    }

    public E fallback() {
        return fallback;
    }

    private static String normalize(String code) {
        return code.trim().toUpperCase(Locale.ROOT);
    }
}
