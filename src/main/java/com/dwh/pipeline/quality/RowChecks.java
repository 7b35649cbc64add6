package com.dwh.pipeline.quality;

import com.dwh.pipeline.exception.ErrorKind;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * 행 목록에 적용하는 표준 검증 규칙 모음
 * <p>
 * - unique: key 유일성
 * - required: 필수 필드 non-null
 * - consistentMeasures: amount == quantity * |price|
 * - references: fact 참조 key 가 dimension key 집합에 존재하는지
 * - ordered: 날짜 선후 관계
 */
public final class RowChecks {

    private RowChecks() {
    }

    public static <R> QualityCheck<List<R>> unique(String entity, String column,
                                                   Function<R, ?> key, Severity severity) {
        return (rows, issues) -> {
            Set<Object> seen = new HashSet<>();
            for (R row : rows) {
                Object value = key.apply(row);
                if (value != null && !seen.add(value)) {
                    issues.record(entity, value, "unique:" + column, severity,
                            severity == Severity.FATAL ? ErrorKind.STRUCTURAL : ErrorKind.DUPLICATE,
                            "Duplicate " + column + " value " + value);
                }
            }
        };
    }

    public static <R> QualityCheck<List<R>> required(String entity, String column,
                                                     Function<R, ?> key, Function<R, ?> field,
                                                     Severity severity) {
        return (rows, issues) -> {
            for (R row : rows) {
                if (field.apply(row) == null) {
                    issues.record(entity, key.apply(row), "required:" + column, severity, ErrorKind.FORMAT,
                            column + " is null");
                }
            }
        };
    }

    /**
     * amount == quantity * |price| (scale 무시 비교). skip 조건에 해당하는 행은 검사하지 않습니다.
     */
    public static <R> QualityCheck<List<R>> consistentMeasures(String entity,
                                                               Function<R, ?> key,
                                                               Function<R, BigDecimal> amount,
                                                               Function<R, Integer> quantity,
                                                               Function<R, BigDecimal> price,
                                                               Predicate<R> skip,
                                                               Severity severity) {
        return (rows, issues) -> {
            for (R row : rows) {
                if (skip.test(row)) {
                    continue;
                }
                BigDecimal a = amount.apply(row);
                Integer q = quantity.apply(row);
                BigDecimal p = price.apply(row);
                if (a == null || q == null || p == null
                        || a.compareTo(p.abs().multiply(BigDecimal.valueOf(q))) != 0) {
                    issues.record(entity, key.apply(row), "measures:amount=quantity*|price|", severity,
                            ErrorKind.CONSISTENCY,
                            "amount=" + a + ", quantity=" + q + ", price=" + p);
                }
            }
        };
    }

    /**
     * 참조 무결성. sentinel 값은 검사 대상에서 제외합니다 (미해결 참조는 별도 경고로 이미 기록됨).
     */
    public static <R> QualityCheck<List<R>> references(String entity, String column,
                                                       Function<R, ?> key,
                                                       Function<R, Integer> reference,
                                                       int sentinel,
                                                       Supplier<Set<Integer>> targetKeys,
                                                       Severity severity) {
        return (rows, issues) -> {
            Set<Integer> valid = targetKeys.get();
            for (R row : rows) {
                Integer ref = reference.apply(row);
                if (ref != null && ref != sentinel && !valid.contains(ref)) {
                    issues.record(entity, key.apply(row), "references:" + column, severity,
                            ErrorKind.REFERENTIAL,
                            column + "=" + ref + " does not exist in the dimension");
                }
            }
        };
    }

    public static <R> QualityCheck<List<R>> ordered(String entity, String rule,
                                                    Function<R, ?> key,
                                                    Function<R, LocalDate> earlier,
                                                    Function<R, LocalDate> later,
                                                    Severity severity) {
        return (rows, issues) -> {
            for (R row : rows) {
                LocalDate first = earlier.apply(row);
                LocalDate second = later.apply(row);
                if (first != null && second != null && first.isAfter(second)) {
                    issues.record(entity, key.apply(row), "ordered:" + rule, severity, ErrorKind.CONSISTENCY,
                            first + " is after " + second);
                }
            }
        };
    }
}
