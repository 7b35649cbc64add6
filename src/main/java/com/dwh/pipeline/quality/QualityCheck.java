package com.dwh.pipeline.quality;

import java.util.List;
import java.util.function.Function;

/**
 * Stage 출력에 대한 사후 검증 규칙
 *
 * @param <T> Stage 출력 타입
 */
@FunctionalInterface
public interface QualityCheck<T> {

    void check(T output, StageIssues issues);

    default QualityCheck<T> and(QualityCheck<? super T> next) {
        return (output, issues) -> {
            check(output, issues);
            next.check(output, issues);
        };
    }

    /**
     * 복합 출력의 일부 행 목록에만 적용되는 검증으로 변환
     */
    static <T, R> QualityCheck<T> on(Function<T, List<R>> selector, QualityCheck<List<R>> rowCheck) {
        return (output, issues) -> rowCheck.check(selector.apply(output), issues);
    }

    static <T> QualityCheck<T> none() {
        return (output, issues) -> {
        };
    }
}
