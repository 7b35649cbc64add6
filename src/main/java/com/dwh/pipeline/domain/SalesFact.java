package com.dwh.pipeline.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * fact_sales 행
 *
 * Dimension lookup 에 실패한 참조는 {@link #UNRESOLVED} 로 남기고 행 자체는 유지합니다.
 */
public record SalesFact(
        String orderNumber,
        int productKey,
        int customerKey,
        LocalDate orderDate,
        LocalDate shipDate,
        LocalDate dueDate,
        BigDecimal amount,
        Integer quantity,
        BigDecimal price,
        boolean reconciliationFailed
) {

    public static final int UNRESOLVED = -1;

    public boolean productResolved() {
        return productKey != UNRESOLVED;
    }

    public boolean customerResolved() {
        return customerKey != UNRESOLVED;
    }
}
