package com.dwh.pipeline.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 판매 라인 레코드 (crm_sales_details). Grain = 원본 판매 라인 1건.
 *
 * reconciliationFailed 가 true 이면 금액 재계산이 불가능한 행입니다 (quantity 0 등).
 */
public record SalesLineRecord(
        long rowOffset,
        String orderNumber,
        String productNumber,
        Integer customerId,
        LocalDate orderDate,
        LocalDate shipDate,
        LocalDate dueDate,
        BigDecimal amount,
        Integer quantity,
        BigDecimal price,
        boolean reconciliationFailed
) {

    public SalesLineRecord withMeasures(BigDecimal newAmount, BigDecimal newPrice, boolean failed) {
        return new SalesLineRecord(rowOffset, orderNumber, productNumber, customerId,
                orderDate, shipDate, dueDate, newAmount, quantity, newPrice, failed);
    }

    public String lineKey() {
        return orderNumber + "#" + rowOffset;
    }
}
