package com.dwh.pipeline.domain;

import com.dwh.pipeline.domain.code.ProductLine;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * CRM 상품 버전 레코드 (crm_prd_info)
 *
 * categoryId, productNumber, endDate 는 Business Rule 단계에서 채워집니다.
 */
public record ProductRecord(
        long rowOffset,
        Integer productId,
        String productKey,
        String productName,
        BigDecimal cost,
        ProductLine productLine,
        LocalDate startDate,
        String categoryId,
        String productNumber,
        LocalDate endDate
) {

    public ProductRecord withCategory(String derivedCategoryId, String derivedProductNumber) {
        return new ProductRecord(rowOffset, productId, productKey, productName, cost, productLine,
                startDate, derivedCategoryId, derivedProductNumber, endDate);
    }

    public ProductRecord withEndDate(LocalDate derivedEndDate) {
        return new ProductRecord(rowOffset, productId, productKey, productName, cost, productLine,
                startDate, categoryId, productNumber, derivedEndDate);
    }

    public boolean isCurrent() {
        return endDate == null;
    }
}
