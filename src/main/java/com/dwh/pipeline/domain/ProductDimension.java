package com.dwh.pipeline.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * dim_products 행 (현재 버전만)
 */
public record ProductDimension(
        int productKey,
        int productId,
        String productNumber,
        String productName,
        String categoryId,
        String category,
        String subcategory,
        String maintenance,
        BigDecimal cost,
        String productLine,
        LocalDate startDate
) {
}
