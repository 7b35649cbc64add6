package com.dwh.pipeline.domain;

/**
 * ERP 상품 카테고리 레코드 (erp_px_cat_g1v2)
 */
public record ProductCategoryRecord(
        long rowOffset,
        String categoryId,
        String category,
        String subcategory,
        String maintenance
) {
}
