package com.dwh.pipeline.cleansing;

import com.dwh.pipeline.cleansing.FieldNormalizer.Field;
import com.dwh.pipeline.domain.ProductCategoryRecord;
import com.dwh.pipeline.domain.ProductRecord;
import com.dwh.pipeline.domain.RawRecord;
import com.dwh.pipeline.domain.RawTable;
import com.dwh.pipeline.domain.code.ProductLine;
import com.dwh.pipeline.exception.ErrorKind;
import com.dwh.pipeline.quality.StageIssues;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * 상품 패밀리 Cleansing (crm_prd_info, erp_px_cat_g1v2)
 * <p>
 * 원본 prd_end_dt 는 신뢰하지 않으며 Business Rule 단계에서 validity window 로 재계산합니다.
 */
@Component
@RequiredArgsConstructor
public class ProductCleanser {

    public static final String CRM_TABLE = "crm_prd_info";
    public static final String CATEGORY_TABLE = "erp_px_cat_g1v2";

    private final FieldNormalizer normalizer;

    public List<ProductRecord> cleanseCrm(RawTable table, StageIssues issues) {
        table.requireColumns("prd_id", "prd_key", "prd_nm", "prd_cost", "prd_line", "prd_start_dt");

        List<ProductRecord> result = new ArrayList<>(table.size());
        for (RawRecord row : table.rows()) {
            String key = normalizer.text(row.get("prd_id"));
            BigDecimal cost = normalizer.decimal(row.get("prd_cost"), new Field(CRM_TABLE, key, "prd_cost"), issues);
            if (cost == null) {
                issues.info(CRM_TABLE, key, "default:prd_cost", ErrorKind.FORMAT, "absent cost replaced by 0");
                cost = BigDecimal.ZERO;
            }
            result.add(new ProductRecord(
                    row.rowOffset(),
                    normalizer.integer(row.get("prd_id"), new Field(CRM_TABLE, key, "prd_id"), issues),
                    normalizer.text(row.get("prd_key")),
                    normalizer.text(row.get("prd_nm")),
                    cost,
                    normalizer.code(ProductLine.TABLE, row.get("prd_line"), new Field(CRM_TABLE, key, "prd_line"), issues),
                    normalizer.isoDate(row.get("prd_start_dt"), new Field(CRM_TABLE, key, "prd_start_dt"), issues),
                    null,
                    null,
                    null
            ));
        }
        return result;
    }

    public List<ProductCategoryRecord> cleanseCategories(RawTable table, StageIssues issues) {
        table.requireColumns("id", "cat", "subcat", "maintenance");

        List<ProductCategoryRecord> result = new ArrayList<>(table.size());
        for (RawRecord row : table.rows()) {
            result.add(new ProductCategoryRecord(
                    row.rowOffset(),
                    normalizer.text(row.get("id")),
                    normalizer.text(row.get("cat")),
                    normalizer.text(row.get("subcat")),
                    normalizer.text(row.get("maintenance"))
            ));
        }
        return result;
    }
}
