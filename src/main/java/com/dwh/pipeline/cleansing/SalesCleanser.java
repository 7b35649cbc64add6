package com.dwh.pipeline.cleansing;

import com.dwh.pipeline.cleansing.FieldNormalizer.Field;
import com.dwh.pipeline.domain.RawRecord;
import com.dwh.pipeline.domain.RawTable;
import com.dwh.pipeline.domain.SalesLineRecord;
import com.dwh.pipeline.quality.StageIssues;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 판매 라인 Cleansing (crm_sales_details)
 * <p>
 * 날짜는 yyyyMMdd 정수 코드로 들어오며 0 또는 8자리가 아닌 값은 null 처리합니다.
 */
@Component
@RequiredArgsConstructor
public class SalesCleanser {

    public static final String TABLE = "crm_sales_details";

    private final FieldNormalizer normalizer;

    public List<SalesLineRecord> cleanse(RawTable table, StageIssues issues) {
        table.requireColumns("sls_ord_num", "sls_prd_key", "sls_cust_id", "sls_order_dt",
                "sls_ship_dt", "sls_due_dt", "sls_sales", "sls_quantity", "sls_price");

        List<SalesLineRecord> result = new ArrayList<>(table.size());
        for (RawRecord row : table.rows()) {
            String orderNumber = normalizer.text(row.get("sls_ord_num"));
            String key = orderNumber + "#" + row.rowOffset();
            result.add(new SalesLineRecord(
                    row.rowOffset(),
                    orderNumber,
                    normalizer.text(row.get("sls_prd_key")),
                    normalizer.integer(row.get("sls_cust_id"), new Field(TABLE, key, "sls_cust_id"), issues),
                    normalizer.compactDate(row.get("sls_order_dt"), new Field(TABLE, key, "sls_order_dt"), issues),
                    normalizer.compactDate(row.get("sls_ship_dt"), new Field(TABLE, key, "sls_ship_dt"), issues),
                    normalizer.compactDate(row.get("sls_due_dt"), new Field(TABLE, key, "sls_due_dt"), issues),
                    normalizer.decimal(row.get("sls_sales"), new Field(TABLE, key, "sls_sales"), issues),
                    normalizer.integer(row.get("sls_quantity"), new Field(TABLE, key, "sls_quantity"), issues),
                    normalizer.decimal(row.get("sls_price"), new Field(TABLE, key, "sls_price"), issues),
                    false
            ));
        }
        return result;
    }
}
