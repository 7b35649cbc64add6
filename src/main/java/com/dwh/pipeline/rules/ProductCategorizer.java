package com.dwh.pipeline.rules;

import com.dwh.pipeline.cleansing.ProductCleanser;
import com.dwh.pipeline.domain.ProductRecord;
import com.dwh.pipeline.exception.ErrorKind;
import com.dwh.pipeline.quality.StageIssues;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 복합 상품 key 분해
 * <p>
 * {@code CO-RF-FR-R92B-58} → categoryId {@code CO_RF} (ERP 카테고리 id 형식), productNumber {@code FR-R92B-58}
 */
@Component
public class ProductCategorizer {

    private static final Pattern COMPOSITE_KEY = Pattern.compile("^[A-Z0-9]{2}-[A-Z0-9]{2}-.+$");
    private static final int CATEGORY_END = 5;
    private static final int NUMBER_START = 6;

    public List<ProductRecord> categorize(List<ProductRecord> products, StageIssues issues) {
        List<ProductRecord> result = new ArrayList<>(products.size());
        for (ProductRecord product : products) {
            String key = product.productKey();
            if (key == null || !COMPOSITE_KEY.matcher(key).matches()) {
                issues.warning(ProductCleanser.CRM_TABLE, product.productId(), "categorize:prd_key",
                        ErrorKind.FORMAT, "unparseable product key '" + key + "', category left null");
                result.add(product.withCategory(null, key));
                continue;
            }
            String categoryId = key.substring(0, CATEGORY_END).replace('-', '_');
            result.add(product.withCategory(categoryId, key.substring(NUMBER_START)));
        }
        return result;
    }
}
