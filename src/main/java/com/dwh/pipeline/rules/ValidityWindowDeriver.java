package com.dwh.pipeline.rules;

import com.dwh.pipeline.cleansing.ProductCleanser;
import com.dwh.pipeline.domain.ProductRecord;
import com.dwh.pipeline.exception.ErrorKind;
import com.dwh.pipeline.quality.StageIssues;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 상품 버전별 유효기간 계산
 * <p>
 * 같은 productNumber 의 버전들을 시작일 순으로 정렬한 뒤, 각 버전의 종료일 = 다음 버전 시작일 - 1일.
 * 마지막 버전의 종료일은 null (현재 버전) 입니다.
 */
@Component
public class ValidityWindowDeriver {

    private static final Comparator<ProductRecord> VERSION_ORDER = Comparator
            .comparing(ProductRecord::startDate)
            .thenComparingLong(ProductRecord::rowOffset);

    public List<ProductRecord> derive(List<ProductRecord> products, StageIssues issues) {
        Map<String, List<ProductRecord>> versions = new LinkedHashMap<>();
        for (ProductRecord product : products) {
            if (product.startDate() == null) {
                issues.warning(ProductCleanser.CRM_TABLE, product.productId(), "validity:prd_start_dt",
                        ErrorKind.FORMAT, "version without start date cannot be placed in a validity window");
                continue;
            }
            if (product.productNumber() == null) {
                issues.warning(ProductCleanser.CRM_TABLE, product.productId(), "required:prd_key",
                        ErrorKind.FORMAT, "no candidate value for product number");
                continue;
            }
            versions.computeIfAbsent(product.productNumber(), k -> new ArrayList<>()).add(product);
        }

        List<ProductRecord> result = new ArrayList<>(products.size());
        for (List<ProductRecord> history : versions.values()) {
            history.sort(VERSION_ORDER);
            for (int i = 0; i < history.size(); i++) {
                ProductRecord next = i + 1 < history.size() ? history.get(i + 1) : null;
                result.add(history.get(i).withEndDate(next == null ? null : next.startDate().minusDays(1)));
            }
        }
        return result;
    }

    /**
     * 종료일이 열려 있는 (현재) 버전만
     */
    public List<ProductRecord> current(List<ProductRecord> versions) {
        List<ProductRecord> result = new ArrayList<>();
        for (ProductRecord version : versions) {
            if (version.isCurrent()) {
                result.add(version);
            }
        }
        return result;
    }
}
