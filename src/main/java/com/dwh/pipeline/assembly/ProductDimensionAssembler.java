package com.dwh.pipeline.assembly;

import com.dwh.pipeline.domain.ProductCategoryRecord;
import com.dwh.pipeline.domain.ProductDimension;
import com.dwh.pipeline.domain.ProductRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * dim_products 조립 (현재 버전만 입력으로 받습니다)
 * <p>
 * key 순서: 시작일, productNumber. ERP 카테고리는 categoryId 기준 left join 입니다.
 */
@Component
@RequiredArgsConstructor
public class ProductDimensionAssembler {

    public static final String ENTITY = "dim_products";

    private final KeyAssigner keyAssigner;

    public List<ProductDimension> assemble(List<ProductRecord> currentProducts,
                                           List<ProductCategoryRecord> categories) {
        List<ProductRecord> ordered = new ArrayList<>(currentProducts);
        ordered.sort(Comparator.comparing(ProductRecord::startDate)
                .thenComparing(ProductRecord::productNumber));

        Map<String, Integer> keys = keyAssigner.assign(ENTITY,
                ordered.stream().map(ProductRecord::productNumber).toList());

        Map<String, ProductCategoryRecord> categoryById = new HashMap<>();
        categories.forEach(c -> categoryById.put(c.categoryId(), c));

        List<ProductDimension> rows = new ArrayList<>(ordered.size());
        for (ProductRecord product : ordered) {
            ProductCategoryRecord category = product.categoryId() == null ? null : categoryById.get(product.categoryId());
            rows.add(new ProductDimension(
                    keys.get(product.productNumber()),
                    product.productId(),
                    product.productNumber(),
                    product.productName(),
                    product.categoryId(),
                    category == null ? null : category.category(),
                    category == null ? null : category.subcategory(),
                    category == null ? null : category.maintenance(),
                    product.cost(),
                    product.productLine().label(),
                    product.startDate()
            ));
        }
        return rows;
    }
}
