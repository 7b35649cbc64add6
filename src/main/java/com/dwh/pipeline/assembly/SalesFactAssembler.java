package com.dwh.pipeline.assembly;

import com.dwh.pipeline.cleansing.SalesCleanser;
import com.dwh.pipeline.domain.CustomerDimension;
import com.dwh.pipeline.domain.ProductDimension;
import com.dwh.pipeline.domain.SalesFact;
import com.dwh.pipeline.domain.SalesLineRecord;
import com.dwh.pipeline.exception.ErrorKind;
import com.dwh.pipeline.quality.StageIssues;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * fact_sales 조립
 * <p>
 * 판매 라인 1건 = fact 1행. lookup 에 실패한 참조는 {@link SalesFact#UNRESOLVED} 로 남기고 경고를 기록합니다.
 */
@Component
public class SalesFactAssembler {

    public List<SalesFact> assemble(List<SalesLineRecord> lines,
                                    List<CustomerDimension> customers,
                                    List<ProductDimension> products,
                                    StageIssues issues) {
        Map<Integer, Integer> customerKeys = new HashMap<>();
        customers.forEach(c -> customerKeys.put(c.customerId(), c.customerKey()));
        Map<String, Integer> productKeys = new HashMap<>();
        products.forEach(p -> productKeys.put(p.productNumber(), p.productKey()));

        List<SalesFact> facts = new ArrayList<>(lines.size());
        for (SalesLineRecord line : lines) {
            Integer productKey = line.productNumber() == null ? null : productKeys.get(line.productNumber());
            if (productKey == null) {
                issues.warning(SalesCleanser.TABLE, line.lineKey(), "lookup:product_key", ErrorKind.REFERENTIAL,
                        "product '" + line.productNumber() + "' not found in " + ProductDimensionAssembler.ENTITY);
            }
            Integer customerKey = line.customerId() == null ? null : customerKeys.get(line.customerId());
            if (customerKey == null) {
                issues.warning(SalesCleanser.TABLE, line.lineKey(), "lookup:customer_key", ErrorKind.REFERENTIAL,
                        "customer '" + line.customerId() + "' not found in " + CustomerDimensionAssembler.ENTITY);
            }
            facts.add(new SalesFact(
                    line.orderNumber(),
                    productKey == null ? SalesFact.UNRESOLVED : productKey,
                    customerKey == null ? SalesFact.UNRESOLVED : customerKey,
                    line.orderDate(),
                    line.shipDate(),
                    line.dueDate(),
                    line.amount(),
                    line.quantity(),
                    line.price(),
                    line.reconciliationFailed()
            ));
        }
        return facts;
    }
}
