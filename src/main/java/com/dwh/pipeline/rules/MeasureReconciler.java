package com.dwh.pipeline.rules;

import com.dwh.pipeline.cleansing.SalesCleanser;
import com.dwh.pipeline.domain.SalesLineRecord;
import com.dwh.pipeline.exception.ErrorKind;
import com.dwh.pipeline.quality.StageIssues;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * 판매 측정값 보정 (amount = quantity * |price|)
 * <p>
 * 1. quantity 가 null 또는 0 → 보정 불가 플래그 (나눗셈 하지 않음)
 * 2. price 가 null 또는 0 이고 amount 가 있으면 → price = amount / quantity (amount 부호 유지)
 * 3. amount 가 null, 0 이하 또는 quantity * |price| 와 다르면 → amount 재계산
 * <p>
 * price 와 amount 가 둘 다 없으면 보정할 근거가 없으므로 플래그만 남깁니다.
 */
@Component
public class MeasureReconciler {

    private static final int PRICE_SCALE = 2;

    public List<SalesLineRecord> reconcile(List<SalesLineRecord> lines, StageIssues issues) {
        List<SalesLineRecord> result = new ArrayList<>(lines.size());
        for (SalesLineRecord line : lines) {
            result.add(reconcile(line, issues));
        }
        return result;
    }

    SalesLineRecord reconcile(SalesLineRecord line, StageIssues issues) {
        Integer quantity = line.quantity();
        BigDecimal amount = line.amount();
        BigDecimal price = line.price();

        if (quantity == null || quantity == 0) {
            issues.warning(SalesCleanser.TABLE, line.lineKey(), "reconcile:quantity", ErrorKind.CONSISTENCY,
                    "quantity is " + quantity + ", measures cannot be reconciled");
            return line.withMeasures(amount, price, true);
        }

        if (price == null || price.signum() == 0) {
            if (amount == null) {
                issues.warning(SalesCleanser.TABLE, line.lineKey(), "reconcile:price", ErrorKind.CONSISTENCY,
                        "price is " + price + " and amount is absent, measures cannot be reconciled");
                return line.withMeasures(amount, price, true);
            }
            price = amount.divide(BigDecimal.valueOf(quantity), PRICE_SCALE, RoundingMode.HALF_UP);
            issues.info(SalesCleanser.TABLE, line.lineKey(), "reconcile:price", ErrorKind.CONSISTENCY,
                    "price derived as amount/quantity = " + price);
        }

        BigDecimal expected = price.abs().multiply(BigDecimal.valueOf(quantity));
        if (amount == null || amount.signum() < 0 || amount.compareTo(expected) != 0) {
            issues.info(SalesCleanser.TABLE, line.lineKey(), "reconcile:amount", ErrorKind.CONSISTENCY,
                    "amount " + amount + " recomputed as quantity*|price| = " + expected);
            amount = expected;
        }
        return line.withMeasures(amount, price, false);
    }
}
