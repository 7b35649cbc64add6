package com.dwh.pipeline.dedup;

import com.dwh.pipeline.cleansing.CustomerCleanser;
import com.dwh.pipeline.domain.CustomerRecord;
import com.dwh.pipeline.domain.ErpCustomerRecord;
import com.dwh.pipeline.domain.code.Gender;
import com.dwh.pipeline.exception.ErrorKind;
import com.dwh.pipeline.quality.StageIssues;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * CRM(primary) / ERP(secondary) 간 겹치는 고객 속성 조정
 * <p>
 * 입력은 이미 dedup 된 목록이어야 합니다. 매칭 key 는 CRM cst_key = ERP cid 입니다.
 */
@Component
public class CustomerReconciler {

    static final SourcePreference<Gender> GENDER =
            SourcePreference.primaryThenSecondary("gender", g -> !g.isKnown());

    public List<CustomerRecord> reconcile(List<CustomerRecord> customers,
                                          List<ErpCustomerRecord> erpCustomers,
                                          StageIssues issues) {
        Map<String, ErpCustomerRecord> erpByNumber = new HashMap<>();
        for (ErpCustomerRecord erp : erpCustomers) {
            erpByNumber.put(erp.customerNumber(), erp);
        }

        List<CustomerRecord> result = new ArrayList<>(customers.size());
        for (CustomerRecord customer : customers) {
            if (customer.customerNumber() == null) {
                issues.warning(CustomerCleanser.CRM_TABLE, customer.customerId(), "required:cst_key",
                        ErrorKind.FORMAT, "no candidate value for customer number");
            }

            ErpCustomerRecord erp = customer.customerNumber() == null ? null : erpByNumber.get(customer.customerNumber());
            Gender secondary = erp == null ? null : erp.gender();
            Gender resolved = GENDER.resolve(customer.gender(), secondary);
            if (resolved != customer.gender()) {
                issues.info(CustomerCleanser.CRM_TABLE, customer.customerId(), "reconcile:" + GENDER.attribute(),
                        ErrorKind.CONSISTENCY, resolved == null
                                ? "gender unknown in both sources"
                                : "gender taken from " + CustomerCleanser.ERP_TABLE);
            }
            result.add(customer.withGender(resolved));
        }
        return result;
    }
}
