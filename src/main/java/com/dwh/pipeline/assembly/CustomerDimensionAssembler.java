package com.dwh.pipeline.assembly;

import com.dwh.pipeline.domain.CustomerDimension;
import com.dwh.pipeline.domain.CustomerRecord;
import com.dwh.pipeline.domain.ErpCustomerRecord;
import com.dwh.pipeline.domain.ErpLocationRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * dim_customers 조립
 * <p>
 * key 순서: customerId 오름차순. ERP 생년월일/국가는 customerNumber 기준 left join 입니다.
 */
@Component
@RequiredArgsConstructor
public class CustomerDimensionAssembler {

    public static final String ENTITY = "dim_customers";

    private final KeyAssigner keyAssigner;

    public List<CustomerDimension> assemble(List<CustomerRecord> customers,
                                            List<ErpCustomerRecord> erpCustomers,
                                            List<ErpLocationRecord> locations) {
        List<CustomerRecord> ordered = new ArrayList<>(customers);
        ordered.sort(Comparator.comparing(CustomerRecord::customerId));

        List<String> businessKeys = ordered.stream().map(c -> String.valueOf(c.customerId())).toList();
        Map<String, Integer> keys = keyAssigner.assign(ENTITY, businessKeys);

        Map<String, ErpCustomerRecord> erpByNumber = new HashMap<>();
        erpCustomers.forEach(e -> erpByNumber.put(e.customerNumber(), e));
        Map<String, ErpLocationRecord> locationByNumber = new HashMap<>();
        locations.forEach(l -> locationByNumber.put(l.customerNumber(), l));

        List<CustomerDimension> rows = new ArrayList<>(ordered.size());
        for (CustomerRecord customer : ordered) {
            ErpCustomerRecord erp = customer.customerNumber() == null ? null : erpByNumber.get(customer.customerNumber());
            ErpLocationRecord location = customer.customerNumber() == null ? null : locationByNumber.get(customer.customerNumber());
            rows.add(new CustomerDimension(
                    keys.get(String.valueOf(customer.customerId())),
                    customer.customerId(),
                    customer.customerNumber(),
                    customer.firstName(),
                    customer.lastName(),
                    location == null ? null : location.country().label(),
                    customer.maritalStatus().label(),
                    customer.gender() == null ? null : customer.gender().label(),
                    erp == null ? null : erp.birthDate(),
                    customer.createDate()
            ));
        }
        return rows;
    }
}
