package com.dwh.pipeline.domain;

import com.dwh.pipeline.domain.code.Gender;
import com.dwh.pipeline.domain.code.MaritalStatus;

import java.time.LocalDate;

/**
 * Cleansing 이후의 CRM 고객 레코드 (crm_cust_info)
 *
 * Business key 는 customerId 이며, dedup 전까지 동일 key 의 여러 버전이 존재할 수 있습니다.
 */
public record CustomerRecord(
        long rowOffset,
        Integer customerId,
        String customerNumber,
        String firstName,
        String lastName,
        MaritalStatus maritalStatus,
        Gender gender,
        LocalDate createDate
) {

    public CustomerRecord withGender(Gender resolved) {
        return new CustomerRecord(rowOffset, customerId, customerNumber, firstName, lastName,
                maritalStatus, resolved, createDate);
    }
}
