package com.dwh.pipeline.domain;

import com.dwh.pipeline.domain.code.Gender;

import java.time.LocalDate;

/**
 * Cleansing 이후의 ERP 고객 보조 레코드 (erp_cust_az12)
 */
public record ErpCustomerRecord(
        long rowOffset,
        String customerNumber,
        LocalDate birthDate,
        Gender gender
) {
}
