package com.dwh.pipeline.domain;

import com.dwh.pipeline.domain.code.Country;

/**
 * Cleansing 이후의 ERP 고객 위치 레코드 (erp_loc_a101)
 */
public record ErpLocationRecord(
        long rowOffset,
        String customerNumber,
        Country country
) {
}
