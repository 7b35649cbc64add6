package com.dwh.pipeline.domain;

import java.time.LocalDate;

/**
 * dim_customers 행
 */
public record CustomerDimension(
        int customerKey,
        int customerId,
        String customerNumber,
        String firstName,
        String lastName,
        String country,
        String maritalStatus,
        String gender,
        LocalDate birthDate,
        LocalDate createDate
) {
}
