package com.dwh.pipeline.dedup;

import com.dwh.pipeline.cleansing.CustomerCleanser;
import com.dwh.pipeline.cleansing.ProductCleanser;
import com.dwh.pipeline.domain.CustomerRecord;
import com.dwh.pipeline.domain.ErpCustomerRecord;
import com.dwh.pipeline.domain.ErpLocationRecord;
import com.dwh.pipeline.domain.ProductCategoryRecord;
import com.dwh.pipeline.domain.ProductRecord;
import com.dwh.pipeline.quality.StageIssues;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

/**
 * 엔티티별 dedup 규칙 선언
 * <p>
 * - crm_cust_info: cst_id, 최신 cst_create_date
 * - crm_prd_info: prd_id, 최신 prd_start_dt
 * - ERP 테이블: recency 없음, 마지막에 적재된 행
 */
@Component
public class DeduplicationEngine {

    private static final Deduplicator<CustomerRecord, Integer> CUSTOMERS = Deduplicator.of(
            CustomerCleanser.CRM_TABLE, CustomerRecord::customerId, CustomerRecord::createDate,
            CustomerRecord::rowOffset);

    private static final Deduplicator<ErpCustomerRecord, String> ERP_CUSTOMERS = Deduplicator.of(
            CustomerCleanser.ERP_TABLE, ErpCustomerRecord::customerNumber, r -> (LocalDate) null,
            ErpCustomerRecord::rowOffset);

    private static final Deduplicator<ErpLocationRecord, String> LOCATIONS = Deduplicator.of(
            CustomerCleanser.LOCATION_TABLE, ErpLocationRecord::customerNumber, r -> (LocalDate) null,
            ErpLocationRecord::rowOffset);

    private static final Deduplicator<ProductRecord, Integer> PRODUCTS = Deduplicator.of(
            ProductCleanser.CRM_TABLE, ProductRecord::productId, ProductRecord::startDate,
            ProductRecord::rowOffset);

    private static final Deduplicator<ProductCategoryRecord, String> CATEGORIES = Deduplicator.of(
            ProductCleanser.CATEGORY_TABLE, ProductCategoryRecord::categoryId, r -> (LocalDate) null,
            ProductCategoryRecord::rowOffset);

    public List<CustomerRecord> customers(List<CustomerRecord> records, StageIssues issues) {
        return CUSTOMERS.deduplicate(records, issues);
    }

    public List<ErpCustomerRecord> erpCustomers(List<ErpCustomerRecord> records, StageIssues issues) {
        return ERP_CUSTOMERS.deduplicate(records, issues);
    }

    public List<ErpLocationRecord> locations(List<ErpLocationRecord> records, StageIssues issues) {
        return LOCATIONS.deduplicate(records, issues);
    }

    public List<ProductRecord> products(List<ProductRecord> records, StageIssues issues) {
        return PRODUCTS.deduplicate(records, issues);
    }

    public List<ProductCategoryRecord> categories(List<ProductCategoryRecord> records, StageIssues issues) {
        return CATEGORIES.deduplicate(records, issues);
    }
}
