package com.dwh.pipeline.cleansing;

import com.dwh.pipeline.cleansing.FieldNormalizer.Field;
import com.dwh.pipeline.domain.CustomerRecord;
import com.dwh.pipeline.domain.ErpCustomerRecord;
import com.dwh.pipeline.domain.ErpLocationRecord;
import com.dwh.pipeline.domain.RawRecord;
import com.dwh.pipeline.domain.RawTable;
import com.dwh.pipeline.domain.code.Country;
import com.dwh.pipeline.domain.code.Gender;
import com.dwh.pipeline.domain.code.MaritalStatus;
import com.dwh.pipeline.exception.ErrorKind;
import com.dwh.pipeline.quality.StageIssues;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 고객 패밀리 Cleansing (crm_cust_info, erp_cust_az12, erp_loc_a101)
 * <p>
 * 출력 건수는 항상 입력 건수와 같습니다.
 */
@Component
@RequiredArgsConstructor
public class CustomerCleanser {

    public static final String CRM_TABLE = "crm_cust_info";
    public static final String ERP_TABLE = "erp_cust_az12";
    public static final String LOCATION_TABLE = "erp_loc_a101";

    private static final String LEGACY_PREFIX = "NAS";

    private final FieldNormalizer normalizer;

    public List<CustomerRecord> cleanseCrm(RawTable table, StageIssues issues) {
        table.requireColumns("cst_id", "cst_key", "cst_firstname", "cst_lastname",
                "cst_marital_status", "cst_gndr", "cst_create_date");

        List<CustomerRecord> result = new ArrayList<>(table.size());
        for (RawRecord row : table.rows()) {
            String key = normalizer.text(row.get("cst_id"));
            result.add(new CustomerRecord(
                    row.rowOffset(),
                    normalizer.integer(row.get("cst_id"), new Field(CRM_TABLE, key, "cst_id"), issues),
                    normalizer.text(row.get("cst_key")),
                    normalizer.text(row.get("cst_firstname")),
                    normalizer.text(row.get("cst_lastname")),
                    normalizer.code(MaritalStatus.TABLE, row.get("cst_marital_status"),
                            new Field(CRM_TABLE, key, "cst_marital_status"), issues),
                    normalizer.code(Gender.TABLE, row.get("cst_gndr"),
                            new Field(CRM_TABLE, key, "cst_gndr"), issues),
                    normalizer.isoDate(row.get("cst_create_date"),
                            new Field(CRM_TABLE, key, "cst_create_date"), issues)
            ));
        }
        return result;
    }

    public List<ErpCustomerRecord> cleanseErp(RawTable table, StageIssues issues) {
        table.requireColumns("cid", "bdate", "gen");

        List<ErpCustomerRecord> result = new ArrayList<>(table.size());
        for (RawRecord row : table.rows()) {
            String customerNumber = normalizer.text(row.get("cid"));
            if (customerNumber != null && customerNumber.startsWith(LEGACY_PREFIX)) {
                customerNumber = customerNumber.substring(LEGACY_PREFIX.length());
                issues.info(ERP_TABLE, customerNumber, "id:cid", ErrorKind.FORMAT,
                        "legacy '" + LEGACY_PREFIX + "' prefix removed");
            }
            result.add(new ErpCustomerRecord(
                    row.rowOffset(),
                    customerNumber,
                    normalizer.pastDate(row.get("bdate"), new Field(ERP_TABLE, customerNumber, "bdate"), issues),
                    normalizer.code(Gender.TABLE, row.get("gen"), new Field(ERP_TABLE, customerNumber, "gen"), issues)
            ));
        }
        return result;
    }

    public List<ErpLocationRecord> cleanseLocations(RawTable table, StageIssues issues) {
        table.requireColumns("cid", "cntry");

        List<ErpLocationRecord> result = new ArrayList<>(table.size());
        for (RawRecord row : table.rows()) {
            String customerNumber = normalizer.text(row.get("cid"));
            if (customerNumber != null && customerNumber.contains("-")) {
                customerNumber = customerNumber.replace("-", "");
            }
            result.add(new ErpLocationRecord(
                    row.rowOffset(),
                    customerNumber,
                    normalizer.code(Country.TABLE, row.get("cntry"),
                            new Field(LOCATION_TABLE, customerNumber, "cntry"), issues)
            ));
        }
        return result;
    }
}
