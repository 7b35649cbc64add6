package com.dwh.pipeline.dedup;

import com.dwh.pipeline.domain.CustomerRecord;
import com.dwh.pipeline.domain.EntityFamily;
import com.dwh.pipeline.domain.ErpCustomerRecord;
import com.dwh.pipeline.domain.code.Gender;
import com.dwh.pipeline.domain.code.MaritalStatus;
import com.dwh.pipeline.quality.QualityIssueLog;
import com.dwh.pipeline.quality.Severity;
import com.dwh.pipeline.quality.StageIssues;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CustomerReconcilerTest {

    private final CustomerReconciler reconciler = new CustomerReconciler();
    private QualityIssueLog log;
    private StageIssues issues;

    @BeforeEach
    void setUp() {
        log = new QualityIssueLog();
        issues = log.forStage(EntityFamily.CUSTOMER, "dedup");
    }

    private static CustomerRecord crm(int id, String number, Gender gender) {
        return new CustomerRecord(id, id, number, "F", "L", MaritalStatus.MARRIED, gender, LocalDate.of(2026, 1, 1));
    }

    @Test
    @DisplayName("CRM 성별이 n/a 이면 ERP 성별로 대체된다")
    void CRM_unknown_ERP_사용() {
        // given
        List<CustomerRecord> customers = List.of(crm(1, "C1", Gender.UNKNOWN));
        List<ErpCustomerRecord> erp = List.of(new ErpCustomerRecord(0, "C1", null, Gender.FEMALE));

        // when
        List<CustomerRecord> result = reconciler.reconcile(customers, erp, issues);

        // then
        assertThat(result).singleElement().extracting(CustomerRecord::gender).isEqualTo(Gender.FEMALE);
        assertThat(log.countBySeverity()).containsEntry(Severity.INFO, 1L);
    }

    @Test
    @DisplayName("CRM 성별이 있으면 ERP 와 달라도 CRM 값이 우선한다")
    void CRM_우선() {
        // given
        List<CustomerRecord> customers = List.of(crm(1, "C1", Gender.MALE));
        List<ErpCustomerRecord> erp = List.of(new ErpCustomerRecord(0, "C1", null, Gender.FEMALE));

        // when
        List<CustomerRecord> result = reconciler.reconcile(customers, erp, issues);

        // then
        assertThat(result.get(0).gender()).isEqualTo(Gender.MALE);
        assertThat(log.size()).isZero();
    }

    @Test
    @DisplayName("양쪽 모두 성별을 모르면 null 이 된다")
    void 양쪽_unknown_null() {
        // given
        List<CustomerRecord> customers = List.of(crm(1, "C1", Gender.UNKNOWN), crm(2, "C2", Gender.UNKNOWN));
        List<ErpCustomerRecord> erp = List.of(new ErpCustomerRecord(0, "C1", null, Gender.UNKNOWN));

        // when
        List<CustomerRecord> result = reconciler.reconcile(customers, erp, issues);

        // then
        assertThat(result).extracting(CustomerRecord::gender).containsExactly(null, null);
    }

    @Test
    @DisplayName("고객 번호가 없으면 경고를 남기고 그대로 통과시킨다")
    void 고객번호없음_경고() {
        // given
        List<CustomerRecord> customers = List.of(crm(1, null, Gender.MALE));

        // when
        List<CustomerRecord> result = reconciler.reconcile(customers, List.of(), issues);

        // then
        assertThat(result).hasSize(1);
        assertThat(log.countBySeverity()).containsEntry(Severity.WARNING, 1L);
    }
}
