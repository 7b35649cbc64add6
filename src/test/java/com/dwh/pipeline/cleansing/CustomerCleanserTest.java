package com.dwh.pipeline.cleansing;

import com.dwh.pipeline.domain.CustomerRecord;
import com.dwh.pipeline.domain.EntityFamily;
import com.dwh.pipeline.domain.ErpCustomerRecord;
import com.dwh.pipeline.domain.ErpLocationRecord;
import com.dwh.pipeline.domain.RawTable;
import com.dwh.pipeline.domain.code.Country;
import com.dwh.pipeline.domain.code.Gender;
import com.dwh.pipeline.domain.code.MaritalStatus;
import com.dwh.pipeline.exception.StructuralException;
import com.dwh.pipeline.quality.QualityIssue;
import com.dwh.pipeline.quality.QualityIssueLog;
import com.dwh.pipeline.quality.Severity;
import com.dwh.pipeline.quality.StageIssues;
import com.dwh.pipeline.support.RawTableFixture;
import com.dwh.pipeline.support.TestNormalizers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class CustomerCleanserTest {

    private CustomerCleanser cleanser;
    private QualityIssueLog log;
    private StageIssues issues;

    @BeforeEach
    void setUp() {
        cleanser = new CustomerCleanser(TestNormalizers.normalizer());
        log = new QualityIssueLog();
        issues = log.forStage(EntityFamily.CUSTOMER, "cleanse");
    }

    private static RawTableFixture crm() {
        return RawTableFixture.table(CustomerCleanser.CRM_TABLE, "cst_id", "cst_key", "cst_firstname",
                "cst_lastname", "cst_marital_status", "cst_gndr", "cst_create_date");
    }

    @Test
    @DisplayName("공백 제거와 코드 매핑이 적용되고 건수는 유지된다")
    void 공백제거_코드매핑() {
        // given
        RawTable raw = crm()
                .row(" 11000 ", "AW00011000", "  Jon ", "Yang  ", "M", " m ", "2025-10-06")
                .row("11001", "AW00011001", "Eugene", "Huang", "S", "F", "2025-10-06")
                .build();

        // when
        List<CustomerRecord> result = cleanser.cleanseCrm(raw, issues);

        // then
        assertThat(result).hasSize(2);
        CustomerRecord first = result.get(0);
        assertThat(first.customerId()).isEqualTo(11000);
        assertThat(first.firstName()).isEqualTo("Jon");
        assertThat(first.lastName()).isEqualTo("Yang");
        assertThat(first.maritalStatus()).isEqualTo(MaritalStatus.MARRIED);
        assertThat(first.gender()).isEqualTo(Gender.MALE);
        assertThat(first.createDate()).isEqualTo(LocalDate.of(2025, 10, 6));
        assertThat(result.get(1).maritalStatus()).isEqualTo(MaritalStatus.SINGLE);
        assertThat(log.size()).isZero();
    }

    @Test
    @DisplayName("알 수 없는 코드는 n/a 로 대체되고 WARNING 이 기록된다")
    void 알수없는코드_기본값_경고() {
        // given
        RawTable raw = crm().row("11000", "AW00011000", "Jon", "Yang", "X", null, "2025-10-06").build();

        // when
        CustomerRecord result = cleanser.cleanseCrm(raw, issues).get(0);

        // then
        assertThat(result.maritalStatus()).isEqualTo(MaritalStatus.UNKNOWN);
        assertThat(result.maritalStatus().label()).isEqualTo("n/a");
        assertThat(result.gender()).isEqualTo(Gender.UNKNOWN);
        assertThat(log.snapshot())
                .extracting(QualityIssue::rule, QualityIssue::severity)
                .containsExactly(
                        tuple("code:cst_marital_status", Severity.WARNING),
                        tuple("code:cst_gndr", Severity.INFO));
    }

    @Test
    @DisplayName("잘못된 날짜와 숫자는 null 로 대체되고 처리는 계속된다")
    void 잘못된값_null대체() {
        // given
        RawTable raw = crm()
                .row("abc", "AW1", "A", "B", "S", "F", "2025-02-30")
                .row("12", "AW2", "A", "B", "S", "F", "1850-01-01")
                .build();

        // when
        List<CustomerRecord> result = cleanser.cleanseCrm(raw, issues);

        // then
        assertThat(result).hasSize(2);
        assertThat(result.get(0).customerId()).isNull();
        assertThat(result.get(0).createDate()).isNull();
        assertThat(result.get(1).createDate()).isNull();
        assertThat(log.snapshot()).hasSize(3).allMatch(issue -> issue.severity() == Severity.WARNING);
    }

    @Test
    @DisplayName("필수 컬럼이 없으면 구조적 오류로 중단된다")
    void 필수컬럼누락_구조적오류() {
        // given
        RawTable raw = RawTableFixture.table(CustomerCleanser.CRM_TABLE, "cst_id", "cst_key").row("1", "AW1").build();

        // when & then
        assertThatThrownBy(() -> cleanser.cleanseCrm(raw, issues))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("cst_firstname");
    }

    @Test
    @DisplayName("ERP 고객 id 의 NAS 접두어 제거, 미래 생년월일은 null")
    void ERP고객_정규화() {
        // given
        RawTable raw = RawTableFixture.table(CustomerCleanser.ERP_TABLE, "cid", "bdate", "gen")
                .row("NASAW00011000", "1971-10-06", "Male")
                .row("AW00011001", "2030-01-01", " FEMALE ")
                .build();

        // when
        List<ErpCustomerRecord> result = cleanser.cleanseErp(raw, issues);

        // then
        assertThat(result).extracting(ErpCustomerRecord::customerNumber)
                .containsExactly("AW00011000", "AW00011001");
        assertThat(result.get(0).birthDate()).isEqualTo(LocalDate.of(1971, 10, 6));
        assertThat(result.get(0).gender()).isEqualTo(Gender.MALE);
        assertThat(result.get(1).birthDate()).isNull();
        assertThat(result.get(1).gender()).isEqualTo(Gender.FEMALE);
    }

    @Test
    @DisplayName("ERP 위치의 대시 제거와 국가 코드 매핑")
    void ERP위치_정규화() {
        // given
        RawTable raw = RawTableFixture.table(CustomerCleanser.LOCATION_TABLE, "cid", "cntry")
                .row("AW-00011000", "DE")
                .row("AW-00011001", "USA")
                .row("AW-00011002", "Australia ")
                .row("AW-00011003", "  ")
                .build();

        // when
        List<ErpLocationRecord> result = cleanser.cleanseLocations(raw, issues);

        // then
        assertThat(result).extracting(ErpLocationRecord::customerNumber)
                .containsExactly("AW00011000", "AW00011001", "AW00011002", "AW00011003");
        assertThat(result).extracting(ErpLocationRecord::country)
                .containsExactly(Country.GERMANY, Country.UNITED_STATES, Country.AUSTRALIA, Country.UNKNOWN);
    }
}
