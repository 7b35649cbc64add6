package com.dwh.pipeline.cleansing;

import com.dwh.pipeline.domain.EntityFamily;
import com.dwh.pipeline.domain.ProductCategoryRecord;
import com.dwh.pipeline.domain.ProductRecord;
import com.dwh.pipeline.domain.RawTable;
import com.dwh.pipeline.domain.code.ProductLine;
import com.dwh.pipeline.quality.QualityIssueLog;
import com.dwh.pipeline.quality.Severity;
import com.dwh.pipeline.quality.StageIssues;
import com.dwh.pipeline.support.RawTableFixture;
import com.dwh.pipeline.support.TestNormalizers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProductCleanserTest {

    private ProductCleanser cleanser;
    private QualityIssueLog log;
    private StageIssues issues;

    @BeforeEach
    void setUp() {
        cleanser = new ProductCleanser(TestNormalizers.normalizer());
        log = new QualityIssueLog();
        issues = log.forStage(EntityFamily.PRODUCT, "cleanse");
    }

    @Test
    @DisplayName("원가가 없으면 0 으로 대체되고 INFO 가 남는다")
    void 원가누락_0() {
        // given
        RawTable raw = RawTableFixture.table(ProductCleanser.CRM_TABLE,
                        "prd_id", "prd_key", "prd_nm", "prd_cost", "prd_line", "prd_start_dt", "prd_end_dt")
                .row("210", "CO-RF-FR-R92B-58", " HL Road Frame - Black- 58", null, "R ", "2003-07-01", null)
                .build();

        // when
        ProductRecord product = cleanser.cleanseCrm(raw, issues).get(0);

        // then
        assertThat(product.productId()).isEqualTo(210);
        assertThat(product.productKey()).isEqualTo("CO-RF-FR-R92B-58");
        assertThat(product.productName()).isEqualTo("HL Road Frame - Black- 58");
        assertThat(product.cost()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(product.productLine()).isEqualTo(ProductLine.ROAD);
        assertThat(product.startDate()).isEqualTo(LocalDate.of(2003, 7, 1));
        assertThat(product.categoryId()).isNull();
        assertThat(log.countBySeverity()).containsEntry(Severity.INFO, 1L);
    }

    @Test
    @DisplayName("ERP 카테고리는 공백만 정리된다")
    void 카테고리_정규화() {
        // given
        RawTable raw = RawTableFixture.table(ProductCleanser.CATEGORY_TABLE, "id", "cat", "subcat", "maintenance")
                .row("CO_RF ", "Components", " Road Frames", "Yes")
                .build();

        // when
        List<ProductCategoryRecord> result = cleanser.cleanseCategories(raw, issues);

        // then
        assertThat(result).singleElement().satisfies(category -> {
            assertThat(category.categoryId()).isEqualTo("CO_RF");
            assertThat(category.subcategory()).isEqualTo("Road Frames");
        });
    }
}
