package com.dwh.pipeline.orchestration;

import com.dwh.pipeline.assembly.ProductDimensionAssembler;
import com.dwh.pipeline.cleansing.ProductCleanser;
import com.dwh.pipeline.dedup.DeduplicationEngine;
import com.dwh.pipeline.domain.EntityFamily;
import com.dwh.pipeline.domain.ProductCategoryRecord;
import com.dwh.pipeline.domain.ProductDimension;
import com.dwh.pipeline.domain.ProductRecord;
import com.dwh.pipeline.domain.RawTable;
import com.dwh.pipeline.exception.ErrorKind;
import com.dwh.pipeline.output.StarSchemaPublisher;
import com.dwh.pipeline.quality.QualityCheck;
import com.dwh.pipeline.quality.RowChecks;
import com.dwh.pipeline.quality.Severity;
import com.dwh.pipeline.rawstore.RawStore;
import com.dwh.pipeline.rules.ProductCategorizer;
import com.dwh.pipeline.rules.ValidityWindowDeriver;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 상품 패밀리 체인: read → cleanse → dedup → rules → assemble → stage-output
 */
@Component
@RequiredArgsConstructor
public class ProductChain {

    private static final EntityFamily FAMILY = EntityFamily.PRODUCT;

    private final StageRunner runner;
    private final ProductCleanser cleanser;
    private final DeduplicationEngine deduplication;
    private final ProductCategorizer categorizer;
    private final ValidityWindowDeriver validityWindows;
    private final ProductDimensionAssembler assembler;
    private final StarSchemaPublisher publisher;

    public FamilyOutcome<List<ProductDimension>> run(RunContext run, RawStore rawStore) {
        StageResult<RawSources> raw = runner.run(run, FAMILY, "read", issues -> new RawSources(
                rawStore.read(ProductCleanser.CRM_TABLE),
                rawStore.read(ProductCleanser.CATEGORY_TABLE)), QualityCheck.none());
        if (!raw.succeeded()) {
            return FamilyOutcome.stoppedAt(raw);
        }

        StageResult<Sources> cleansed = runner.run(run, FAMILY, "cleanse", issues -> new Sources(
                cleanser.cleanseCrm(raw.output().products(), issues),
                cleanser.cleanseCategories(raw.output().categories(), issues)), sameCardinality(raw.output()));
        if (!cleansed.succeeded()) {
            return FamilyOutcome.stoppedAt(cleansed);
        }

        StageResult<Sources> canonical = runner.run(run, FAMILY, "dedup", issues -> new Sources(
                        deduplication.products(cleansed.output().products(), issues),
                        deduplication.categories(cleansed.output().categories(), issues)),
                QualityCheck.on(Sources::products,
                                RowChecks.<ProductRecord>unique(ProductCleanser.CRM_TABLE, "prd_id", ProductRecord::productId, Severity.FATAL))
                        .and(QualityCheck.on(Sources::categories,
                                RowChecks.<ProductCategoryRecord>unique(ProductCleanser.CATEGORY_TABLE, "id", ProductCategoryRecord::categoryId, Severity.FATAL))));
        if (!canonical.succeeded()) {
            return FamilyOutcome.stoppedAt(canonical);
        }

        StageResult<Sources> current = runner.run(run, FAMILY, "rules", issues -> {
            List<ProductRecord> categorized = categorizer.categorize(canonical.output().products(), issues);
            List<ProductRecord> versions = validityWindows.derive(categorized, issues);
            return new Sources(validityWindows.current(versions), canonical.output().categories());
        }, QualityCheck.on(Sources::products,
                RowChecks.<ProductRecord>unique(ProductCleanser.CRM_TABLE, "current:product_number", ProductRecord::productNumber, Severity.FATAL)
                        .and(RowChecks.<ProductRecord>required(ProductCleanser.CRM_TABLE, "category_id",
                                ProductRecord::productId, ProductRecord::categoryId, Severity.WARNING))));
        if (!current.succeeded()) {
            return FamilyOutcome.stoppedAt(current);
        }

        StageResult<List<ProductDimension>> dimension = runner.run(run, FAMILY, "assemble",
                issues -> assembler.assemble(current.output().products(), current.output().categories()),
                RowChecks.<ProductDimension>unique(ProductDimensionAssembler.ENTITY, "product_key", ProductDimension::productKey, Severity.FATAL)
                        .and(RowChecks.<ProductDimension>unique(ProductDimensionAssembler.ENTITY, "product_number", ProductDimension::productNumber, Severity.FATAL))
                        .and(RowChecks.<ProductDimension>required(ProductDimensionAssembler.ENTITY, "category",
                                ProductDimension::productNumber, ProductDimension::category, Severity.WARNING)));
        if (!dimension.succeeded()) {
            return FamilyOutcome.stoppedAt(dimension);
        }

        StageResult<Integer> staged = runner.run(run, FAMILY, "stage-output",
                issues -> publisher.stageProducts(dimension.output()), QualityCheck.none());
        if (!staged.succeeded()) {
            return FamilyOutcome.stoppedAt(staged);
        }
        return FamilyOutcome.succeeded(FAMILY, dimension.output(), staged.output());
    }

    private static QualityCheck<Sources> sameCardinality(RawSources raw) {
        return (out, issues) -> {
            if (out.products().size() != raw.products().size()
                    || out.categories().size() != raw.categories().size()) {
                issues.fatal(ProductCleanser.CRM_TABLE, null, "cleanse:cardinality", ErrorKind.STRUCTURAL,
                        "cleansing changed the row count");
            }
        };
    }

    record RawSources(RawTable products, RawTable categories) {
    }

    record Sources(List<ProductRecord> products, List<ProductCategoryRecord> categories) {
    }
}
