package com.dwh.pipeline.orchestration;

import com.dwh.pipeline.assembly.CustomerDimensionAssembler;
import com.dwh.pipeline.cleansing.CustomerCleanser;
import com.dwh.pipeline.dedup.CustomerReconciler;
import com.dwh.pipeline.dedup.DeduplicationEngine;
import com.dwh.pipeline.domain.CustomerDimension;
import com.dwh.pipeline.domain.CustomerRecord;
import com.dwh.pipeline.domain.EntityFamily;
import com.dwh.pipeline.domain.ErpCustomerRecord;
import com.dwh.pipeline.domain.ErpLocationRecord;
import com.dwh.pipeline.domain.RawTable;
import com.dwh.pipeline.exception.ErrorKind;
import com.dwh.pipeline.output.StarSchemaPublisher;
import com.dwh.pipeline.quality.QualityCheck;
import com.dwh.pipeline.quality.RowChecks;
import com.dwh.pipeline.quality.Severity;
import com.dwh.pipeline.rawstore.RawStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 고객 패밀리 체인: read → cleanse → dedup → assemble → stage-output
 */
@Component
@RequiredArgsConstructor
public class CustomerChain {

    private static final EntityFamily FAMILY = EntityFamily.CUSTOMER;

    private final StageRunner runner;
    private final CustomerCleanser cleanser;
    private final DeduplicationEngine deduplication;
    private final CustomerReconciler reconciler;
    private final CustomerDimensionAssembler assembler;
    private final StarSchemaPublisher publisher;

    public FamilyOutcome<List<CustomerDimension>> run(RunContext run, RawStore rawStore) {
        StageResult<RawSources> raw = runner.run(run, FAMILY, "read", issues -> new RawSources(
                rawStore.read(CustomerCleanser.CRM_TABLE),
                rawStore.read(CustomerCleanser.ERP_TABLE),
                rawStore.read(CustomerCleanser.LOCATION_TABLE)), QualityCheck.none());
        if (!raw.succeeded()) {
            return FamilyOutcome.stoppedAt(raw);
        }

        StageResult<Sources> cleansed = runner.run(run, FAMILY, "cleanse", issues -> new Sources(
                        cleanser.cleanseCrm(raw.output().crm(), issues),
                        cleanser.cleanseErp(raw.output().erp(), issues),
                        cleanser.cleanseLocations(raw.output().locations(), issues)),
                sameCardinality(raw.output()));
        if (!cleansed.succeeded()) {
            return FamilyOutcome.stoppedAt(cleansed);
        }

        StageResult<Sources> canonical = runner.run(run, FAMILY, "dedup", issues -> {
            Sources in = cleansed.output();
            List<ErpCustomerRecord> erp = deduplication.erpCustomers(in.erp(), issues);
            List<CustomerRecord> customers = reconciler.reconcile(deduplication.customers(in.customers(), issues), erp, issues);
            return new Sources(customers, erp, deduplication.locations(in.locations(), issues));
        }, QualityCheck.on(Sources::customers,
                        RowChecks.<CustomerRecord>unique(CustomerCleanser.CRM_TABLE, "cst_id", CustomerRecord::customerId, Severity.FATAL))
                .and(QualityCheck.on(Sources::erp,
                        RowChecks.<ErpCustomerRecord>unique(CustomerCleanser.ERP_TABLE, "cid", ErpCustomerRecord::customerNumber, Severity.FATAL)))
                .and(QualityCheck.on(Sources::locations,
                        RowChecks.<ErpLocationRecord>unique(CustomerCleanser.LOCATION_TABLE, "cid", ErpLocationRecord::customerNumber, Severity.FATAL))));
        if (!canonical.succeeded()) {
            return FamilyOutcome.stoppedAt(canonical);
        }

        StageResult<List<CustomerDimension>> dimension = runner.run(run, FAMILY, "assemble", issues -> {
            Sources in = canonical.output();
            return assembler.assemble(in.customers(), in.erp(), in.locations());
        }, RowChecks.<CustomerDimension>unique(CustomerDimensionAssembler.ENTITY, "customer_key", CustomerDimension::customerKey, Severity.FATAL)
                .and(RowChecks.<CustomerDimension>unique(CustomerDimensionAssembler.ENTITY, "customer_id", CustomerDimension::customerId, Severity.FATAL))
                .and(RowChecks.<CustomerDimension>required(CustomerDimensionAssembler.ENTITY, "customer_number",
                        CustomerDimension::customerId, CustomerDimension::customerNumber, Severity.WARNING)));
        if (!dimension.succeeded()) {
            return FamilyOutcome.stoppedAt(dimension);
        }

        StageResult<Integer> staged = runner.run(run, FAMILY, "stage-output",
                issues -> publisher.stageCustomers(dimension.output()), QualityCheck.none());
        if (!staged.succeeded()) {
            return FamilyOutcome.stoppedAt(staged);
        }
        return FamilyOutcome.succeeded(FAMILY, dimension.output(), staged.output());
    }

    private static QualityCheck<Sources> sameCardinality(RawSources raw) {
        return (out, issues) -> {
            if (out.customers().size() != raw.crm().size()
                    || out.erp().size() != raw.erp().size()
                    || out.locations().size() != raw.locations().size()) {
                issues.fatal(CustomerCleanser.CRM_TABLE, null, "cleanse:cardinality", ErrorKind.STRUCTURAL,
                        "cleansing changed the row count");
            }
        };
    }

    record RawSources(RawTable crm, RawTable erp, RawTable locations) {
    }

    record Sources(List<CustomerRecord> customers, List<ErpCustomerRecord> erp, List<ErpLocationRecord> locations) {
    }
}
