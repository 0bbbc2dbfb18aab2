package com.genomics.service;

import com.genomics.error.DuplicateRecordException;
import com.genomics.error.TransactionAbortedException;
import com.genomics.model.Classification;
import com.genomics.model.GeneRecord;
import com.genomics.model.GeneRecordKey;
import com.genomics.model.MutationRecord;
import com.genomics.model.Patient;
import com.genomics.store.GenomicStore;
import com.genomics.store.StoreOperation;
import com.genomics.validation.ErrorPolicy;
import com.genomics.validation.RowOutcome;
import com.genomics.validation.RowValidator;
import com.genomics.validation.ValidatedRow;
import com.genomics.validation.ValidationFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Imports raw rows: validate, classify, store. Rows are independent; one bad
 * row is reported and the import carries on.
 */
@Service
public class RecordImportService {

    private static final Logger log = LoggerFactory.getLogger(RecordImportService.class);

    private final GenomicStore store;
    private final RowValidator validator;
    private final CatalogService catalogService;

    public RecordImportService(GenomicStore store, RowValidator validator, CatalogService catalogService) {
        this.store = store;
        this.validator = validator;
        this.catalogService = catalogService;
    }

    /**
     * Import rows one transaction per row.
     *
     * @param rows    raw rows as produced by the CSV front-end
     * @param options replace flag and error policy
     * @return one result per processed row
     * @throws com.genomics.error.StorageUnavailableException if the store cannot be reached; rows
     *         already committed stay committed
     */
    public ImportReport importRows(Iterable<? extends Map<String, ?>> rows, ImportOptions options) {
        List<ImportReport.RowResult> results = new ArrayList<>();
        try (Stream<RowOutcome> outcomes = validator.validateAll(rows, store::exists, options.replace(),
                                                                options.errorPolicy())) {
            Iterator<RowOutcome> iterator = outcomes.iterator();
            while (iterator.hasNext()) {
                ImportReport.RowResult result = importRow(iterator.next(), options.replace());
                results.add(result);
                if (!result.isSuccess() && options.errorPolicy() == ErrorPolicy.STOP_AT_FIRST) {
                    break;
                }
            }
        }
        ImportReport report = new ImportReport(results);
        log.info("Imported {} of {} row(s) into {} store", report.succeeded(), results.size(), store.backendName());
        return report;
    }

    private ImportReport.RowResult importRow(RowOutcome outcome, boolean replace) {
        if (!outcome.isValid()) {
            log.warn("Row {} rejected: {}", outcome.index(), outcome.failure());
            return rejected(outcome);
        }
        ValidatedRow row = outcome.row();
        Patient patient = mergeWithStored(row.patient());
        GeneRecord geneRecord = row.geneRecord();
        if (geneRecord == null) {
            store.transaction(List.of(StoreOperation.put(patient)));
            return result(outcome.index(), ImportReport.Status.IMPORTED, patient.id(), null, null, null);
        }

        boolean existed = replace && store.exists(geneRecord.key());
        MutationRecord mutation = catalogService.classify(geneRecord);
        try {
            store.transaction(List.of(
                StoreOperation.put(patient),
                StoreOperation.put(geneRecord, replace),
                StoreOperation.put(mutation)
            ));
        } catch (TransactionAbortedException e) {
            log.warn("Row {} not stored: {}", outcome.index(), e.getCause().getMessage());
            ImportReport.Status status = e.getCause() instanceof DuplicateRecordException
                ? ImportReport.Status.DUPLICATE : ImportReport.Status.FAILED;
            return result(outcome.index(), status, patient.id(), geneRecord.geneId(), null, e.getCause().getMessage());
        }
        return result(outcome.index(), existed ? ImportReport.Status.REPLACED : ImportReport.Status.IMPORTED,
                      patient.id(), geneRecord.geneId(), mutation.classification(), null);
    }

    /**
     * Import rows all-or-nothing: if any row is invalid or any write fails,
     * nothing is stored.
     *
     * @param rows    raw rows as produced by the CSV front-end
     * @param replace supersede existing (patient, gene) records
     * @return one result per row; either all succeed or none do
     */
    public ImportReport importAtomically(Iterable<? extends Map<String, ?>> rows, boolean replace) {
        List<RowOutcome> outcomes;
        try (Stream<RowOutcome> stream = validator.validateAll(rows, store::exists, replace, ErrorPolicy.COLLECT_ALL)) {
            outcomes = stream.toList();
        }
        if (outcomes.stream().anyMatch(o -> !o.isValid())) {
            log.warn("Atomic import of {} row(s) rejected: invalid rows present", outcomes.size());
            return new ImportReport(outcomes.stream()
                .map(o -> o.isValid()
                    ? result(o.index(), ImportReport.Status.FAILED, o.row().patient().id(), geneIdOf(o.row()), null,
                             "batch rejected because other rows are invalid")
                    : rejected(o))
                .toList());
        }

        Map<String, Patient> patients = new LinkedHashMap<>();
        Set<GeneRecordKey> existing = new HashSet<>();
        List<StoreOperation> geneOperations = new ArrayList<>();
        List<MutationRecord> mutations = new ArrayList<>();
        for (RowOutcome outcome : outcomes) {
            ValidatedRow row = outcome.row();
            Patient known = patients.get(row.patient().id());
            patients.put(row.patient().id(), known != null ? merge(known, row.patient()) : mergeWithStored(row.patient()));
            if (row.hasGeneRecord()) {
                if (replace && store.exists(row.key())) {
                    existing.add(row.key());
                }
                MutationRecord mutation = catalogService.classify(row.geneRecord());
                geneOperations.add(StoreOperation.put(row.geneRecord(), replace));
                geneOperations.add(StoreOperation.put(mutation));
                mutations.add(mutation);
            } else {
                mutations.add(null);
            }
        }

        List<StoreOperation> operations = new ArrayList<>();
        patients.values().forEach(p -> operations.add(StoreOperation.put(p)));
        operations.addAll(geneOperations);
        try {
            store.transaction(operations);
        } catch (TransactionAbortedException e) {
            log.warn("Atomic import of {} row(s) rolled back: {}", outcomes.size(), e.getCause().getMessage());
            return new ImportReport(outcomes.stream()
                .map(o -> result(o.index(), ImportReport.Status.FAILED, o.row().patient().id(), geneIdOf(o.row()),
                                 null, e.getCause().getMessage()))
                .toList());
        }

        List<ImportReport.RowResult> results = new ArrayList<>();
        for (int i = 0; i < outcomes.size(); i++) {
            ValidatedRow row = outcomes.get(i).row();
            MutationRecord mutation = mutations.get(i);
            ImportReport.Status status = row.hasGeneRecord() && existing.contains(row.key())
                ? ImportReport.Status.REPLACED : ImportReport.Status.IMPORTED;
            results.add(result(outcomes.get(i).index(), status, row.patient().id(), geneIdOf(row),
                               mutation != null ? mutation.classification() : null, null));
        }
        log.info("Atomically imported {} row(s) into {} store", results.size(), store.backendName());
        return new ImportReport(results);
    }

    /**
     * Rows repeat a patient's id for every gene; fields left blank on a row
     * keep their stored value.
     */
    private Patient mergeWithStored(Patient fromRow) {
        return store.findPatient(fromRow.id())
            .map(stored -> merge(stored, fromRow))
            .orElse(fromRow);
    }

    static Patient merge(Patient base, Patient update) {
        return new Patient(
            base.id(),
            update.name() != null ? update.name() : base.name(),
            update.age() != null ? update.age() : base.age(),
            update.sex() != null ? update.sex() : base.sex(),
            update.stage() != null ? update.stage() : base.stage(),
            update.diagnosis() != null ? update.diagnosis() : base.diagnosis()
        );
    }

    private static ImportReport.RowResult rejected(RowOutcome outcome) {
        ValidationFailure failure = outcome.failure();
        ImportReport.Status status = failure.kind() == ValidationFailure.Kind.DUPLICATE
            ? ImportReport.Status.DUPLICATE : ImportReport.Status.INVALID;
        return result(outcome.index(), status, null, null, null, failure.field() + ": " + failure.message());
    }

    private static String geneIdOf(ValidatedRow row) {
        return row.hasGeneRecord() ? row.geneRecord().geneId() : null;
    }

    private static ImportReport.RowResult result(int index, ImportReport.Status status, String patientId,
                                                 String geneId, Classification classification,
                                                 String message) {
        return new ImportReport.RowResult(index, status, patientId, geneId, classification, message);
    }
}
