package com.genomics.service;

import com.genomics.error.DuplicateRecordException;
import com.genomics.error.RecordNotFoundException;
import com.genomics.error.TransactionAbortedException;
import com.genomics.error.ValidationException;
import com.genomics.model.ClinicalStage;
import com.genomics.model.GeneRecord;
import com.genomics.model.MutationRecord;
import com.genomics.model.Patient;
import com.genomics.model.RecordKind;
import com.genomics.model.Sex;
import com.genomics.store.GenomicStore;
import com.genomics.store.StoreOperation;
import com.genomics.validation.RowOutcome;
import com.genomics.validation.RowValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

@Service
public class PatientService {

    private static final Logger log = LoggerFactory.getLogger(PatientService.class);

    private final GenomicStore store;
    private final RowValidator validator;
    private final CatalogService catalogService;

    public PatientService(GenomicStore store, RowValidator validator, CatalogService catalogService) {
        this.store = store;
        this.validator = validator;
        this.catalogService = catalogService;
    }

    public Optional<Patient> getPatient(String id) {
        return store.findPatient(id);
    }

    /**
     * Register a new patient.
     *
     * @param body map containing patient fields (patient_id, name, age, sex, stage, diagnosis)
     * @return the stored patient, or empty if a patient with that id already exists
     * @throws ValidationException if a field is missing or malformed
     */
    public Optional<Patient> createPatient(Map<String, Object> body) {
        Patient patient = parsePatient(body);
        try {
            store.insert(patient);
        } catch (DuplicateRecordException e) {
            log.debug("Patient {} already exists", patient.id());
            return Optional.empty();
        }
        log.info("Created patient {} ({})", patient.id(), patient.displayName());
        return store.findPatient(patient.id());
    }

    /**
     * Update an existing patient with the provided fields. Fields absent from
     * the body keep their value; fields present with a null value are cleared.
     *
     * @param id   the patient ID to update
     * @param body map containing field values (name, age, sex, stage, diagnosis)
     * @return the updated Patient, or empty if not found
     */
    public Optional<Patient> updatePatient(String id, Map<String, Object> body) {
        Patient existing = store.findPatient(id).orElse(null);
        if (existing == null) {
            return Optional.empty();
        }

        Object age = body.containsKey("age") ? body.get("age") : existing.age();
        Object sex = body.containsKey("sex") ? body.get("sex") : existing.sex();
        Object stage = body.containsKey("stage") ? body.get("stage") : existing.stage();

        Patient updated = new Patient(
            existing.id(),
            body.containsKey("name") ? RowValidator.text("name", body.get("name")) : existing.name(),
            toAge(age),
            sex instanceof Sex s ? s : optional(RowValidator.text("sex", sex), Sex::parse),
            stage instanceof ClinicalStage c ? c : optional(RowValidator.text("stage", stage), ClinicalStage::parse),
            body.containsKey("diagnosis") ? RowValidator.text("diagnosis", body.get("diagnosis")) : existing.diagnosis()
        );
        store.put(updated);
        return store.findPatient(id);
    }

    /**
     * Delete a patient together with their gene and mutation records.
     *
     * @return false if the patient did not exist
     */
    public boolean deletePatient(String id) {
        try {
            store.delete(RecordKind.PATIENT, id);
        } catch (RecordNotFoundException e) {
            return false;
        }
        log.info("Deleted patient {} and dependent records", id);
        return true;
    }

    /**
     * Add a gene record to a patient and derive its mutation record, in one
     * transaction.
     *
     * @param patientId  the owning patient
     * @param geneId     gene symbol
     * @param expression expression value, must be finite
     * @param sequence   raw sequence, optional
     * @param replace    supersede an existing record for the same gene
     * @return the derived mutation record
     * @throws RecordNotFoundException if the patient does not exist
     * @throws com.genomics.error.DuplicateRecordException if the gene is already recorded and replace is false
     */
    public MutationRecord addGeneRecord(String patientId, String geneId, double expression, String sequence,
                                        boolean replace) {
        if (store.findPatient(patientId).isEmpty()) {
            throw new RecordNotFoundException(RecordKind.PATIENT, patientId);
        }
        GeneRecord geneRecord = new GeneRecord(patientId, geneId, expression, sequence);
        MutationRecord mutation = catalogService.classify(geneRecord);
        try {
            store.transaction(List.of(
                StoreOperation.put(geneRecord, replace),
                StoreOperation.put(mutation)
            ));
        } catch (TransactionAbortedException e) {
            throw e.getCause();
        }
        log.info("Recorded {} for patient {}: {}", geneRecord.geneId(), patientId, mutation.classification().code());
        return mutation;
    }

    public List<Patient> findAll() {
        return store.queryPatients(p -> true);
    }

    public List<Patient> findByDiagnosis(String diagnosis) {
        String wanted = diagnosis.trim().toLowerCase(Locale.ROOT);
        return store.queryPatients(p -> p.diagnosis() != null && p.diagnosis().toLowerCase(Locale.ROOT).equals(wanted));
    }

    public List<GeneRecord> geneRecordsFor(String patientId) {
        return store.queryGeneRecords(g -> g.patientId().equals(patientId));
    }

    public List<MutationRecord> mutationRecordsFor(String patientId) {
        Set<String> owned = Set.copyOf(geneRecordsFor(patientId).stream().map(GeneRecord::id).toList());
        return store.queryMutationRecords(m -> owned.contains(m.geneRecordId()));
    }

    private Patient parsePatient(Map<String, Object> body) {
        RowOutcome outcome = validator.validate(body);
        if (!outcome.isValid()) {
            throw new ValidationException(outcome.failure().field(), outcome.failure().message());
        }
        if (outcome.row().hasGeneRecord()) {
            throw new ValidationException("gene_id", "add gene records through the patient's gene endpoint");
        }
        return outcome.row().patient();
    }

    private static <T> T optional(String value, Function<String, T> parser) {
        return value == null ? null : parser.apply(value);
    }

    private static Integer toAge(Object value) {
        if (value == null || value instanceof Integer) {
            return (Integer) value;
        }
        try {
            return new BigDecimal(value.toString().trim()).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new ValidationException("age", "not a whole number: '" + value + "'");
        }
    }
}
