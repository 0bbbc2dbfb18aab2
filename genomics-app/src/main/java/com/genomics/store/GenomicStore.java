package com.genomics.store;

import com.genomics.model.GeneRecord;
import com.genomics.model.GeneRecordKey;
import com.genomics.model.GenomicRecord;
import com.genomics.model.MutationRecord;
import com.genomics.model.Patient;
import com.genomics.model.RecordKind;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Durable store for patients, gene records and mutation records.
 *
 * <p>Implementations are interchangeable: for identical data they return
 * identical results, and the backend in use is never visible through this
 * interface. Every mutation goes through a transaction; a failed transaction
 * leaves the store exactly as it was.
 *
 * <p>Write rules shared by all backends:
 * <ul>
 *   <li>a patient put inserts or updates the patient's demographic fields</li>
 *   <li>a gene record put requires its patient; an existing (patient, gene)
 *       pair is a duplicate unless {@code replace} is set, in which case the
 *       old record and its mutation records are superseded</li>
 *   <li>a mutation record put requires its gene record and supersedes any
 *       other mutation record of that gene record</li>
 *   <li>deletes cascade from patient to gene records to mutation records</li>
 * </ul>
 */
public interface GenomicStore {

    default void put(GenomicRecord record) {
        put(record, false);
    }

    /**
     * @throws com.genomics.error.DuplicateRecordException     gene record exists and {@code replace} is false
     * @throws com.genomics.error.ConstraintViolationException owning record missing
     * @throws com.genomics.error.StorageUnavailableException  backend unreachable
     */
    void put(GenomicRecord record, boolean replace);

    /**
     * Store a record that must not exist yet. For a patient this is the
     * create-only counterpart of the upserting {@link #put}.
     *
     * @throws com.genomics.error.DuplicateRecordException     a record of that kind and id exists
     * @throws com.genomics.error.ConstraintViolationException owning record missing
     */
    void insert(GenomicRecord record);

    /**
     * @throws com.genomics.error.RecordNotFoundException no record of that kind and id
     */
    GenomicRecord get(RecordKind kind, String id);

    /**
     * Like {@link #get} but reports absence as an empty result.
     */
    Optional<GenomicRecord> find(RecordKind kind, String id);

    default Optional<Patient> findPatient(String id) {
        return find(RecordKind.PATIENT, id).map(Patient.class::cast);
    }

    default Patient getPatient(String id) {
        return (Patient) get(RecordKind.PATIENT, id);
    }

    default GeneRecord getGeneRecord(String id) {
        return (GeneRecord) get(RecordKind.GENE_RECORD, id);
    }

    default MutationRecord getMutationRecord(String id) {
        return (MutationRecord) get(RecordKind.MUTATION_RECORD, id);
    }

    /**
     * Delete a record and everything that depends on it.
     *
     * @throws com.genomics.error.RecordNotFoundException no record of that kind and id
     */
    void delete(RecordKind kind, String id);

    /**
     * Records of one kind that satisfy the predicate, ordered by id.
     */
    List<GenomicRecord> query(RecordKind kind, Predicate<? super GenomicRecord> predicate);

    default List<Patient> queryPatients(Predicate<? super Patient> predicate) {
        return query(RecordKind.PATIENT, r -> predicate.test((Patient) r)).stream()
            .map(Patient.class::cast)
            .toList();
    }

    default List<GeneRecord> queryGeneRecords(Predicate<? super GeneRecord> predicate) {
        return query(RecordKind.GENE_RECORD, r -> predicate.test((GeneRecord) r)).stream()
            .map(GeneRecord.class::cast)
            .toList();
    }

    default List<MutationRecord> queryMutationRecords(Predicate<? super MutationRecord> predicate) {
        return query(RecordKind.MUTATION_RECORD, r -> predicate.test((MutationRecord) r)).stream()
            .map(MutationRecord.class::cast)
            .toList();
    }

    boolean exists(GeneRecordKey key);

    /**
     * All records read from one committed state, so a transaction committing
     * meanwhile is either fully visible or not at all.
     */
    GenomicSnapshot snapshot();

    /**
     * Apply all operations atomically.
     *
     * @throws com.genomics.error.TransactionAbortedException an operation failed; nothing was applied
     * @throws com.genomics.error.StorageUnavailableException backend unreachable; nothing was applied
     */
    void transaction(List<StoreOperation> operations);

    /**
     * Short name of the backend, for logging.
     */
    String backendName();
}
