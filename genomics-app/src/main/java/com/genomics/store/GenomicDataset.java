package com.genomics.store;

import com.genomics.error.ConstraintViolationException;
import com.genomics.error.DuplicateRecordException;
import com.genomics.error.RecordNotFoundException;
import com.genomics.model.GeneRecord;
import com.genomics.model.GeneRecordKey;
import com.genomics.model.GenomicRecord;
import com.genomics.model.MutationRecord;
import com.genomics.model.Patient;
import com.genomics.model.RecordKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * In-memory image of the whole dataset, used by the file backend. A published
 * instance is never modified again; writers work on a {@link #copy()}.
 *
 * <p>Gene record ids are {@code patient:gene} and mutation record ids start
 * with {@code patient:gene|}, so owned records are contiguous key ranges.
 */
final class GenomicDataset {

    private final TreeMap<String, Patient> patients;
    private final TreeMap<String, GeneRecord> geneRecords;
    private final TreeMap<String, MutationRecord> mutationRecords;

    private GenomicDataset(TreeMap<String, Patient> patients,
                           TreeMap<String, GeneRecord> geneRecords,
                           TreeMap<String, MutationRecord> mutationRecords) {
        this.patients = patients;
        this.geneRecords = geneRecords;
        this.mutationRecords = mutationRecords;
    }

    static GenomicDataset empty() {
        return new GenomicDataset(new TreeMap<>(), new TreeMap<>(), new TreeMap<>());
    }

    GenomicDataset copy() {
        return new GenomicDataset(new TreeMap<>(patients), new TreeMap<>(geneRecords), new TreeMap<>(mutationRecords));
    }

    // ========== READ ==========

    Optional<GenomicRecord> find(RecordKind kind, String id) {
        return switch (kind) {
            case PATIENT -> Optional.ofNullable(patients.get(id)).map(this::withGeneIds);
            case GENE_RECORD -> Optional.ofNullable(geneRecords.get(id));
            case MUTATION_RECORD -> Optional.ofNullable(mutationRecords.get(id));
        };
    }

    List<GenomicRecord> all(RecordKind kind) {
        return switch (kind) {
            case PATIENT -> new ArrayList<>(patients.values().stream().map(this::withGeneIds).toList());
            case GENE_RECORD -> new ArrayList<>(geneRecords.values());
            case MUTATION_RECORD -> new ArrayList<>(mutationRecords.values());
        };
    }

    boolean contains(GeneRecordKey key) {
        return geneRecords.containsKey(key.recordId());
    }

    GenomicSnapshot snapshot() {
        return new GenomicSnapshot(
            patients.values().stream().map(this::withGeneIds).map(Patient.class::cast).toList(),
            List.copyOf(geneRecords.values()),
            List.copyOf(mutationRecords.values())
        );
    }

    List<Patient> patients() {
        return List.copyOf(patients.values());
    }

    List<GeneRecord> geneRecords() {
        return List.copyOf(geneRecords.values());
    }

    List<MutationRecord> mutationRecords() {
        return List.copyOf(mutationRecords.values());
    }

    private GenomicRecord withGeneIds(Patient patient) {
        List<String> geneIds = genesOf(patient.id()).values().stream()
            .map(GeneRecord::geneId)
            .toList();
        return patient.withGeneIds(geneIds);
    }

    private SortedMap<String, GeneRecord> genesOf(String patientId) {
        return geneRecords.subMap(patientId + ":", patientId + ";");
    }

    private SortedMap<String, MutationRecord> mutationsOf(String geneRecordId) {
        return mutationRecords.subMap(geneRecordId + "|", geneRecordId + "}");
    }

    // ========== WRITE ==========

    void apply(StoreOperation operation) {
        switch (operation.type()) {
            case PUT -> put(operation.record(), operation.replace());
            case INSERT -> {
                if (find(operation.kind(), operation.id()).isPresent()) {
                    throw new DuplicateRecordException(operation.kind(), operation.id());
                }
                put(operation.record(), false);
            }
            case DELETE -> delete(operation.kind(), operation.id());
        }
    }

    private void put(GenomicRecord record, boolean replace) {
        if (record instanceof Patient patient) {
            patients.put(patient.id(), patient.withoutGeneIds());
        } else if (record instanceof GeneRecord geneRecord) {
            putGeneRecord(geneRecord, replace);
        } else if (record instanceof MutationRecord mutationRecord) {
            putMutationRecord(mutationRecord);
        }
    }

    private void putGeneRecord(GeneRecord geneRecord, boolean replace) {
        if (!patients.containsKey(geneRecord.patientId())) {
            throw new ConstraintViolationException(
                "Gene record " + geneRecord.id() + " references missing patient " + geneRecord.patientId());
        }
        if (geneRecords.containsKey(geneRecord.id())) {
            if (!replace) {
                throw new DuplicateRecordException(geneRecord.key());
            }
            mutationsOf(geneRecord.id()).clear();
        }
        geneRecords.put(geneRecord.id(), geneRecord);
    }

    private void putMutationRecord(MutationRecord mutationRecord) {
        if (!geneRecords.containsKey(mutationRecord.geneRecordId())) {
            throw new ConstraintViolationException(
                "Mutation record " + mutationRecord.id() + " references missing gene record "
                    + mutationRecord.geneRecordId());
        }
        mutationsOf(mutationRecord.geneRecordId()).clear();
        mutationRecords.put(mutationRecord.id(), mutationRecord);
    }

    private void delete(RecordKind kind, String id) {
        switch (kind) {
            case PATIENT -> {
                if (patients.remove(id) == null) {
                    throw new RecordNotFoundException(kind, id);
                }
                SortedMap<String, GeneRecord> owned = genesOf(id);
                for (String geneRecordId : owned.keySet()) {
                    mutationsOf(geneRecordId).clear();
                }
                owned.clear();
            }
            case GENE_RECORD -> {
                if (geneRecords.remove(id) == null) {
                    throw new RecordNotFoundException(kind, id);
                }
                mutationsOf(id).clear();
            }
            case MUTATION_RECORD -> {
                if (mutationRecords.remove(id) == null) {
                    throw new RecordNotFoundException(kind, id);
                }
            }
        }
    }

    /**
     * Rebuild a dataset from stored collections, enforcing the same rules as
     * live writes so a document with orphans is rejected.
     */
    static GenomicDataset of(List<Patient> patients, List<GeneRecord> geneRecords,
                             List<MutationRecord> mutationRecords) {
        GenomicDataset dataset = empty();
        patients.forEach(p -> dataset.apply(StoreOperation.put(p)));
        geneRecords.forEach(g -> dataset.apply(StoreOperation.put(g)));
        mutationRecords.forEach(m -> dataset.apply(StoreOperation.put(m)));
        return dataset;
    }

    Map<RecordKind, Integer> counts() {
        return Map.of(
            RecordKind.PATIENT, patients.size(),
            RecordKind.GENE_RECORD, geneRecords.size(),
            RecordKind.MUTATION_RECORD, mutationRecords.size()
        );
    }
}
