package com.genomics.store;

import com.genomics.model.GeneRecord;
import com.genomics.model.MutationRecord;
import com.genomics.model.Patient;

import java.util.Comparator;
import java.util.List;

/**
 * Every stored record as of one committed state, each collection ordered by id.
 * Patients carry their gene ids.
 */
public record GenomicSnapshot(
    List<Patient> patients,
    List<GeneRecord> geneRecords,
    List<MutationRecord> mutationRecords
) {

    public GenomicSnapshot {
        patients = patients.stream().sorted(Comparator.comparing(Patient::id)).toList();
        geneRecords = geneRecords.stream().sorted(Comparator.comparing(GeneRecord::id)).toList();
        mutationRecords = mutationRecords.stream().sorted(Comparator.comparing(MutationRecord::id)).toList();
    }
}
