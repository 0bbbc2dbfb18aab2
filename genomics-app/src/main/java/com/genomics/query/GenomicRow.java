package com.genomics.query;

import com.genomics.model.Classification;
import com.genomics.model.GeneRecord;
import com.genomics.model.MutationRecord;
import com.genomics.model.Patient;

/**
 * One patient joined with one of their gene records and its current mutation
 * record. A patient without gene records appears once with both left null.
 */
public record GenomicRow(Patient patient, GeneRecord geneRecord, MutationRecord mutation) {

    public boolean hasGeneRecord() {
        return geneRecord != null;
    }

    /**
     * Classification of the row; gene records not yet classified count as unknown.
     */
    public Classification classification() {
        return mutation != null ? mutation.classification() : Classification.UNKNOWN;
    }

    public boolean isMutated() {
        return mutation != null && mutation.isMutated();
    }

    String sortKey() {
        return geneRecord != null ? geneRecord.id() : patient.id() + ":";
    }
}
