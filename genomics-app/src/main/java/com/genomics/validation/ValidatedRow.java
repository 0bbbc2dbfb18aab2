package com.genomics.validation;

import com.genomics.model.GeneRecord;
import com.genomics.model.GeneRecordKey;
import com.genomics.model.Patient;

/**
 * Typed records built from one raw row. {@code geneRecord} is null for a
 * patient-only intake row.
 */
public record ValidatedRow(Patient patient, GeneRecord geneRecord) {

    public boolean hasGeneRecord() {
        return geneRecord != null;
    }

    public GeneRecordKey key() {
        return geneRecord != null ? geneRecord.key() : null;
    }
}
