package com.genomics.error;

import com.genomics.model.GeneRecordKey;
import com.genomics.model.RecordKind;

/**
 * A record with the same identity already exists and the caller did not ask
 * for it to be replaced: a gene record for the same (patient, gene) pair, or a
 * patient created twice.
 */
public class DuplicateRecordException extends GenomicsException {

    private final RecordKind kind;
    private final String id;
    private final GeneRecordKey key;

    public DuplicateRecordException(GeneRecordKey key) {
        super("Gene record already exists for patient " + key.patientId() + " and gene " + key.geneId());
        this.kind = RecordKind.GENE_RECORD;
        this.id = key.recordId();
        this.key = key;
    }

    public DuplicateRecordException(RecordKind kind, String id) {
        super(kind.label() + " already exists: " + id);
        this.kind = kind;
        this.id = id;
        this.key = null;
    }

    public RecordKind getKind() {
        return kind;
    }

    public String getId() {
        return id;
    }

    /**
     * The (patient, gene) pair, null unless a gene record was duplicated.
     */
    public GeneRecordKey getKey() {
        return key;
    }
}
