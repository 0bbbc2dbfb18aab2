package com.genomics.model;

/**
 * Composite key of a gene record: a patient has at most one record per gene.
 */
public record GeneRecordKey(String patientId, String geneId) {

    public GeneRecordKey {
        patientId = Identifiers.requirePatientId("patient_id", patientId);
        geneId = Identifiers.requireGeneId("gene_id", geneId);
    }

    public String recordId() {
        return patientId + ":" + geneId;
    }

    public static GeneRecordKey parse(String recordId) {
        int separator = recordId == null ? -1 : recordId.indexOf(':');
        if (separator < 0) {
            throw new IllegalArgumentException("Not a gene record id: " + recordId);
        }
        return new GeneRecordKey(recordId.substring(0, separator), recordId.substring(separator + 1));
    }

    @Override
    public String toString() {
        return recordId();
    }
}
