package com.genomics.model;

public enum RecordKind {
    PATIENT("Patient"),
    GENE_RECORD("Gene record"),
    MUTATION_RECORD("Mutation record");

    private final String label;

    RecordKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
