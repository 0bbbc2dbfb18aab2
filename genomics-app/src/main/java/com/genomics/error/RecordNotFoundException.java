package com.genomics.error;

import com.genomics.model.RecordKind;

public class RecordNotFoundException extends GenomicsException {

    private final RecordKind kind;
    private final String id;

    public RecordNotFoundException(RecordKind kind, String id) {
        super(kind.label() + " not found: " + id);
        this.kind = kind;
        this.id = id;
    }

    public RecordKind getKind() {
        return kind;
    }

    public String getId() {
        return id;
    }
}
