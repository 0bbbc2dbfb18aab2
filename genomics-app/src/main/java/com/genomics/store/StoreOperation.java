package com.genomics.store;

import com.genomics.model.GenomicRecord;
import com.genomics.model.RecordKind;

import java.util.Objects;

/**
 * One write inside a {@link GenomicStore#transaction(java.util.List)} batch.
 * {@code INSERT} is a put that fails with a duplicate error when a record of
 * the same kind and id already exists.
 */
public record StoreOperation(Type type, RecordKind kind, String id, GenomicRecord record, boolean replace) {

    public enum Type { PUT, INSERT, DELETE }

    public StoreOperation {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(id, "id");
        if (type != Type.DELETE && record == null) {
            throw new IllegalArgumentException(type + " requires a record");
        }
    }

    public static StoreOperation put(GenomicRecord record) {
        return put(record, false);
    }

    public static StoreOperation put(GenomicRecord record, boolean replace) {
        return new StoreOperation(Type.PUT, record.kind(), record.id(), record, replace);
    }

    public static StoreOperation insert(GenomicRecord record) {
        return new StoreOperation(Type.INSERT, record.kind(), record.id(), record, false);
    }

    public static StoreOperation delete(RecordKind kind, String id) {
        return new StoreOperation(Type.DELETE, kind, id, null, false);
    }

    @Override
    public String toString() {
        return type + " " + kind + " " + id + (replace ? " (replace)" : "");
    }
}
