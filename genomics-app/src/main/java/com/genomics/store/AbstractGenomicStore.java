package com.genomics.store;

import com.genomics.error.RecordNotFoundException;
import com.genomics.error.TransactionAbortedException;
import com.genomics.model.GenomicRecord;
import com.genomics.model.RecordKind;

import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Routes single-record writes through the backend's transaction so both paths
 * share one code path, and keeps read ordering identical across backends.
 */
public abstract class AbstractGenomicStore implements GenomicStore {

    static final Comparator<GenomicRecord> BY_ID = Comparator.comparing(GenomicRecord::id);

    @Override
    public void put(GenomicRecord record, boolean replace) {
        applySingle(StoreOperation.put(record, replace));
    }

    @Override
    public void insert(GenomicRecord record) {
        applySingle(StoreOperation.insert(record));
    }

    @Override
    public void delete(RecordKind kind, String id) {
        applySingle(StoreOperation.delete(kind, id));
    }

    @Override
    public GenomicRecord get(RecordKind kind, String id) {
        return find(kind, id).orElseThrow(() -> new RecordNotFoundException(kind, id));
    }

    @Override
    public List<GenomicRecord> query(RecordKind kind, Predicate<? super GenomicRecord> predicate) {
        return findAll(kind).stream()
            .filter(predicate)
            .sorted(BY_ID)
            .toList();
    }

    @Override
    public void transaction(List<StoreOperation> operations) {
        if (operations.isEmpty()) {
            return;
        }
        commit(List.copyOf(operations));
    }

    private void applySingle(StoreOperation operation) {
        try {
            commit(List.of(operation));
        } catch (TransactionAbortedException e) {
            throw e.getCause();
        }
    }

    /**
     * Apply every operation or none of them.
     *
     * @throws TransactionAbortedException wrapping the first failing operation's error
     */
    protected abstract void commit(List<StoreOperation> operations);

    protected abstract List<GenomicRecord> findAll(RecordKind kind);
}
