package com.genomics.service;

import com.genomics.model.Classification;

import java.util.List;

/**
 * Per-row results of an import, in input order.
 */
public record ImportReport(List<RowResult> rows) {

    public enum Status { IMPORTED, REPLACED, INVALID, DUPLICATE, FAILED }

    public record RowResult(
        int index,
        Status status,
        String patientId,
        String geneId,
        Classification classification,
        String message
    ) {
        public boolean isSuccess() {
            return status == Status.IMPORTED || status == Status.REPLACED;
        }
    }

    public ImportReport {
        rows = List.copyOf(rows);
    }

    public long succeeded() {
        return rows.stream().filter(RowResult::isSuccess).count();
    }

    public long failed() {
        return rows.size() - succeeded();
    }

    public List<RowResult> failures() {
        return rows.stream().filter(r -> !r.isSuccess()).toList();
    }

    public long count(Status status) {
        return rows.stream().filter(r -> r.status() == status).count();
    }
}
