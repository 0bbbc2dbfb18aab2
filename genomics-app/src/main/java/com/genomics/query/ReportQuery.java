package com.genomics.query;

import java.util.Objects;

/**
 * @param filter rows to aggregate
 * @param topN   how many genes the most-mutated ranking keeps
 */
public record ReportQuery(RecordFilter filter, int topN) {

    public static final int DEFAULT_TOP_N = 10;

    public ReportQuery {
        Objects.requireNonNull(filter, "filter");
        if (topN < 0) {
            throw new IllegalArgumentException("topN must not be negative");
        }
    }

    public static ReportQuery of(RecordFilter filter) {
        return new ReportQuery(filter, DEFAULT_TOP_N);
    }
}
