package com.genomics.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregations keyed by label, each an ordered list of (key, value) pairs.
 * This is the whole contract with the reporting front-end.
 */
public record QueryResult(Map<String, List<ResultEntry>> aggregations) {

    public static final String CLASSIFICATION_COUNTS = "classificationCounts";
    public static final String EXPRESSION_BY_GENE = "expressionByGene";
    public static final String TOP_MUTATED_GENES = "topMutatedGenes";

    public QueryResult {
        Map<String, List<ResultEntry>> copy = new LinkedHashMap<>();
        aggregations.forEach((label, entries) -> copy.put(label, List.copyOf(entries)));
        aggregations = Collections.unmodifiableMap(copy);
    }

    public List<ResultEntry> get(String label) {
        return aggregations.getOrDefault(label, List.of());
    }
}
