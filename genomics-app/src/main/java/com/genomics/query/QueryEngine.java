package com.genomics.query;

import com.genomics.model.Classification;
import com.genomics.model.GeneRecord;
import com.genomics.model.MutationRecord;
import com.genomics.model.Patient;
import com.genomics.store.GenomicSnapshot;
import com.genomics.store.GenomicStore;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Filters and aggregates stored records for reporting. Reads only through
 * {@link GenomicStore}, so results do not depend on the backend.
 */
@Service
public class QueryEngine {

    private static final Comparator<Map.Entry<String, Long>> BY_COUNT_DESC_THEN_KEY =
        Map.Entry.<String, Long>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey());

    private final GenomicStore store;

    public QueryEngine(GenomicStore store) {
        this.store = store;
    }

    /**
     * Run every aggregation over the rows matching the query's filter.
     *
     * <ul>
     *   <li>{@code classificationCounts}: all classifications, count descending then label ascending</li>
     *   <li>{@code expressionByGene}: {@link ExpressionStats} per gene, gene ascending</li>
     *   <li>{@code topMutatedGenes}: mutated row count per gene, count descending then gene ascending,
     *       at most {@code topN} entries</li>
     * </ul>
     */
    public QueryResult query(ReportQuery query) {
        List<GenomicRow> rows = rows(query.filter()).stream()
            .filter(GenomicRow::hasGeneRecord)
            .toList();

        Map<String, List<ResultEntry>> aggregations = new LinkedHashMap<>();
        aggregations.put(QueryResult.CLASSIFICATION_COUNTS, classificationCounts(rows));
        aggregations.put(QueryResult.EXPRESSION_BY_GENE, expressionByGene(rows));
        aggregations.put(QueryResult.TOP_MUTATED_GENES, topMutatedGenes(rows, query.topN()));
        return new QueryResult(aggregations);
    }

    /**
     * Joined rows matching the filter, ordered by gene record id. All rows come
     * from one committed state of the store.
     */
    public List<GenomicRow> rows(RecordFilter filter) {
        GenomicSnapshot snapshot = store.snapshot();
        Map<String, MutationRecord> mutations = snapshot.mutationRecords().stream()
            .collect(Collectors.toMap(MutationRecord::geneRecordId, Function.identity(), (a, b) -> a));
        Map<String, List<GeneRecord>> genesByPatient = new HashMap<>();
        for (GeneRecord geneRecord : snapshot.geneRecords()) {
            genesByPatient.computeIfAbsent(geneRecord.patientId(), k -> new ArrayList<>()).add(geneRecord);
        }

        List<GenomicRow> rows = new ArrayList<>();
        for (Patient patient : snapshot.patients()) {
            List<GeneRecord> owned = genesByPatient.getOrDefault(patient.id(), List.of());
            if (owned.isEmpty()) {
                rows.add(new GenomicRow(patient, null, null));
            }
            for (GeneRecord geneRecord : owned) {
                rows.add(new GenomicRow(patient, geneRecord, mutations.get(geneRecord.id())));
            }
        }
        return rows.stream()
            .filter(filter::test)
            .sorted(Comparator.comparing(GenomicRow::sortKey))
            .toList();
    }

    /**
     * Distinct patients with at least one matching row, ordered by id.
     */
    public List<Patient> patients(RecordFilter filter) {
        Map<String, Patient> byId = new TreeMap<>();
        rows(filter).forEach(row -> byId.putIfAbsent(row.patient().id(), row.patient()));
        return List.copyOf(byId.values());
    }

    List<ResultEntry> classificationCounts(List<GenomicRow> rows) {
        Map<Classification, Long> counts = new EnumMap<>(Classification.class);
        for (Classification classification : Classification.values()) {
            counts.put(classification, 0L);
        }
        rows.forEach(row -> counts.merge(row.classification(), 1L, Long::sum));

        Map<String, Long> byCode = new HashMap<>();
        counts.forEach((classification, count) -> byCode.put(classification.code(), count));
        return sortedByCount(byCode, Integer.MAX_VALUE);
    }

    List<ResultEntry> expressionByGene(List<GenomicRow> rows) {
        Map<String, ExpressionStats.Accumulator> byGene = new TreeMap<>();
        rows.forEach(row -> byGene.computeIfAbsent(row.geneRecord().geneId(), k -> new ExpressionStats.Accumulator())
            .add(row.geneRecord().expression()));
        List<ResultEntry> entries = new ArrayList<>();
        byGene.forEach((gene, stats) -> entries.add(new ResultEntry(gene, stats.result())));
        return entries;
    }

    List<ResultEntry> topMutatedGenes(List<GenomicRow> rows, int topN) {
        Map<String, Long> counts = new HashMap<>();
        rows.stream()
            .filter(GenomicRow::isMutated)
            .forEach(row -> counts.merge(row.geneRecord().geneId(), 1L, Long::sum));
        return sortedByCount(counts, topN);
    }

    private static List<ResultEntry> sortedByCount(Map<String, Long> counts, int limit) {
        return counts.entrySet().stream()
            .sorted(BY_COUNT_DESC_THEN_KEY)
            .limit(limit)
            .map(e -> new ResultEntry(e.getKey(), e.getValue()))
            .toList();
    }
}
