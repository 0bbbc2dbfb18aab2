package com.genomics.query;

import com.genomics.model.Classification;
import com.genomics.model.ClinicalStage;
import com.genomics.model.Sex;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Predicate over joined rows. Filters compose with {@link #and}, {@link #or}
 * and {@link #negate}.
 */
@FunctionalInterface
public interface RecordFilter {

    boolean test(GenomicRow row);

    default RecordFilter and(RecordFilter other) {
        return row -> test(row) && other.test(row);
    }

    default RecordFilter or(RecordFilter other) {
        return row -> test(row) || other.test(row);
    }

    default RecordFilter negate() {
        return row -> !test(row);
    }

    static RecordFilter not(RecordFilter filter) {
        return filter.negate();
    }

    static RecordFilter all() {
        return row -> true;
    }

    static RecordFilter allOf(RecordFilter... filters) {
        return allOf(Arrays.asList(filters));
    }

    static RecordFilter allOf(List<RecordFilter> filters) {
        return row -> filters.stream().allMatch(f -> f.test(row));
    }

    static RecordFilter anyOf(RecordFilter... filters) {
        return anyOf(Arrays.asList(filters));
    }

    static RecordFilter anyOf(List<RecordFilter> filters) {
        return row -> filters.stream().anyMatch(f -> f.test(row));
    }

    // ========== PATIENT ATTRIBUTES ==========

    static RecordFilter patientId(String id) {
        return row -> row.patient().id().equals(id);
    }

    static RecordFilter sex(Sex sex) {
        return row -> row.patient().sex() == sex;
    }

    static RecordFilter stage(ClinicalStage stage) {
        return row -> row.patient().stage() == stage;
    }

    /**
     * Inclusive bounds; either may be null for an open range. Patients with no
     * recorded age never match.
     */
    static RecordFilter ageBetween(Integer min, Integer max) {
        return row -> {
            Integer age = row.patient().age();
            return age != null && (min == null || age >= min) && (max == null || age <= max);
        };
    }

    static RecordFilter diagnosis(String diagnosis) {
        String wanted = diagnosis.trim().toLowerCase(Locale.ROOT);
        return row -> row.patient().diagnosis() != null
            && row.patient().diagnosis().toLowerCase(Locale.ROOT).equals(wanted);
    }

    // ========== GENE RECORDS ==========

    static RecordFilter gene(String geneId) {
        String wanted = geneId.trim().toUpperCase(Locale.ROOT);
        return row -> row.hasGeneRecord() && row.geneRecord().geneId().equals(wanted);
    }

    /**
     * Inclusive bounds; either may be null for an open range.
     */
    static RecordFilter expressionBetween(Double min, Double max) {
        return row -> {
            if (!row.hasGeneRecord()) {
                return false;
            }
            double value = row.geneRecord().expression();
            return (min == null || value >= min) && (max == null || value <= max);
        };
    }

    static RecordFilter classification(Classification classification) {
        return row -> row.hasGeneRecord() && row.classification() == classification;
    }
}
