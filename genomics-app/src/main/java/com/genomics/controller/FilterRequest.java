package com.genomics.controller;

import com.genomics.error.ValidationException;
import com.genomics.model.Classification;
import com.genomics.model.ClinicalStage;
import com.genomics.model.Sex;
import com.genomics.query.RecordFilter;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of a {@link RecordFilter}. Conditions set on one node must all
 * hold; {@code anyOf} and {@code not} nest further nodes.
 *
 * <pre>
 * {"diagnosis": "breast carcinoma", "anyOf": [{"gene": "TP53"}, {"gene": "BRCA1"}], "not": {"sex": "M"}}
 * </pre>
 */
public record FilterRequest(
    String patientId,
    String sex,
    String stage,
    Integer minAge,
    Integer maxAge,
    String diagnosis,
    String gene,
    Double minExpression,
    Double maxExpression,
    String classification,
    List<FilterRequest> allOf,
    List<FilterRequest> anyOf,
    FilterRequest not
) {

    public RecordFilter toFilter() {
        List<RecordFilter> conditions = new ArrayList<>();
        if (patientId != null) conditions.add(RecordFilter.patientId(patientId));
        if (sex != null) conditions.add(RecordFilter.sex(Sex.parse(sex)));
        if (stage != null) conditions.add(RecordFilter.stage(ClinicalStage.parse(stage)));
        if (minAge != null || maxAge != null) conditions.add(RecordFilter.ageBetween(minAge, maxAge));
        if (diagnosis != null) conditions.add(RecordFilter.diagnosis(diagnosis));
        if (gene != null) conditions.add(RecordFilter.gene(gene));
        if (minExpression != null || maxExpression != null) {
            conditions.add(RecordFilter.expressionBetween(minExpression, maxExpression));
        }
        if (classification != null) conditions.add(RecordFilter.classification(parseClassification(classification)));
        if (allOf != null) {
            allOf.forEach(node -> conditions.add(node.toFilter()));
        }
        if (anyOf != null && !anyOf.isEmpty()) {
            conditions.add(RecordFilter.anyOf(anyOf.stream().map(FilterRequest::toFilter).toList()));
        }
        if (not != null) conditions.add(RecordFilter.not(not.toFilter()));
        return conditions.isEmpty() ? RecordFilter.all() : RecordFilter.allOf(List.copyOf(conditions));
    }

    private static Classification parseClassification(String value) {
        try {
            return Classification.fromCode(value.trim());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("classification", e.getMessage());
        }
    }
}
