package com.genomics.model;

import com.genomics.error.ValidationException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * One gene measurement for one patient: an expression value and, optionally,
 * the raw nucleotide sequence read for that gene.
 */
public record GeneRecord(
    String patientId,
    String geneId,
    double expression,
    String sequence
) implements GenomicRecord {

    private static final Pattern NUCLEOTIDES = Pattern.compile("[ACGTN]+");

    public GeneRecord {
        patientId = Identifiers.requirePatientId("patient_id", patientId);
        geneId = Identifiers.requireGeneId("gene_id", geneId);
        if (!Double.isFinite(expression)) {
            throw new ValidationException("expression", "must be a finite number, was " + expression);
        }
        sequence = normalizeSequence("sequence", sequence);
    }

    public GeneRecord(String patientId, String geneId, double expression) {
        this(patientId, geneId, expression, null);
    }

    @Override
    public RecordKind kind() {
        return RecordKind.GENE_RECORD;
    }

    @Override
    public String id() {
        return key().recordId();
    }

    public GeneRecordKey key() {
        return new GeneRecordKey(patientId, geneId);
    }

    public boolean hasSequence() {
        return sequence != null;
    }

    /**
     * Upper-cased nucleotide string, null when blank.
     */
    static String normalizeSequence(String field, String sequence) {
        if (sequence == null || sequence.isBlank()) {
            return null;
        }
        String upper = sequence.trim().toUpperCase(Locale.ROOT);
        if (!NUCLEOTIDES.matcher(upper).matches()) {
            throw new ValidationException(field, "may only contain A, C, G, T or N");
        }
        return upper;
    }
}
