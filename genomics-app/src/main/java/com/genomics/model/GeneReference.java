package com.genomics.model;

import com.genomics.error.ValidationException;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Catalog entry for one gene: the reference sequence, the expected expression
 * range and the variants known to be pathogenic.
 */
public record GeneReference(
    String geneId,
    String referenceSequence,
    Double expectedMin,
    Double expectedMax,
    boolean oncogene,
    Set<String> pathogenicVariants
) {

    public GeneReference {
        geneId = Identifiers.requireGeneId("gene_id", geneId);
        referenceSequence = GeneRecord.normalizeSequence("reference_sequence", referenceSequence);
        if ((expectedMin == null) != (expectedMax == null)) {
            throw new ValidationException("expected_range", "both bounds are required for " + geneId);
        }
        if (expectedMin != null
                && (!Double.isFinite(expectedMin) || !Double.isFinite(expectedMax) || expectedMin > expectedMax)) {
            throw new ValidationException("expected_range",
                "invalid range [" + expectedMin + ", " + expectedMax + "] for " + geneId);
        }
        pathogenicVariants = pathogenicVariants == null ? Set.of() : pathogenicVariants.stream()
            .filter(v -> v != null && !v.isBlank())
            .map(GeneReference::normalizeVariant)
            .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Variants are matched against classifier notation: upper-case bases with
     * lower-case {@code ins}/{@code del}, e.g. {@code A5T}, {@code 12insTT}.
     */
    static String normalizeVariant(String variant) {
        return variant.trim().toUpperCase(Locale.ROOT)
            .replace("INS", "ins")
            .replace("DEL", "del");
    }

    public boolean hasReferenceSequence() {
        return referenceSequence != null;
    }

    public boolean hasExpectedRange() {
        return expectedMin != null;
    }
}
