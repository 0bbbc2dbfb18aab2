package com.genomics.classifier;

import com.genomics.model.Identifiers;

import java.util.Objects;

/**
 * @param tolerance   widening of the expected expression range, as a fraction of its width
 * @param ruleVersion identifier stamped on every derived mutation record
 * @param precedence  tie-break between sequence and expression evidence
 */
public record ClassifierSettings(double tolerance, String ruleVersion, EvidencePrecedence precedence) {

    public static final String DEFAULT_RULE_VERSION = "rules-1";
    public static final double DEFAULT_TOLERANCE = 0.1;

    public ClassifierSettings {
        if (!Double.isFinite(tolerance) || tolerance < 0) {
            throw new IllegalArgumentException("tolerance must be a non-negative number, was " + tolerance);
        }
        ruleVersion = Identifiers.requireVersion("rule_version", ruleVersion);
        Objects.requireNonNull(precedence, "precedence");
    }

    public static ClassifierSettings defaults() {
        return new ClassifierSettings(DEFAULT_TOLERANCE, DEFAULT_RULE_VERSION, EvidencePrecedence.SEQUENCE);
    }
}
