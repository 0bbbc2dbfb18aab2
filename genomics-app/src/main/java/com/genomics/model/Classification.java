package com.genomics.model;

/**
 * Clinical-significance label of a detected mutation.
 */
public enum Classification {
    BENIGN("benign"),
    LIKELY_PATHOGENIC("likely-pathogenic"),
    PATHOGENIC("pathogenic"),
    UNKNOWN("unknown");

    private final String code;

    Classification(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean isPathogenic() {
        return this == PATHOGENIC || this == LIKELY_PATHOGENIC;
    }

    public static Classification fromCode(String code) {
        for (Classification classification : values()) {
            if (classification.code.equalsIgnoreCase(code) || classification.name().equalsIgnoreCase(code)) {
                return classification;
            }
        }
        throw new IllegalArgumentException("Unknown classification: " + code);
    }
}
