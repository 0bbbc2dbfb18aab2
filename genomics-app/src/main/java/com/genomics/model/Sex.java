package com.genomics.model;

import com.genomics.error.ValidationException;

import java.util.Locale;

public enum Sex {
    FEMALE("F"),
    MALE("M"),
    OTHER("O");

    private final String code;

    Sex(String code) {
        this.code = code;
    }

    /**
     * Accepts single-letter codes and full names in any case.
     */
    public static Sex parse(String value) {
        String normalized = value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
        for (Sex sex : values()) {
            if (sex.code.equals(normalized) || sex.name().equals(normalized)) {
                return sex;
            }
        }
        throw new ValidationException("sex", "unknown value '" + value + "'");
    }
}
