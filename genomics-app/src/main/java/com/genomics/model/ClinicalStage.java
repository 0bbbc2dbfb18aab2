package com.genomics.model;

import com.genomics.error.ValidationException;

import java.util.Locale;

public enum ClinicalStage {
    STAGE_0("0", "0"),
    STAGE_I("I", "1"),
    STAGE_II("II", "2"),
    STAGE_III("III", "3"),
    STAGE_IV("IV", "4");

    private final String roman;
    private final String arabic;

    ClinicalStage(String roman, String arabic) {
        this.roman = roman;
        this.arabic = arabic;
    }

    /**
     * Accepts "II", "2", "2.0", "Stage II" or the enum name.
     */
    public static ClinicalStage parse(String value) {
        String normalized = value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
        if (normalized.startsWith("STAGE_")) {
            normalized = normalized.substring(6);
        } else if (normalized.startsWith("STAGE")) {
            normalized = normalized.substring(5).trim();
        }
        if (normalized.endsWith(".0")) {
            normalized = normalized.substring(0, normalized.length() - 2);
        }
        for (ClinicalStage stage : values()) {
            if (stage.roman.equals(normalized) || stage.arabic.equals(normalized)) {
                return stage;
            }
        }
        throw new ValidationException("stage", "unknown value '" + value + "'");
    }
}
