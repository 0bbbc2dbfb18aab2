package com.genomics.model;

import com.genomics.error.ValidationException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Identifier rules shared by patients and genes. The allowed alphabet keeps
 * ':' and '|' free for composite record ids.
 */
public final class Identifiers {

    public static final int MAX_LENGTH = 64;
    public static final int MAX_VERSION_LENGTH = 128;

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

    private Identifiers() {
    }

    public static String requirePatientId(String field, String value) {
        return require(field, value);
    }

    /**
     * Gene symbols are case-insensitive; the canonical form is upper case.
     */
    public static String requireGeneId(String field, String value) {
        return require(field, value).toUpperCase(Locale.ROOT);
    }

    /**
     * Catalog and rule versions become part of mutation record ids.
     */
    public static String requireVersion(String field, String value) {
        return require(field, value, MAX_VERSION_LENGTH);
    }

    private static String require(String field, String value) {
        return require(field, value, MAX_LENGTH);
    }

    private static String require(String field, String value, int maxLength) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, "must not be empty");
        }
        String trimmed = value.trim();
        if (trimmed.length() > maxLength) {
            throw new ValidationException(field, "must be at most " + maxLength + " characters");
        }
        if (!IDENTIFIER.matcher(trimmed).matches()) {
            throw new ValidationException(field, "invalid identifier '" + trimmed + "'");
        }
        return trimmed;
    }
}
