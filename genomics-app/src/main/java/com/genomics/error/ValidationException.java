package com.genomics.error;

/**
 * Malformed or out-of-range input. Raised by record constructors and by the
 * row validator; never touches durable state.
 */
public class ValidationException extends GenomicsException {

    private final String field;

    public ValidationException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    public String getField() {
        return field;
    }

    public String getReason() {
        String message = getMessage();
        return message.substring(field.length() + 2);
    }
}
