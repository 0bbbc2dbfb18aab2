package com.genomics.validation;

import com.genomics.error.DuplicateRecordException;
import com.genomics.error.ValidationException;

/**
 * Why a raw row was rejected.
 */
public record ValidationFailure(Kind kind, String field, String message) {

    public enum Kind {
        /** Missing, malformed or out-of-range value. */
        INVALID,
        /** (patient, gene) pair already present and replace was not requested. */
        DUPLICATE
    }

    public static ValidationFailure of(ValidationException e) {
        return new ValidationFailure(Kind.INVALID, e.getField(), e.getReason());
    }

    public static ValidationFailure of(DuplicateRecordException e) {
        return new ValidationFailure(Kind.DUPLICATE, "gene_id", e.getMessage());
    }

    @Override
    public String toString() {
        return kind + " " + field + ": " + message;
    }
}
