package com.genomics.validation;

/**
 * Result of validating one raw row: either {@code row} or {@code failure} is set.
 *
 * @param index zero-based position of the row in its batch
 */
public record RowOutcome(int index, ValidatedRow row, ValidationFailure failure) {

    public static RowOutcome success(int index, ValidatedRow row) {
        return new RowOutcome(index, row, null);
    }

    public static RowOutcome failure(int index, ValidationFailure failure) {
        return new RowOutcome(index, null, failure);
    }

    public boolean isValid() {
        return failure == null;
    }
}
