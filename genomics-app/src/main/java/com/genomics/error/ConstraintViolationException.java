package com.genomics.error;

/**
 * The patient → gene record → mutation record ownership chain would be broken.
 * Indicates a caller bug; never retried.
 */
public class ConstraintViolationException extends GenomicsException {

    public ConstraintViolationException(String message) {
        super(message);
    }

    public ConstraintViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
