package com.genomics.error;

/**
 * Root of the unchecked exceptions raised by the genomic record core.
 */
public abstract class GenomicsException extends RuntimeException {

    protected GenomicsException(String message) {
        super(message);
    }

    protected GenomicsException(String message, Throwable cause) {
        super(message, cause);
    }
}
