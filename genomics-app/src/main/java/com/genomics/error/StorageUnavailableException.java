package com.genomics.error;

/**
 * The backing store could not be reached, read or written. Surfaced to the
 * caller as-is; the core never retries.
 */
public class StorageUnavailableException extends GenomicsException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
