package com.genomics.validation;

public enum ErrorPolicy {
    /** Report every row, valid or not. */
    COLLECT_ALL,
    /** End the batch after the first failing row, which is still reported. */
    STOP_AT_FIRST
}
