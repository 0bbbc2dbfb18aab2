package com.genomics.model;

/**
 * Common view of the three persisted record types.
 */
public interface GenomicRecord {

    RecordKind kind();

    String id();
}
