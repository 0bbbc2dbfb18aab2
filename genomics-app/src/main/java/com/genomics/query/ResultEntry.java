package com.genomics.query;

/**
 * One (key, value) pair of an aggregation.
 */
public record ResultEntry(String key, Object value) {
}
