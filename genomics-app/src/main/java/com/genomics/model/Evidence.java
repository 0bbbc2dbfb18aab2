package com.genomics.model;

/**
 * Which signal a classification was derived from.
 */
public enum Evidence {
    SEQUENCE,
    EXPRESSION,
    NONE
}
