package com.genomics.classifier;

/**
 * Which signal decides when a gene record carries both a sequence and an
 * expression value that the catalog can judge.
 */
public enum EvidencePrecedence {
    SEQUENCE,
    EXPRESSION
}
