package com.genomics.model;

public enum MutationType {
    SUBSTITUTION,
    INSERTION,
    DELETION,
    NONE
}
