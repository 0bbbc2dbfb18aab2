package com.genomics.service;

import com.genomics.validation.ErrorPolicy;

/**
 * @param replace     supersede existing (patient, gene) records instead of reporting duplicates
 * @param errorPolicy whether an import stops at its first failing row
 */
public record ImportOptions(boolean replace, ErrorPolicy errorPolicy) {

    public static ImportOptions defaults() {
        return new ImportOptions(false, ErrorPolicy.COLLECT_ALL);
    }

    public static ImportOptions replacing() {
        return new ImportOptions(true, ErrorPolicy.COLLECT_ALL);
    }
}
