package com.genomics.classifier;

import com.genomics.model.MutationType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Position-by-position comparison of a sample sequence against its reference.
 *
 * @param type      kind of change, {@link MutationType#NONE} when identical
 * @param position  1-based position of the first difference, null when identical
 * @param notation  e.g. {@code A12G}, {@code C3T,G7A}, {@code 12insTT}, {@code 5delA}
 */
record SequenceDifference(MutationType type, Integer position, String notation) {

    static final SequenceDifference IDENTICAL = new SequenceDifference(MutationType.NONE, null, null);

    static SequenceDifference compare(String sample, String reference) {
        if (sample.equals(reference)) {
            return IDENTICAL;
        }
        int shared = Math.min(sample.length(), reference.length());
        int first = 0;
        while (first < shared && sample.charAt(first) == reference.charAt(first)) {
            first++;
        }

        if (sample.length() == reference.length()) {
            List<String> substitutions = new ArrayList<>();
            for (int i = first; i < shared; i++) {
                if (sample.charAt(i) != reference.charAt(i)) {
                    substitutions.add("" + reference.charAt(i) + (i + 1) + sample.charAt(i));
                }
            }
            return new SequenceDifference(MutationType.SUBSTITUTION, first + 1, String.join(",", substitutions));
        }

        int delta = Math.abs(sample.length() - reference.length());
        if (sample.length() > reference.length()) {
            String inserted = sample.substring(first, first + delta);
            return new SequenceDifference(MutationType.INSERTION, first + 1, (first + 1) + "ins" + inserted);
        }
        String deleted = reference.substring(first, first + delta);
        return new SequenceDifference(MutationType.DELETION, first + 1, (first + 1) + "del" + deleted);
    }

    List<String> variants() {
        return notation == null ? List.of() : Arrays.asList(notation.split(","));
    }
}
