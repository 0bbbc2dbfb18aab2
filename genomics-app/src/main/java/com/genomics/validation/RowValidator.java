package com.genomics.validation;

import com.genomics.error.DuplicateRecordException;
import com.genomics.error.ValidationException;
import com.genomics.model.ClinicalStage;
import com.genomics.model.GeneRecord;
import com.genomics.model.GeneRecordKey;
import com.genomics.model.Patient;
import com.genomics.model.Sex;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Turns raw rows (field name to untyped value, as produced by CSV parsing)
 * into typed records. Pure: never reads or writes the store itself; duplicate
 * detection asks the caller-supplied lookup.
 */
@Component
public class RowValidator {

    static final String[] PATIENT_ID = {"patient_id", "patientId", "patient"};
    static final String[] NAME = {"name"};
    static final String[] AGE = {"age"};
    static final String[] SEX = {"sex", "gender"};
    static final String[] STAGE = {"stage", "clinical_stage"};
    static final String[] DIAGNOSIS = {"diagnosis"};
    static final String[] GENE_ID = {"gene_id", "geneId", "gene"};
    static final String[] EXPRESSION = {"expression", "expression_value", "expressionValue"};
    static final String[] SEQUENCE = {"sequence"};

    /**
     * Validate a single row.
     *
     * @param rawRow field name to value; values may be strings or already-typed
     * @return the typed records, or the first problem found
     */
    public RowOutcome validate(Map<String, ?> rawRow) {
        return validate(0, rawRow);
    }

    /**
     * Validate a batch lazily. Rows are only read as the stream is consumed, so
     * a malformed row never prevents later rows from being reported.
     *
     * @param rows         raw rows in input order
     * @param existingKeys lookup for (patient, gene) pairs already in the target store
     * @param replace      when true, existing pairs are not reported as duplicates
     * @param policy       whether to stop after the first failure
     * @return one outcome per consumed row, in input order
     */
    public Stream<RowOutcome> validateAll(Iterable<? extends Map<String, ?>> rows,
                                          Predicate<GeneRecordKey> existingKeys,
                                          boolean replace,
                                          ErrorPolicy policy) {
        Iterator<RowOutcome> outcomes = new OutcomeIterator(rows.iterator(), existingKeys, replace, policy);
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(outcomes, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    public Stream<RowOutcome> validateAll(Iterable<? extends Map<String, ?>> rows) {
        return validateAll(rows, key -> false, false, ErrorPolicy.COLLECT_ALL);
    }

    private RowOutcome validate(int index, Map<String, ?> rawRow) {
        if (rawRow == null) {
            return RowOutcome.failure(index, new ValidationFailure(ValidationFailure.Kind.INVALID, "row", "row is empty"));
        }
        try {
            Patient patient = new Patient(
                text(rawRow, PATIENT_ID),
                text(rawRow, NAME),
                integer(rawRow, AGE),
                optional(text(rawRow, SEX), Sex::parse),
                optional(text(rawRow, STAGE), ClinicalStage::parse),
                text(rawRow, DIAGNOSIS)
            );
            GeneRecord geneRecord = null;
            String geneId = text(rawRow, GENE_ID);
            if (geneId != null) {
                Double expression = number(rawRow, EXPRESSION);
                if (expression == null) {
                    throw new ValidationException(EXPRESSION[0], "is required when gene_id is present");
                }
                geneRecord = new GeneRecord(patient.id(), geneId, expression, text(rawRow, SEQUENCE));
            } else if (number(rawRow, EXPRESSION) != null || text(rawRow, SEQUENCE) != null) {
                throw new ValidationException(GENE_ID[0], "is required when expression or sequence is present");
            }
            return RowOutcome.success(index, new ValidatedRow(patient, geneRecord));
        } catch (ValidationException e) {
            return RowOutcome.failure(index, ValidationFailure.of(e));
        }
    }

    // ========== FIELD COERCION ==========

    static String text(Map<String, ?> row, String[] names) {
        for (String name : names) {
            String value = text(name, row.get(name));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    /**
     * A scalar field value as trimmed text; numbers and booleans are accepted
     * as their string form, blank is null.
     *
     * @throws ValidationException if the value is a JSON object or array
     */
    public static String text(String field, Object value) {
        if (value instanceof Map<?, ?> || value instanceof Collection<?>) {
            throw new ValidationException(field, "must be a single value");
        }
        if (value == null || String.valueOf(value).isBlank()) {
            return null;
        }
        return String.valueOf(value).trim();
    }

    static Integer integer(Map<String, ?> row, String[] names) {
        String value = text(row, names);
        if (value == null) {
            return null;
        }
        try {
            return new BigDecimal(value).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new ValidationException(names[0], "not a whole number: '" + value + "'");
        }
    }

    static Double number(Map<String, ?> row, String[] names) {
        for (String name : names) {
            Object value = row.get(name);
            if (value instanceof Number n) {
                return n.doubleValue();
            }
        }
        String value = text(row, names);
        if (value == null) {
            return null;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ValidationException(names[0], "not a number: '" + value + "'");
        }
    }

    private static <T> T optional(String value, Function<String, T> parser) {
        return value == null ? null : parser.apply(value);
    }

    private class OutcomeIterator implements Iterator<RowOutcome> {

        private final Iterator<? extends Map<String, ?>> rows;
        private final Predicate<GeneRecordKey> existingKeys;
        private final boolean replace;
        private final ErrorPolicy policy;
        private final Set<GeneRecordKey> seen = new HashSet<>();
        private int index;
        private boolean stopped;

        OutcomeIterator(Iterator<? extends Map<String, ?>> rows, Predicate<GeneRecordKey> existingKeys,
                        boolean replace, ErrorPolicy policy) {
            this.rows = rows;
            this.existingKeys = existingKeys;
            this.replace = replace;
            this.policy = policy;
        }

        @Override
        public boolean hasNext() {
            return !stopped && rows.hasNext();
        }

        @Override
        public RowOutcome next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            RowOutcome outcome = checkDuplicate(validate(index++, rows.next()));
            if (!outcome.isValid() && policy == ErrorPolicy.STOP_AT_FIRST) {
                stopped = true;
            }
            return outcome;
        }

        private RowOutcome checkDuplicate(RowOutcome outcome) {
            if (!outcome.isValid() || !outcome.row().hasGeneRecord()) {
                return outcome;
            }
            GeneRecordKey key = outcome.row().key();
            boolean duplicate = !seen.add(key) || existingKeys.test(key);
            if (duplicate && !replace) {
                return RowOutcome.failure(outcome.index(), ValidationFailure.of(new DuplicateRecordException(key)));
            }
            return outcome;
        }
    }
}
