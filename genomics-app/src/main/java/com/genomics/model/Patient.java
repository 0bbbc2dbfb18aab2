package com.genomics.model;

import com.genomics.error.ValidationException;

import java.util.List;

/**
 * A patient and their demographic data. {@code geneIds} lists the genes of the
 * gene records the patient owns; the store fills it in on read and ignores it
 * on write.
 */
public record Patient(
    String id,
    String name,
    Integer age,
    Sex sex,
    ClinicalStage stage,
    String diagnosis,
    List<String> geneIds
) implements GenomicRecord {

    public static final int MAX_AGE = 150;
    public static final int MAX_TEXT_LENGTH = 255;

    public Patient {
        id = Identifiers.requirePatientId("patient_id", id);
        if (age != null && (age < 0 || age > MAX_AGE)) {
            throw new ValidationException("age", "must be between 0 and " + MAX_AGE + ", was " + age);
        }
        name = text("name", name);
        diagnosis = text("diagnosis", diagnosis);
        geneIds = geneIds == null ? List.of() : geneIds.stream().sorted().toList();
    }

    public Patient(String id, String name, Integer age, Sex sex, ClinicalStage stage, String diagnosis) {
        this(id, name, age, sex, stage, diagnosis, List.of());
    }

    public static Patient of(String id) {
        return new Patient(id, null, null, null, null, null);
    }

    @Override
    public RecordKind kind() {
        return RecordKind.PATIENT;
    }

    public Patient withGeneIds(List<String> geneIds) {
        return new Patient(id, name, age, sex, stage, diagnosis, geneIds);
    }

    public Patient withoutGeneIds() {
        return withGeneIds(List.of());
    }

    public String displayName() {
        return name != null ? name : "Unknown";
    }

    private static String text(String field, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.length() > MAX_TEXT_LENGTH) {
            throw new ValidationException(field, "must be at most " + MAX_TEXT_LENGTH + " characters");
        }
        return trimmed;
    }
}
