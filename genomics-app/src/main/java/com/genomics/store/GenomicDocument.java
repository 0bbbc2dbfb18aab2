package com.genomics.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.genomics.model.Classification;
import com.genomics.model.ClinicalStage;
import com.genomics.model.Evidence;
import com.genomics.model.GeneRecord;
import com.genomics.model.MutationRecord;
import com.genomics.model.MutationType;
import com.genomics.model.Patient;
import com.genomics.model.Sex;

import java.time.Instant;
import java.util.List;

/**
 * On-disk layout of the file backend: three collections ordered by id plus a
 * schema version for forward migration.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record GenomicDocument(
    Integer schemaVersion,
    List<PatientEntry> patients,
    List<GeneRecordEntry> geneRecords,
    List<MutationRecordEntry> mutationRecords
) {

    static final int CURRENT_SCHEMA_VERSION = 1;

    static GenomicDocument from(GenomicDataset dataset) {
        return new GenomicDocument(
            CURRENT_SCHEMA_VERSION,
            dataset.patients().stream().map(PatientEntry::from).toList(),
            dataset.geneRecords().stream().map(GeneRecordEntry::from).toList(),
            dataset.mutationRecords().stream().map(MutationRecordEntry::from).toList()
        );
    }

    GenomicDataset toDataset() {
        return GenomicDataset.of(
            patients == null ? List.of() : patients.stream().map(PatientEntry::toRecord).toList(),
            geneRecords == null ? List.of() : geneRecords.stream().map(GeneRecordEntry::toRecord).toList(),
            mutationRecords == null ? List.of() : mutationRecords.stream().map(MutationRecordEntry::toRecord).toList()
        );
    }

    /**
     * Documents written before versioning carry no schema version; they share
     * the version 1 layout.
     */
    int effectiveSchemaVersion() {
        return schemaVersion == null ? CURRENT_SCHEMA_VERSION : schemaVersion;
    }

    record PatientEntry(String id, String name, Integer age, Sex sex, ClinicalStage stage, String diagnosis) {

        static PatientEntry from(Patient patient) {
            return new PatientEntry(patient.id(), patient.name(), patient.age(), patient.sex(),
                                    patient.stage(), patient.diagnosis());
        }

        Patient toRecord() {
            return new Patient(id, name, age, sex, stage, diagnosis);
        }
    }

    record GeneRecordEntry(String id, String patientId, String geneId, double expression, String sequence) {

        static GeneRecordEntry from(GeneRecord record) {
            return new GeneRecordEntry(record.id(), record.patientId(), record.geneId(),
                                       record.expression(), record.sequence());
        }

        GeneRecord toRecord() {
            return new GeneRecord(patientId, geneId, expression, sequence);
        }
    }

    record MutationRecordEntry(
        String id,
        String geneRecordId,
        MutationType type,
        Classification classification,
        Evidence evidence,
        Integer position,
        String notation,
        String catalogVersion,
        String ruleVersion,
        String createdAt
    ) {

        static MutationRecordEntry from(MutationRecord record) {
            return new MutationRecordEntry(record.id(), record.geneRecordId(), record.type(),
                record.classification(), record.evidence(), record.position(), record.notation(),
                record.catalogVersion(), record.ruleVersion(),
                record.createdAt() != null ? record.createdAt().toString() : null);
        }

        MutationRecord toRecord() {
            return new MutationRecord(id, geneRecordId, type, classification, evidence, position, notation,
                catalogVersion, ruleVersion, createdAt != null ? Instant.parse(createdAt) : null);
        }
    }
}
