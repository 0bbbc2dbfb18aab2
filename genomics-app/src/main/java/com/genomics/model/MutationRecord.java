package com.genomics.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Classification of one gene record against one catalog version. Produced only
 * by the classifier; a newer derivation supersedes it rather than editing it.
 * {@code createdAt} is informational and takes no part in equality.
 */
public record MutationRecord(
    String id,
    String geneRecordId,
    MutationType type,
    Classification classification,
    Evidence evidence,
    Integer position,
    String notation,
    String catalogVersion,
    String ruleVersion,
    Instant createdAt
) implements GenomicRecord {

    public MutationRecord {
        Objects.requireNonNull(geneRecordId, "geneRecordId");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(classification, "classification");
        Objects.requireNonNull(evidence, "evidence");
        Objects.requireNonNull(catalogVersion, "catalogVersion");
        Objects.requireNonNull(ruleVersion, "ruleVersion");
        GeneRecordKey.parse(geneRecordId);
        if (id == null) {
            id = idFor(geneRecordId, catalogVersion, ruleVersion);
        }
    }

    public static String idFor(String geneRecordId, String catalogVersion, String ruleVersion) {
        return geneRecordId + "|" + catalogVersion + "|" + ruleVersion;
    }

    @Override
    public RecordKind kind() {
        return RecordKind.MUTATION_RECORD;
    }

    public GeneRecordKey geneRecordKey() {
        return GeneRecordKey.parse(geneRecordId);
    }

    public boolean isMutated() {
        return type != MutationType.NONE || classification.isPathogenic();
    }

    public boolean isDerivedFrom(String catalogVersion, String ruleVersion) {
        return this.catalogVersion.equals(catalogVersion) && this.ruleVersion.equals(ruleVersion);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MutationRecord other)) return false;
        return id.equals(other.id)
            && geneRecordId.equals(other.geneRecordId)
            && type == other.type
            && classification == other.classification
            && evidence == other.evidence
            && Objects.equals(position, other.position)
            && Objects.equals(notation, other.notation)
            && catalogVersion.equals(other.catalogVersion)
            && ruleVersion.equals(other.ruleVersion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, geneRecordId, type, classification, evidence, position, notation,
                            catalogVersion, ruleVersion);
    }
}
