package com.genomics.classifier;

import com.genomics.model.Classification;
import com.genomics.model.Evidence;
import com.genomics.model.GeneRecord;
import com.genomics.model.GeneReference;
import com.genomics.model.MutationRecord;
import com.genomics.model.MutationType;
import com.genomics.model.ReferenceCatalog;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

/**
 * Derives a {@link MutationRecord} from a gene record by comparing it with the
 * reference catalog. Deterministic: the same record, catalog version and rule
 * version always yield an equal result.
 */
@Service
public class MutationClassifier {

    private final ClassifierSettings settings;
    private final Clock clock;

    public MutationClassifier(ClassifierSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    public ClassifierSettings settings() {
        return settings;
    }

    /**
     * Classify a gene record.
     *
     * <ul>
     *   <li>gene not in the catalog: {@code UNKNOWN}, type {@code NONE}</li>
     *   <li>sequence and reference sequence available: first difference decides the type</li>
     *   <li>expected expression range available: outside the tolerance band is
     *       {@code LIKELY_PATHOGENIC} for oncogenes, {@code BENIGN} otherwise</li>
     * </ul>
     * When both signals are available the configured precedence picks one.
     *
     * @param record  the gene record to classify
     * @param catalog the reference catalog to compare against
     * @return a new mutation record stamped with the catalog and rule versions
     */
    public MutationRecord classify(GeneRecord record, ReferenceCatalog catalog) {
        Optional<GeneReference> found = catalog.lookup(record.geneId());
        if (found.isEmpty()) {
            return build(record, catalog, MutationType.NONE, Classification.UNKNOWN, Evidence.NONE, null, null);
        }
        GeneReference reference = found.get();

        boolean sequenceAvailable = record.hasSequence() && reference.hasReferenceSequence();
        boolean expressionAvailable = reference.hasExpectedRange();

        if (sequenceAvailable && (!expressionAvailable || settings.precedence() == EvidencePrecedence.SEQUENCE)) {
            return classifyBySequence(record, reference, catalog);
        }
        if (expressionAvailable) {
            return classifyByExpression(record, reference, catalog);
        }
        return build(record, catalog, MutationType.NONE, Classification.UNKNOWN, Evidence.NONE, null, null);
    }

    private MutationRecord classifyBySequence(GeneRecord record, GeneReference reference, ReferenceCatalog catalog) {
        SequenceDifference difference = SequenceDifference.compare(record.sequence(), reference.referenceSequence());
        Classification classification;
        if (difference.type() == MutationType.NONE) {
            classification = Classification.BENIGN;
        } else if (difference.variants().stream().anyMatch(reference.pathogenicVariants()::contains)) {
            classification = Classification.PATHOGENIC;
        } else if (reference.oncogene()) {
            classification = Classification.LIKELY_PATHOGENIC;
        } else {
            classification = Classification.UNKNOWN;
        }
        return build(record, catalog, difference.type(), classification, Evidence.SEQUENCE,
                     difference.position(), difference.notation());
    }

    private MutationRecord classifyByExpression(GeneRecord record, GeneReference reference, ReferenceCatalog catalog) {
        Classification classification = isOutsideBand(record.expression(), reference) && reference.oncogene()
            ? Classification.LIKELY_PATHOGENIC
            : Classification.BENIGN;
        return build(record, catalog, MutationType.NONE, classification, Evidence.EXPRESSION, null, null);
    }

    boolean isOutsideBand(double expression, GeneReference reference) {
        double margin = (reference.expectedMax() - reference.expectedMin()) * settings.tolerance();
        return expression < reference.expectedMin() - margin || expression > reference.expectedMax() + margin;
    }

    private MutationRecord build(GeneRecord record, ReferenceCatalog catalog, MutationType type,
                                 Classification classification, Evidence evidence,
                                 Integer position, String notation) {
        return new MutationRecord(
            null,
            record.id(),
            type,
            classification,
            evidence,
            position,
            notation,
            catalog.version(),
            settings.ruleVersion(),
            clock.instant()
        );
    }
}
