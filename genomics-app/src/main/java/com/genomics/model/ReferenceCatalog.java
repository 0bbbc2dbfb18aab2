package com.genomics.model;

import com.genomics.error.ValidationException;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Versioned reference values that mutation detection compares against.
 * Immutable; replacing the catalog means building a new one.
 */
public final class ReferenceCatalog {

    private final String version;
    private final Map<String, GeneReference> genes;

    public ReferenceCatalog(String version, Collection<GeneReference> references) {
        this.version = Identifiers.requireVersion("version", version);
        Map<String, GeneReference> byGene = new TreeMap<>();
        for (GeneReference reference : references) {
            if (byGene.put(reference.geneId(), reference) != null) {
                throw new ValidationException("genes", "duplicate catalog entry for gene " + reference.geneId());
            }
        }
        this.genes = Collections.unmodifiableMap(byGene);
    }

    public static ReferenceCatalog empty(String version) {
        return new ReferenceCatalog(version, List.of());
    }

    public String version() {
        return version;
    }

    public Optional<GeneReference> lookup(String geneId) {
        return geneId == null ? Optional.empty() : Optional.ofNullable(genes.get(geneId.toUpperCase(Locale.ROOT)));
    }

    public Collection<GeneReference> genes() {
        return genes.values();
    }

    public int size() {
        return genes.size();
    }

    @Override
    public String toString() {
        return "ReferenceCatalog[version=" + version + ", genes=" + genes.keySet() + "]";
    }
}
