package com.genomics.config;

import com.genomics.model.GeneReference;
import com.genomics.model.ReferenceCatalog;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Reference catalog loaded at startup.
 * Define genes in application.yml under 'genomics.catalog.genes'
 */
@Configuration
@ConfigurationProperties(prefix = "genomics.catalog")
public class CatalogConfig {

    private String version = "catalog-1";
    private boolean reclassifyOnStartup = true;
    private List<GeneDefinition> genes = new ArrayList<>();

    public ReferenceCatalog toCatalog() {
        return new ReferenceCatalog(version, genes.stream().map(GeneDefinition::toReference).toList());
    }

    public String getVersion() { return version; }
    public void setVersion(String version) { this.version = version; }

    public boolean isReclassifyOnStartup() { return reclassifyOnStartup; }
    public void setReclassifyOnStartup(boolean reclassifyOnStartup) { this.reclassifyOnStartup = reclassifyOnStartup; }

    public List<GeneDefinition> getGenes() { return genes; }
    public void setGenes(List<GeneDefinition> genes) { this.genes = genes; }

    /**
     * Mutable class for Spring Boot configuration binding
     */
    public static class GeneDefinition {
        private String geneId;
        private String referenceSequence;
        private Double expectedMin;
        private Double expectedMax;
        private boolean oncogene;
        private List<String> pathogenicVariants = new ArrayList<>();

        public GeneReference toReference() {
            return new GeneReference(
                geneId, referenceSequence, expectedMin, expectedMax, oncogene,
                pathogenicVariants != null ? new LinkedHashSet<>(pathogenicVariants) : null
            );
        }

        // Getters and setters for Spring Boot binding
        public String getGeneId() { return geneId; }
        public void setGeneId(String geneId) { this.geneId = geneId; }

        public String getReferenceSequence() { return referenceSequence; }
        public void setReferenceSequence(String referenceSequence) { this.referenceSequence = referenceSequence; }

        public Double getExpectedMin() { return expectedMin; }
        public void setExpectedMin(Double expectedMin) { this.expectedMin = expectedMin; }

        public Double getExpectedMax() { return expectedMax; }
        public void setExpectedMax(Double expectedMax) { this.expectedMax = expectedMax; }

        public boolean isOncogene() { return oncogene; }
        public void setOncogene(boolean oncogene) { this.oncogene = oncogene; }

        public List<String> getPathogenicVariants() { return pathogenicVariants; }
        public void setPathogenicVariants(List<String> pathogenicVariants) { this.pathogenicVariants = pathogenicVariants; }
    }
}
