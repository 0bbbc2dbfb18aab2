package com.genomics.service;

import com.genomics.classifier.MutationClassifier;
import com.genomics.config.CatalogConfig;
import com.genomics.error.ValidationException;
import com.genomics.model.GeneRecord;
import com.genomics.model.MutationRecord;
import com.genomics.model.ReferenceCatalog;
import com.genomics.store.GenomicSnapshot;
import com.genomics.store.GenomicStore;
import com.genomics.store.StoreOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Owns the process-wide reference catalog. Swapping it re-derives every
 * mutation record in one transaction before the new catalog becomes current.
 */
@Service
public class CatalogService {

    private static final Logger log = LoggerFactory.getLogger(CatalogService.class);

    private final GenomicStore store;
    private final MutationClassifier classifier;
    private final boolean reclassifyOnStartup;
    private final AtomicReference<ReferenceCatalog> current;

    public CatalogService(GenomicStore store, MutationClassifier classifier, CatalogConfig catalogConfig) {
        this.store = store;
        this.classifier = classifier;
        this.reclassifyOnStartup = catalogConfig.isReclassifyOnStartup();
        this.current = new AtomicReference<>(catalogConfig.toCatalog());
        log.info("Loaded reference catalog {} with {} gene(s)", current.get().version(), current.get().size());
    }

    public ReferenceCatalog current() {
        return current.get();
    }

    public MutationRecord classify(GeneRecord record) {
        return classifier.classify(record, current.get());
    }

    /**
     * Replace the catalog and supersede every mutation record derived from the
     * old one. If the re-derivation cannot be stored the old catalog stays.
     *
     * @param catalog the new catalog
     * @return number of mutation records written
     * @throws ValidationException if the catalog carries the current version
     */
    public synchronized int replaceCatalog(ReferenceCatalog catalog) {
        ReferenceCatalog previous = current.get();
        if (catalog.version().equals(previous.version())) {
            throw new ValidationException("version",
                "catalog version " + catalog.version() + " is already current; publish changes under a new version");
        }
        List<StoreOperation> operations = store.queryGeneRecords(g -> true).stream()
            .map(g -> StoreOperation.put(classifier.classify(g, catalog)))
            .toList();
        store.transaction(operations);
        current.set(catalog);
        log.info("Reference catalog {} replaced by {}; {} mutation record(s) re-derived",
                 previous.version(), catalog.version(), operations.size());
        return operations.size();
    }

    /**
     * Gene records whose mutation record is missing or was derived from another
     * catalog or rule version.
     */
    public List<GeneRecord> staleGeneRecords() {
        ReferenceCatalog catalog = current.get();
        String ruleVersion = classifier.settings().ruleVersion();
        GenomicSnapshot snapshot = store.snapshot();
        Map<String, MutationRecord> byGeneRecord = snapshot.mutationRecords().stream()
            .collect(Collectors.toMap(MutationRecord::geneRecordId, Function.identity(), (a, b) -> a));
        return snapshot.geneRecords().stream()
            .filter(g -> {
                MutationRecord mutation = byGeneRecord.get(g.id());
                return mutation == null || !mutation.isDerivedFrom(catalog.version(), ruleVersion);
            })
            .toList();
    }

    /**
     * @return number of mutation records re-derived
     */
    public synchronized int reclassifyStale() {
        ReferenceCatalog catalog = current.get();
        List<StoreOperation> operations = staleGeneRecords().stream()
            .map(g -> StoreOperation.put(classifier.classify(g, catalog)))
            .toList();
        store.transaction(operations);
        if (!operations.isEmpty()) {
            log.info("Re-derived {} stale mutation record(s) against catalog {}", operations.size(), catalog.version());
        }
        return operations.size();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void reclassifyOnStartup() {
        if (reclassifyOnStartup) {
            reclassifyStale();
        }
    }
}
