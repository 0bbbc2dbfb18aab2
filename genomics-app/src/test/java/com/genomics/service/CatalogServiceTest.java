package com.genomics.service;

import com.genomics.error.StorageUnavailableException;
import com.genomics.error.ValidationException;
import com.genomics.model.Classification;
import com.genomics.model.GeneRecord;
import com.genomics.model.GeneReference;
import com.genomics.model.MutationRecord;
import com.genomics.model.ReferenceCatalog;
import com.genomics.store.GenomicStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.jdbc.Sql;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@SpringBootTest
@ActiveProfiles("test")
@Sql("/genomics-fixture.sql")
class CatalogServiceTest {

    @Autowired
    private CatalogService catalogService;

    @SpyBean
    private GenomicStore store;

    private ReferenceCatalog original;

    private final ReferenceCatalog revised = new ReferenceCatalog("catalog-test-2", List.of(
        new GeneReference("TP53", "ACGTACGTAC", 1.0, 5.0, true, Set.of("A5T")),
        new GeneReference("BRCA1", null, 0.5, 2.0, true, Set.of())
    ));

    @BeforeEach
    void rememberCatalog() {
        original = catalogService.current();
    }

    @AfterEach
    void restoreCatalog() {
        if (catalogService.current() != original) {
            catalogService.replaceCatalog(original);
        }
    }

    @Test
    void loadsCatalogFromConfiguration() {
        assertThat(original.version()).isEqualTo("catalog-test");
        assertThat(original.lookup("tp53")).isPresent();
        assertThat(original.lookup("BRCA1")).isEmpty();
    }

    @Test
    void fixtureIsUpToDate() {
        assertThat(catalogService.staleGeneRecords()).isEmpty();
    }

    @Test
    void replacingCatalogRederivesEveryMutationRecord() {
        int rederived = catalogService.replaceCatalog(revised);

        assertThat(rederived).isEqualTo(6);
        assertThat(catalogService.current().version()).isEqualTo("catalog-test-2");
        List<MutationRecord> mutations = store.queryMutationRecords(m -> true);
        assertThat(mutations).hasSize(6).allMatch(m -> m.catalogVersion().equals("catalog-test-2"));
        // BRCA1 is now catalogued: 4.4 is far above [0.5, 2.0] and it is flagged as an oncogene
        assertThat(store.getMutationRecord("P003:BRCA1|catalog-test-2|rules-1").classification())
            .isEqualTo(Classification.LIKELY_PATHOGENIC);
        // EGFR dropped out of the catalog
        assertThat(store.getMutationRecord("P002:EGFR|catalog-test-2|rules-1").classification())
            .isEqualTo(Classification.UNKNOWN);
    }

    @Test
    @DisplayName("different genes under the current version are refused")
    void refusesChangedContentUnderCurrentVersion() {
        ReferenceCatalog sameVersion = new ReferenceCatalog("catalog-test", List.of(
            new GeneReference("TP53", null, 100.0, 200.0, true, Set.of())
        ));

        assertThatThrownBy(() -> catalogService.replaceCatalog(sameVersion))
            .isInstanceOf(ValidationException.class)
            .hasFieldOrPropertyWithValue("field", "version");

        assertThat(catalogService.current()).isSameAs(original);
        verify(store, never()).transaction(any());
        assertThat(catalogService.staleGeneRecords()).isEmpty();
    }

    @Test
    void keepsOldCatalogWhenRederivationFails() {
        doThrow(new StorageUnavailableException("Database unavailable", null)).when(store).transaction(any());

        assertThatThrownBy(() -> catalogService.replaceCatalog(revised))
            .isInstanceOf(StorageUnavailableException.class);

        assertThat(catalogService.current()).isSameAs(original);
    }

    @Test
    void reclassifiesOnlyStaleRecords() {
        store.put(new GeneRecord("P004", "TP53", 0.2));

        assertThat(catalogService.staleGeneRecords()).extracting(GeneRecord::id).containsExactly("P004:TP53");
        assertThat(catalogService.reclassifyStale()).isEqualTo(1);
        assertThat(catalogService.staleGeneRecords()).isEmpty();
        assertThat(store.getMutationRecord("P004:TP53|catalog-test|rules-1").classification())
            .isEqualTo(Classification.LIKELY_PATHOGENIC);
    }
}
