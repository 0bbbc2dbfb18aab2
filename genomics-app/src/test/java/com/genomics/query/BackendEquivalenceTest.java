package com.genomics.query;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.genomics.error.TransactionAbortedException;
import com.genomics.model.Classification;
import com.genomics.model.Evidence;
import com.genomics.model.GeneRecord;
import com.genomics.model.MutationRecord;
import com.genomics.model.MutationType;
import com.genomics.model.Patient;
import com.genomics.model.RecordKind;
import com.genomics.service.CatalogService;
import com.genomics.store.GenomicStore;
import com.genomics.store.JsonFileGenomicStore;
import com.genomics.store.StoreOperation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.jdbc.Sql;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Loads the same data into the relational and the file backend and checks
 * that every read and report agrees.
 */
@SpringBootTest
@ActiveProfiles("test")
@Sql("/genomics-fixture.sql")
class BackendEquivalenceTest {

    @Autowired
    private GenomicStore relational;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private CatalogService catalogService;

    @TempDir
    Path tempDir;

    private GenomicStore file;

    @BeforeEach
    void copyFixtureToFileStore() {
        file = new JsonFileGenomicStore(tempDir.resolve("genomics.json"), objectMapper);
        List<StoreOperation> operations = new ArrayList<>();
        relational.queryPatients(p -> true).forEach(p -> operations.add(StoreOperation.put(p)));
        relational.queryGeneRecords(g -> true).forEach(g -> operations.add(StoreOperation.put(g)));
        relational.queryMutationRecords(m -> true).forEach(m -> operations.add(StoreOperation.put(m)));
        file.transaction(operations);
    }

    private void assertSameContents() {
        assertThat(file.queryPatients(p -> true)).isEqualTo(relational.queryPatients(p -> true));
        assertThat(file.queryGeneRecords(g -> true)).isEqualTo(relational.queryGeneRecords(g -> true));
        assertThat(file.queryMutationRecords(m -> true)).isEqualTo(relational.queryMutationRecords(m -> true));
    }

    private void applyToBoth(List<StoreOperation> operations) {
        relational.transaction(operations);
        file.transaction(operations);
    }

    @Test
    void readsAgree() {
        assertSameContents();
        assertThat(file.getPatient("P002")).isEqualTo(relational.getPatient("P002"));
        assertThat(file.find(RecordKind.GENE_RECORD, "P404:TP53")).isEqualTo(relational.find(RecordKind.GENE_RECORD, "P404:TP53"));
    }

    @Test
    void reportsAgree() {
        ReportQuery everything = ReportQuery.of(RecordFilter.all());
        ReportQuery breast = new ReportQuery(RecordFilter.diagnosis("Breast carcinoma"), 3);

        assertThat(new QueryEngine(file).query(everything)).isEqualTo(new QueryEngine(relational).query(everything));
        assertThat(new QueryEngine(file).query(breast)).isEqualTo(new QueryEngine(relational).query(breast));
        assertThat(new QueryEngine(file).rows(RecordFilter.all())).isEqualTo(new QueryEngine(relational).rows(RecordFilter.all()));
    }

    @Test
    void writesAgree() {
        GeneRecord replacement = new GeneRecord("P003", "TP53", 7.5, "ACGTTCGTAC");
        MutationRecord rederived = catalogService.classify(replacement);

        applyToBoth(List.of(
            StoreOperation.put(new Patient("P005", "Eve Fox", 39, null, null, "Melanoma")),
            StoreOperation.put(replacement, true),
            StoreOperation.put(rederived),
            StoreOperation.delete(RecordKind.PATIENT, "P001")
        ));

        assertSameContents();
    }

    @Test
    @DisplayName("sequences and notations longer than 64k characters are stored by both backends")
    void longValuesAgree() {
        String reference = "A".repeat(70_000);
        String sample = "C".repeat(70_000);
        GeneRecord geneRecord = new GeneRecord("P004", "KRAS", 1.0, sample);
        List<String> substitutions = new ArrayList<>();
        for (int i = 0; i < reference.length(); i++) {
            substitutions.add("A" + (i + 1) + "C");
        }
        MutationRecord mutation = new MutationRecord(null, geneRecord.id(), MutationType.SUBSTITUTION,
            Classification.UNKNOWN, Evidence.SEQUENCE, 1, String.join(",", substitutions),
            "catalog-test", "rules-1", Instant.parse("2024-01-15T09:00:00Z"));

        applyToBoth(List.of(StoreOperation.put(geneRecord), StoreOperation.put(mutation)));

        assertSameContents();
        assertThat(relational.getGeneRecord("P004:KRAS").sequence()).hasSize(70_000);
        assertThat(relational.getMutationRecord(mutation.id()).notation()).isEqualTo(mutation.notation());
    }

    @Test
    void failuresAgree() {
        List<StoreOperation> failing = List.of(
            StoreOperation.delete(RecordKind.GENE_RECORD, "P002:EGFR"),
            StoreOperation.put(new GeneRecord("P002", "TP53", 1.0))
        );

        assertThatThrownBy(() -> relational.transaction(failing)).isInstanceOf(TransactionAbortedException.class);
        assertThatThrownBy(() -> file.transaction(failing)).isInstanceOf(TransactionAbortedException.class);

        assertSameContents();
    }
}
