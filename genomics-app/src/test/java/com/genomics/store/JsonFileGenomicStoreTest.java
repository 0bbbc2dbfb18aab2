package com.genomics.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.genomics.error.StorageUnavailableException;
import com.genomics.error.TransactionAbortedException;
import com.genomics.model.Classification;
import com.genomics.model.GeneRecord;
import com.genomics.model.MutationRecord;
import com.genomics.model.Patient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileGenomicStoreTest extends GenomicStoreContract {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();

    private Path file;
    private JsonFileGenomicStore store;

    @BeforeEach
    void setUp() {
        file = tempDir.resolve("genomics.json");
        store = new JsonFileGenomicStore(file, mapper);
    }

    @Override
    protected GenomicStore store() {
        return store;
    }

    @Nested
    @DisplayName("durability")
    class Durability {

        @Test
        void reopenedStoreSeesCommittedData() {
            GeneRecord geneRecord = new GeneRecord("P001", "TP53", 0.1, "ACGT");
            MutationRecord mutation = mutation(geneRecord, Classification.LIKELY_PATHOGENIC, "c1");
            store.transaction(List.of(
                StoreOperation.put(ADA),
                StoreOperation.put(geneRecord),
                StoreOperation.put(mutation)
            ));

            JsonFileGenomicStore reopened = new JsonFileGenomicStore(file, mapper);

            assertThat(reopened.getPatient("P001")).isEqualTo(ADA.withGeneIds(List.of("TP53")));
            assertThat(reopened.getGeneRecord("P001:TP53")).isEqualTo(geneRecord);
            assertThat(reopened.getMutationRecord(mutation.id())).isEqualTo(mutation);
            assertThat(reopened.getMutationRecord(mutation.id()).createdAt()).isEqualTo(mutation.createdAt());
        }

        @Test
        void leavesNoTemporaryFileBehind() {
            store.put(ADA);

            assertThat(file).exists();
            assertThat(tempDir.resolve("genomics.json.tmp")).doesNotExist();
        }

        @Test
        @DisplayName("a rolled-back transaction leaves the file byte-identical")
        void failedTransactionLeavesFileUntouched() throws IOException {
            store.put(ADA);
            byte[] before = Files.readAllBytes(file);

            assertThatThrownBy(() -> store.transaction(List.of(
                StoreOperation.put(BEN),
                StoreOperation.put(new GeneRecord("P404", "TP53", 1.0))
            ))).isInstanceOf(TransactionAbortedException.class);

            assertThat(Files.readAllBytes(file)).isEqualTo(before);
            assertThat(store.findPatient("P002")).isEmpty();
        }

        @Test
        void unwritableLocationIsStorageUnavailable() throws IOException {
            Path blocker = Files.writeString(tempDir.resolve("blocker"), "not a directory");
            JsonFileGenomicStore blocked = new JsonFileGenomicStore(blocker.resolve("genomics.json"), mapper);

            assertThatThrownBy(() -> blocked.put(ADA))
                .isInstanceOf(StorageUnavailableException.class);
            assertThat(blocked.findPatient("P001")).isEmpty();
        }
    }

    @Nested
    @DisplayName("stores sharing one file")
    class SharedFile {

        @Test
        void writesThroughDifferentStoresAreAllKept() {
            JsonFileGenomicStore other = new JsonFileGenomicStore(file, mapper);

            store.put(ADA);
            other.put(BEN);

            assertThat(other.findPatient("P001")).isPresent();
            JsonFileGenomicStore reopened = new JsonFileGenomicStore(file, mapper);
            assertThat(reopened.queryPatients(p -> true)).extracting(Patient::id).containsExactly("P001", "P002");
        }

        @Test
        void concurrentWritersLoseNothing() throws Exception {
            JsonFileGenomicStore other = new JsonFileGenomicStore(file, mapper);
            ExecutorService executor = Executors.newFixedThreadPool(2);
            try {
                Future<?> first = executor.submit(() -> putPatients(store, "A"));
                Future<?> second = executor.submit(() -> putPatients(other, "B"));
                first.get(30, TimeUnit.SECONDS);
                second.get(30, TimeUnit.SECONDS);
            } finally {
                executor.shutdownNow();
            }

            JsonFileGenomicStore reopened = new JsonFileGenomicStore(file, mapper);
            assertThat(reopened.queryPatients(p -> true)).hasSize(40);
        }

        @Test
        @DisplayName("a document replaced by another process is reloaded before the next write")
        void reloadsDocumentReplacedOnDisk() throws IOException {
            store.put(ADA);
            Path written = tempDir.resolve("other-process.json");
            Files.writeString(written, """
                {"schemaVersion": 1,
                 "patients": [{"id": "P001", "name": "Ada Byron"}, {"id": "P002", "name": "Ben Carter"}],
                 "geneRecords": [], "mutationRecords": []}
                """, StandardCharsets.UTF_8);
            Files.move(written, file, StandardCopyOption.REPLACE_EXISTING);

            store.put(new GeneRecord("P002", "TP53", 1.0));

            JsonFileGenomicStore reopened = new JsonFileGenomicStore(file, mapper);
            assertThat(reopened.getPatient("P002").geneIds()).containsExactly("TP53");
            assertThat(reopened.getPatient("P001").name()).isEqualTo("Ada Byron");
        }

        private void putPatients(GenomicStore target, String prefix) {
            for (int i = 0; i < 20; i++) {
                target.put(Patient.of(prefix + i));
            }
        }
    }

    @Nested
    @DisplayName("loading")
    class Loading {

        @Test
        void refusesNewerSchemaVersion() throws IOException {
            Files.writeString(file, """
                {"schemaVersion": 2, "patients": [], "geneRecords": [], "mutationRecords": []}
                """, StandardCharsets.UTF_8);

            assertThatThrownBy(() -> new JsonFileGenomicStore(file, mapper))
                .isInstanceOf(StorageUnavailableException.class)
                .hasMessageContaining("schema version 2");
        }

        @Test
        void readsDocumentWithoutSchemaVersion() throws IOException {
            Files.writeString(file, """
                {"patients": [{"id": "P001", "name": "Ada Byron", "age": 54, "sex": "FEMALE"}],
                 "geneRecords": [{"patientId": "P001", "geneId": "TP53", "expression": 2.0}]}
                """, StandardCharsets.UTF_8);

            JsonFileGenomicStore loaded = new JsonFileGenomicStore(file, mapper);

            Patient patient = loaded.getPatient("P001");
            assertThat(patient.age()).isEqualTo(54);
            assertThat(patient.geneIds()).containsExactly("TP53");
        }

        @Test
        void refusesOrphanedRecords() throws IOException {
            Files.writeString(file, """
                {"schemaVersion": 1, "patients": [],
                 "geneRecords": [{"patientId": "P001", "geneId": "TP53", "expression": 2.0}]}
                """, StandardCharsets.UTF_8);

            assertThatThrownBy(() -> new JsonFileGenomicStore(file, mapper))
                .isInstanceOf(StorageUnavailableException.class)
                .hasMessageContaining("inconsistent");
        }

        @Test
        void refusesMalformedJson() throws IOException {
            Files.writeString(file, "{ not json", StandardCharsets.UTF_8);

            assertThatThrownBy(() -> new JsonFileGenomicStore(file, mapper))
                .isInstanceOf(StorageUnavailableException.class);
        }
    }
}
