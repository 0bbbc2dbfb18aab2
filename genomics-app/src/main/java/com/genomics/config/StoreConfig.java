package com.genomics.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.genomics.repository.GeneRecordRepository;
import com.genomics.repository.MutationRecordRepository;
import com.genomics.repository.PatientRepository;
import com.genomics.store.GenomicStore;
import com.genomics.store.JdbcGenomicStore;
import com.genomics.store.JsonFileGenomicStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import java.nio.file.Path;

/**
 * Selects the persistence backend. Set {@code genomics.store.backend} to
 * {@code relational} (default) or {@code file}; the file backend also reads
 * {@code genomics.store.file-path}.
 */
@Configuration
@ConfigurationProperties(prefix = "genomics.store")
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    private String backend = "relational";
    private String filePath = "data/genomics.json";

    @Bean
    @ConditionalOnProperty(prefix = "genomics.store", name = "backend", havingValue = "relational", matchIfMissing = true)
    public GenomicStore jdbcGenomicStore(PatientRepository patientRepository,
                                         GeneRecordRepository geneRecordRepository,
                                         MutationRecordRepository mutationRecordRepository,
                                         PlatformTransactionManager transactionManager) {
        log.info("Using relational genomic store");
        return new JdbcGenomicStore(patientRepository, geneRecordRepository, mutationRecordRepository,
                                    transactionManager);
    }

    @Bean
    @ConditionalOnProperty(prefix = "genomics.store", name = "backend", havingValue = "file")
    public GenomicStore jsonFileGenomicStore(ObjectMapper objectMapper) {
        log.info("Using file genomic store at {}", filePath);
        return new JsonFileGenomicStore(Path.of(filePath), objectMapper);
    }

    public String getBackend() {
        return backend;
    }

    public void setBackend(String backend) {
        this.backend = backend;
    }

    public String getFilePath() {
        return filePath;
    }

    public void setFilePath(String filePath) {
        this.filePath = filePath;
    }
}
