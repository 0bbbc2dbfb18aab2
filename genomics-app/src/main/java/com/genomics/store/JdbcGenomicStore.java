package com.genomics.store;

import com.genomics.error.ConstraintViolationException;
import com.genomics.error.DuplicateRecordException;
import com.genomics.error.GenomicsException;
import com.genomics.error.RecordNotFoundException;
import com.genomics.error.StorageUnavailableException;
import com.genomics.error.TransactionAbortedException;
import com.genomics.model.GeneRecord;
import com.genomics.model.GeneRecordKey;
import com.genomics.model.GenomicRecord;
import com.genomics.model.MutationRecord;
import com.genomics.model.Patient;
import com.genomics.model.RecordKind;
import com.genomics.repository.GeneRecordRepository;
import com.genomics.repository.MutationRecordRepository;
import com.genomics.repository.PatientRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Relational backend. Each batch runs in one database transaction; the
 * foreign keys on gene_records and mutation_records back up the ownership
 * checks made here before every write.
 */
public class JdbcGenomicStore extends AbstractGenomicStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcGenomicStore.class);

    private final PatientRepository patientRepository;
    private final GeneRecordRepository geneRecordRepository;
    private final MutationRecordRepository mutationRecordRepository;
    private final TransactionTemplate writeTemplate;
    private final TransactionTemplate readTemplate;
    private final TransactionTemplate snapshotTemplate;

    public JdbcGenomicStore(PatientRepository patientRepository,
                            GeneRecordRepository geneRecordRepository,
                            MutationRecordRepository mutationRecordRepository,
                            PlatformTransactionManager transactionManager) {
        this.patientRepository = patientRepository;
        this.geneRecordRepository = geneRecordRepository;
        this.mutationRecordRepository = mutationRecordRepository;
        this.writeTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate.setReadOnly(true);
        this.snapshotTemplate = new TransactionTemplate(transactionManager);
        this.snapshotTemplate.setReadOnly(true);
        this.snapshotTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_REPEATABLE_READ);
    }

    @Override
    public String backendName() {
        return "relational";
    }

    // ========== READ OPERATIONS ==========

    @Override
    public Optional<GenomicRecord> find(RecordKind kind, String id) {
        return read(() -> switch (kind) {
            case PATIENT -> patientRepository.findById(id).map(GenomicRecord.class::cast);
            case GENE_RECORD -> geneRecordRepository.findById(id).map(GenomicRecord.class::cast);
            case MUTATION_RECORD -> mutationRecordRepository.findById(id).map(GenomicRecord.class::cast);
        });
    }

    @Override
    protected List<GenomicRecord> findAll(RecordKind kind) {
        return read(() -> switch (kind) {
            case PATIENT -> new ArrayList<GenomicRecord>(patientRepository.findAll());
            case GENE_RECORD -> new ArrayList<GenomicRecord>(geneRecordRepository.findAll());
            case MUTATION_RECORD -> new ArrayList<GenomicRecord>(mutationRecordRepository.findAll());
        });
    }

    @Override
    public boolean exists(GeneRecordKey key) {
        return read(() -> geneRecordRepository.exists(key.recordId()));
    }

    @Override
    public GenomicSnapshot snapshot() {
        return read(snapshotTemplate, () -> new GenomicSnapshot(
            patientRepository.findAll(),
            geneRecordRepository.findAll(),
            mutationRecordRepository.findAll()
        ));
    }

    private <T> T read(Supplier<T> query) {
        return read(readTemplate, query);
    }

    private <T> T read(TransactionTemplate template, Supplier<T> query) {
        try {
            return template.execute(status -> query.get());
        } catch (DataAccessResourceFailureException | TransactionException e) {
            log.error("Database unavailable: {}", e.getMessage());
            throw new StorageUnavailableException("Database unavailable", e);
        }
    }

    // ========== WRITE OPERATIONS ==========

    @Override
    protected void commit(List<StoreOperation> operations) {
        try {
            writeTemplate.executeWithoutResult(status -> {
                for (int i = 0; i < operations.size(); i++) {
                    StoreOperation operation = operations.get(i);
                    try {
                        apply(operation);
                    } catch (GenomicsException e) {
                        throw new TransactionAbortedException(i, e);
                    } catch (DuplicateKeyException e) {
                        throw new TransactionAbortedException(i, duplicateOf(operation, e));
                    } catch (DataIntegrityViolationException e) {
                        throw new TransactionAbortedException(i, new ConstraintViolationException(
                            operation + " violates a storage constraint", e));
                    }
                }
            });
        } catch (TransactionAbortedException e) {
            log.warn("Rolled back {} operation(s): {}", operations.size(), e.getMessage());
            throw e;
        } catch (DataAccessResourceFailureException | TransactionException e) {
            log.error("Database unavailable, {} operation(s) not applied: {}", operations.size(), e.getMessage());
            throw new StorageUnavailableException("Database unavailable", e);
        }
    }

    private void apply(StoreOperation operation) {
        if (operation.type() == StoreOperation.Type.DELETE) {
            delete(operation);
            return;
        }
        GenomicRecord record = operation.record();
        if (operation.type() == StoreOperation.Type.INSERT) {
            insert(record);
        } else if (record instanceof Patient patient) {
            patientRepository.save(patient);
        } else if (record instanceof GeneRecord geneRecord) {
            putGeneRecord(geneRecord, operation.replace());
        } else if (record instanceof MutationRecord mutationRecord) {
            putMutationRecord(mutationRecord);
        }
    }

    public void insert(GenomicRecord record) {
        boolean taken = switch (record.kind()) {
            case PATIENT -> patientRepository.exists(record.id());
            case GENE_RECORD -> geneRecordRepository.exists(record.id());
            case MUTATION_RECORD -> mutationRecordRepository.findById(record.id()).isPresent();
        };
        if (taken) {
            throw new DuplicateRecordException(record.kind(), record.id());
        }
        // A concurrent insert of the same id still fails on the primary key
        if (record instanceof Patient patient) {
            patientRepository.insert(patient);
        } else if (record instanceof GeneRecord geneRecord) {
            putGeneRecord(geneRecord, false);
        } else if (record instanceof MutationRecord mutationRecord) {
            putMutationRecord(mutationRecord);
        }
    }

    private void putGeneRecord(GeneRecord geneRecord, boolean replace) {
        if (!patientRepository.exists(geneRecord.patientId())) {
            throw new ConstraintViolationException(
                "Gene record " + geneRecord.id() + " references missing patient " + geneRecord.patientId());
        }
        if (geneRecordRepository.exists(geneRecord.id())) {
            if (!replace) {
                throw new DuplicateRecordException(geneRecord.key());
            }
            mutationRecordRepository.deleteByGeneRecordId(geneRecord.id());
            geneRecordRepository.update(geneRecord);
        } else {
            geneRecordRepository.insert(geneRecord);
        }
    }

    private void putMutationRecord(MutationRecord mutationRecord) {
        if (!geneRecordRepository.exists(mutationRecord.geneRecordId())) {
            throw new ConstraintViolationException(
                "Mutation record " + mutationRecord.id() + " references missing gene record "
                    + mutationRecord.geneRecordId());
        }
        mutationRecordRepository.deleteByGeneRecordId(mutationRecord.geneRecordId());
        mutationRecordRepository.insert(mutationRecord);
    }

    private void delete(StoreOperation operation) {
        int deleted = switch (operation.kind()) {
            case PATIENT -> patientRepository.delete(operation.id());
            case GENE_RECORD -> geneRecordRepository.delete(operation.id());
            case MUTATION_RECORD -> mutationRecordRepository.delete(operation.id());
        };
        if (deleted == 0) {
            throw new RecordNotFoundException(operation.kind(), operation.id());
        }
    }

    private static GenomicsException duplicateOf(StoreOperation operation, DuplicateKeyException e) {
        if (operation.record() instanceof GeneRecord geneRecord) {
            return new DuplicateRecordException(geneRecord.key());
        }
        if (operation.type() == StoreOperation.Type.INSERT) {
            return new DuplicateRecordException(operation.kind(), operation.id());
        }
        return new ConstraintViolationException(operation + " duplicates an existing key", e);
    }
}
