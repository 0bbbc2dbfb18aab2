package com.genomics.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.genomics.error.GenomicsException;
import com.genomics.error.StorageUnavailableException;
import com.genomics.error.TransactionAbortedException;
import com.genomics.model.GeneRecordKey;
import com.genomics.model.GenomicRecord;
import com.genomics.model.RecordKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * File backend: the whole dataset lives in one JSON document.
 *
 * <p>A transaction applies its operations to a copy of the current dataset,
 * writes the result to {@code <file>.tmp}, forces it to disk and atomically
 * moves it over the document. Only then is the copy published, so readers
 * never see an in-flight transaction and a failure at any step leaves both the
 * file and the published dataset untouched.
 *
 * <p>Every store in this JVM that points at the same file shares one published
 * dataset and one writer lock. Writers also hold an OS lock on
 * {@code <file>.lock} and reload the document first when another process has
 * replaced it, so a transaction always starts from the latest committed state.
 */
public class JsonFileGenomicStore extends AbstractGenomicStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileGenomicStore.class);

    private static final ConcurrentMap<Path, SharedFile> OPEN_FILES = new ConcurrentHashMap<>();

    private final Path file;
    private final Path tempFile;
    private final Path lockFile;
    private final ObjectMapper mapper;
    private final SharedFile shared;

    public JsonFileGenomicStore(Path file, ObjectMapper mapper) {
        this.file = file.toAbsolutePath().normalize();
        this.tempFile = this.file.resolveSibling(this.file.getFileName() + ".tmp");
        this.lockFile = this.file.resolveSibling(this.file.getFileName() + ".lock");
        this.mapper = mapper;
        this.shared = OPEN_FILES.computeIfAbsent(this.file, p -> new SharedFile());
        shared.writeLock.lock();
        try {
            refresh();
        } finally {
            shared.writeLock.unlock();
        }
    }

    @Override
    public String backendName() {
        return "file";
    }

    @Override
    public Optional<GenomicRecord> find(RecordKind kind, String id) {
        return current().find(kind, id);
    }

    @Override
    protected List<GenomicRecord> findAll(RecordKind kind) {
        return current().all(kind);
    }

    @Override
    public boolean exists(GeneRecordKey key) {
        return current().contains(key);
    }

    @Override
    public GenomicSnapshot snapshot() {
        return current().snapshot();
    }

    @Override
    protected void commit(List<StoreOperation> operations) {
        shared.writeLock.lock();
        try (FileChannel lockChannel = openLockChannel();
             FileLock ignored = lockChannel.lock()) {
            refresh();
            GenomicDataset working = shared.dataset.copy();
            for (int i = 0; i < operations.size(); i++) {
                try {
                    working.apply(operations.get(i));
                } catch (GenomicsException e) {
                    log.warn("Rolling back {} operation(s): {} failed: {}",
                             operations.size(), operations.get(i), e.getMessage());
                    throw new TransactionAbortedException(i, e);
                }
            }
            write(GenomicDocument.from(working));
            shared.stamp = stamp();
            shared.dataset = working;
            log.debug("Committed {} operation(s) to {}", operations.size(), file);
        } catch (IOException e) {
            log.error("Failed to lock data file {}: {}", file, e.getMessage(), e);
            throw new StorageUnavailableException("Cannot lock data file " + file, e);
        } finally {
            shared.writeLock.unlock();
        }
    }

    /**
     * The published dataset, reloaded first when the document on disk is no
     * longer the one it was read from.
     */
    private GenomicDataset current() {
        if (!stamp().equals(shared.stamp)) {
            shared.writeLock.lock();
            try {
                refresh();
            } finally {
                shared.writeLock.unlock();
            }
        }
        return shared.dataset;
    }

    /**
     * Caller holds the writer lock.
     */
    private void refresh() {
        FileStamp onDisk = stamp();
        if (shared.dataset == null || !onDisk.equals(shared.stamp)) {
            shared.dataset = load();
            shared.stamp = onDisk;
        }
    }

    // ========== FILE I/O ==========

    private GenomicDataset load() {
        if (!Files.exists(file)) {
            log.info("No data file at {}, starting with an empty dataset", file);
            return GenomicDataset.empty();
        }
        GenomicDocument document;
        try {
            document = mapper.readValue(file.toFile(), GenomicDocument.class);
        } catch (IOException e) {
            log.error("Failed to read data file {}", file, e);
            throw new StorageUnavailableException("Cannot read data file " + file, e);
        }
        if (document.effectiveSchemaVersion() > GenomicDocument.CURRENT_SCHEMA_VERSION) {
            throw new StorageUnavailableException(
                "Data file " + file + " has schema version " + document.schemaVersion()
                    + ", newer than supported version " + GenomicDocument.CURRENT_SCHEMA_VERSION, null);
        }
        try {
            GenomicDataset dataset = document.toDataset();
            log.info("Loaded {} from {}", dataset.counts(), file);
            return dataset;
        } catch (GenomicsException e) {
            throw new StorageUnavailableException("Data file " + file + " is inconsistent: " + e.getMessage(), e);
        }
    }

    private void write(GenomicDocument document) {
        try {
            byte[] bytes = mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(document);
            try (FileChannel channel = FileChannel.open(tempFile,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            Files.move(tempFile, file,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.error("Failed to write data file {}: {}", file, e.getMessage(), e);
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw new StorageUnavailableException("Cannot write data file " + file, e);
        }
    }

    private FileChannel openLockChannel() throws IOException {
        Files.createDirectories(file.getParent());
        return FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
    }

    /**
     * Identity of the document on disk. Every commit moves a new file into
     * place, so the file key changes even when size and timestamp do not.
     */
    private FileStamp stamp() {
        if (!Files.exists(file)) {
            return FileStamp.ABSENT;
        }
        try {
            BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
            return new FileStamp(attributes.fileKey(), attributes.lastModifiedTime(), attributes.size());
        } catch (NoSuchFileException e) {
            return FileStamp.ABSENT;
        } catch (IOException e) {
            throw new StorageUnavailableException("Cannot read data file " + file, e);
        }
    }

    private record FileStamp(Object fileKey, FileTime modified, long size) {
        static final FileStamp ABSENT = new FileStamp(null, null, -1);
    }

    /**
     * State shared by every store in this JVM that uses the same file.
     */
    private static final class SharedFile {
        private final ReentrantLock writeLock = new ReentrantLock();
        private volatile GenomicDataset dataset;
        private volatile FileStamp stamp;
    }
}
