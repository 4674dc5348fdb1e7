package org.endlesssource.mediarelay.agent.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * {@link CredentialStore} persisted as a JSON document in the agent's state directory.
 * <p>
 * Every change writes a complete new document to a temporary file and atomically moves it over
 * the previous one. Readers use an immutable in-memory copy that is replaced after the move, so
 * they never see a half-written record. The directory is locked for as long as the store is open.
 */
public final class FileCredentialStore implements CredentialStore {
    private static final Logger logger = LoggerFactory.getLogger(FileCredentialStore.class);

    public static final String FILE_NAME = "trust-records.json";
    static final String LOCK_FILE_NAME = ".lock";
    private static final int FORMAT_VERSION = 1;
    private static final Set<PosixFilePermission> OWNER_ONLY_DIR = PosixFilePermissions.fromString("rwx------");
    private static final Set<PosixFilePermission> OWNER_ONLY_FILE = PosixFilePermissions.fromString("rw-------");

    private final Path directory;
    private final Path file;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final FileChannel lockChannel;
    private final FileLock lock;
    private final Object writeLock = new Object();

    private volatile Map<String, TrustRecord> records;
    private volatile boolean closed;

    private FileCredentialStore(Path directory, Clock clock, FileChannel lockChannel, FileLock lock,
                                Map<String, TrustRecord> records, ObjectMapper mapper) {
        this.directory = directory;
        this.file = directory.resolve(FILE_NAME);
        this.clock = clock;
        this.lockChannel = lockChannel;
        this.lock = lock;
        this.records = records;
        this.mapper = mapper;
    }

    public static FileCredentialStore open(Path directory) {
        return open(directory, Clock.systemUTC());
    }

    /**
     * Open the store in {@code directory}, creating the directory if needed.
     *
     * @throws CredentialStoreException if the directory is locked by another agent or the
     *                                  existing document cannot be read
     */
    public static FileCredentialStore open(Path directory, Clock clock) {
        Objects.requireNonNull(directory, "directory must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
        Path dir = directory.toAbsolutePath();
        createDirectory(dir);

        FileChannel channel = null;
        try {
            channel = FileChannel.open(dir.resolve(LOCK_FILE_NAME),
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock lock = tryLock(channel, dir);
            ObjectMapper mapper = newMapper();
            Map<String, TrustRecord> records = load(mapper, dir.resolve(FILE_NAME));
            logger.info("Opened credential store at {} with {} trust record(s)", dir, records.size());
            return new FileCredentialStore(dir, clock, channel, lock, records, mapper);
        } catch (IOException e) {
            closeQuietly(channel);
            throw new CredentialStoreException("Cannot open credential store at " + dir, e);
        } catch (RuntimeException e) {
            closeQuietly(channel);
            throw e;
        }
    }

    @Override
    public TrustRecord put(String identity, TrustMaterial material) {
        Objects.requireNonNull(identity, "identity must not be null");
        Objects.requireNonNull(material, "material must not be null");
        synchronized (writeLock) {
            requireOpen();
            TrustRecord record = new TrustRecord(identity, material.identityKey(), material.clientName(),
                    material.trustToken(), clock.instant());
            Map<String, TrustRecord> updated = new LinkedHashMap<>(records);
            TrustRecord previous = updated.put(identity, record);
            persist(updated);
            if (previous != null) {
                logger.info("Replaced trust record for {} ({})", identity, record.clientName());
            } else {
                logger.info("Stored trust record for {} ({})", identity, record.clientName());
            }
            return record;
        }
    }

    @Override
    public Optional<TrustRecord> get(String identity) {
        requireOpen();
        return identity == null ? Optional.empty() : Optional.ofNullable(records.get(identity));
    }

    @Override
    public List<TrustRecord> list() {
        requireOpen();
        List<TrustRecord> result = new ArrayList<>(records.values());
        result.sort(Comparator.comparing(TrustRecord::createdAt));
        return result;
    }

    @Override
    public boolean revoke(String identity) {
        synchronized (writeLock) {
            requireOpen();
            if (identity == null || !records.containsKey(identity)) {
                return false;
            }
            Map<String, TrustRecord> updated = new LinkedHashMap<>(records);
            updated.remove(identity);
            persist(updated);
            logger.info("Revoked trust record for {}", identity);
            return true;
        }
    }

    @Override
    public int revokeAll() {
        synchronized (writeLock) {
            requireOpen();
            int count = records.size();
            if (count > 0) {
                persist(new LinkedHashMap<>());
                logger.info("Revoked all {} trust record(s)", count);
            }
            return count;
        }
    }

    @Override
    public void close() {
        synchronized (writeLock) {
            if (closed) {
                return;
            }
            closed = true;
        }
        try {
            lock.release();
        } catch (IOException e) {
            logger.warn("Failed to release credential store lock: {}", e.getMessage());
        }
        closeQuietly(lockChannel);
        logger.debug("Closed credential store at {}", directory);
    }

    private void requireOpen() {
        if (closed) {
            throw new IllegalStateException("Credential store is closed");
        }
    }

    // Caller holds writeLock.
    private void persist(Map<String, TrustRecord> updated) {
        List<StoredRecord> stored = updated.values().stream().map(StoredRecord::from).toList();
        Path temp = null;
        try {
            byte[] bytes = mapper.writeValueAsBytes(new StoredDocument(FORMAT_VERSION, stored));
            temp = Files.createTempFile(directory, FILE_NAME, ".tmp");
            restrict(temp, OWNER_ONLY_FILE);
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE,
                    StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                logger.debug("Atomic move not supported in {}, replacing file", directory);
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            temp = null;
        } catch (IOException e) {
            throw new CredentialStoreException("Cannot write " + file, e);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
        records = Collections.unmodifiableMap(updated);
    }

    private static FileLock tryLock(FileChannel channel, Path dir) throws IOException {
        FileLock lock;
        try {
            lock = channel.tryLock();
        } catch (OverlappingFileLockException e) {
            lock = null;
        }
        if (lock == null) {
            throw new CredentialStoreException("Credential store at " + dir + " is in use by another agent");
        }
        return lock;
    }

    private static Map<String, TrustRecord> load(ObjectMapper mapper, Path file) throws IOException {
        if (!Files.exists(file)) {
            return Collections.unmodifiableMap(new LinkedHashMap<>());
        }
        StoredDocument document = mapper.readValue(file.toFile(), StoredDocument.class);
        if (document.version() > FORMAT_VERSION) {
            throw new CredentialStoreException("Unsupported credential store version " + document.version()
                    + " in " + file);
        }
        Map<String, TrustRecord> records = new LinkedHashMap<>();
        if (document.records() != null) {
            for (StoredRecord stored : document.records()) {
                TrustRecord record = stored.toRecord();
                records.put(record.identity(), record);
            }
        }
        return Collections.unmodifiableMap(records);
    }

    private static void createDirectory(Path dir) {
        try {
            if (!Files.isDirectory(dir)) {
                Files.createDirectories(dir);
                restrict(dir, OWNER_ONLY_DIR);
            }
        } catch (IOException e) {
            throw new CredentialStoreException("Cannot create state directory " + dir, e);
        }
    }

    private static void restrict(Path path, Set<PosixFilePermission> permissions) throws IOException {
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            Files.setPosixFilePermissions(path, permissions);
        }
    }

    private static ObjectMapper newMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(SerializationFeature.INDENT_OUTPUT, true);
        return mapper;
    }

    private static void closeQuietly(FileChannel channel) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            logger.debug("Failed to close lock file: {}", e.getMessage());
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("Failed to delete temporary file {}: {}", path, e.getMessage());
        }
    }

    record StoredDocument(int version, List<StoredRecord> records) {
    }

    record StoredRecord(String identity, byte[] identityKey, String clientName, byte[] trustToken,
                        long createdAtEpochMillis) {

        static StoredRecord from(TrustRecord record) {
            return new StoredRecord(record.identity(), record.identityKey(), record.clientName(),
                    record.trustToken(), record.createdAt().toEpochMilli());
        }

        TrustRecord toRecord() {
            return new TrustRecord(identity, identityKey, clientName, trustToken,
                    Instant.ofEpochMilli(createdAtEpochMillis));
        }
    }
}
