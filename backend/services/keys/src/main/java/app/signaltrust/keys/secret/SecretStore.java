package app.signaltrust.keys.secret;

import app.signaltrust.keys.crypto.MasterKeyDeriver;
import app.signaltrust.keys.error.DecryptionException;
import app.signaltrust.keys.error.LockTimeoutException;
import app.signaltrust.keys.error.MissingMasterPasswordException;
import app.signaltrust.keys.error.StoreIOException;
import app.signaltrust.keys.vault.AesGcmSecretVault;
import app.signaltrust.keys.vault.EncryptedSecret;
import app.signaltrust.keys.vault.SecretVault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.AEADBadTagException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Encrypted on-disk record set. Reads work on an immutable snapshot that is reloaded when the file
 * is replaced by another process; writes are serialized by an in-process lock and a file lock,
 * re-read the file under the lock, and replace it atomically. Mutation is package-private and
 * reached through {@link KeyManager}.
 */
public class SecretStore {

    private static final Logger log = LoggerFactory.getLogger(SecretStore.class);

    public static final int FORMAT_VERSION = 1;
    private static final Pattern NAME_PATTERN = Pattern.compile("^[A-Za-z0-9_.-]{1,128}$");
    private static final byte[] KEY_CHECK_MARKER = "signaltrust-key-check".getBytes(StandardCharsets.UTF_8);
    private static final byte[] KEY_CHECK_AAD = "key-check".getBytes(StandardCharsets.UTF_8);
    private static final long WRITE_RETRY_BACKOFF_MS = 100L;

    private final Path path;
    private final Path lockPath;
    private final char[] masterPassword;
    private final String masterPasswordEnv;
    private final MasterKeyDeriver deriver;
    private final StoreFileCodec codec;
    private final AtomicFileWriter writer;
    private final Duration lockTimeout;
    private final Clock clock;
    private final ReentrantLock writeLock = new ReentrantLock();

    private volatile Snapshot snapshot;

    public SecretStore(Path path,
                       char[] masterPassword,
                       String masterPasswordEnv,
                       MasterKeyDeriver deriver,
                       StoreFileCodec codec,
                       AtomicFileWriter writer,
                       Duration lockTimeout,
                       Clock clock) {
        this.path = path;
        this.lockPath = path.resolveSibling(path.getFileName() + ".lock");
        this.masterPassword = masterPassword == null || masterPassword.length == 0 ? null : masterPassword.clone();
        this.masterPasswordEnv = masterPasswordEnv;
        this.deriver = deriver;
        this.codec = codec;
        this.writer = writer;
        this.lockTimeout = lockTimeout;
        this.clock = clock;
    }

    public Path path() {
        return path;
    }

    public boolean hasMasterPassword() {
        return masterPassword != null;
    }

    public synchronized void load() {
        Snapshot loaded = readSnapshot(snapshot);
        snapshot = loaded;
        log.info("Key store loaded path={} records={}", path, loaded.store().records().size());
    }

    /**
     * Decrypts one secret. A wrong master password and a tampered record fail with the same
     * {@link DecryptionException}.
     */
    public Optional<String> get(String name) {
        Snapshot current;
        try {
            current = current();
        } catch (DecryptionException ex) {
            throw DecryptionException.forSecret(name);
        }
        SecretRecord record = current.store().records().get(name);
        if (record == null) {
            return Optional.empty();
        }
        return Optional.of(decrypt(requireVault(current), record));
    }

    public boolean contains(String name) {
        return current().store().records().containsKey(name);
    }

    public Set<String> names() {
        return current().store().records().keySet();
    }

    public Optional<SecretRecord> record(String name) {
        return Optional.ofNullable(current().store().records().get(name));
    }

    public List<MaskedSecret> list() {
        Snapshot current = current();
        List<MaskedSecret> result = new ArrayList<>();
        for (SecretRecord record : current.store().records().values()) {
            String preview;
            try {
                preview = SecretMasker.mask(decrypt(requireVault(current), record));
            } catch (DecryptionException ex) {
                log.warn("Key store record failed authentication name={}", record.name());
                preview = SecretMasker.UNDECRYPTABLE;
            }
            result.add(new MaskedSecret(record.name(), preview, record.version(), record.createdAt(), record.rotatedAt()));
        }
        return result;
    }

    SecretRecord set(String name, String value) {
        return setAll(Map.of(name, value)).get(name);
    }

    Map<String, SecretRecord> setAll(Map<String, String> values) {
        values.forEach((name, value) -> {
            requireValidName(name);
            if (value == null || value.isEmpty()) {
                throw new IllegalArgumentException("Secret value is required for " + name);
            }
        });
        if (values.isEmpty()) {
            return Map.of();
        }
        return mutate(draft -> {
            Map<String, SecretRecord> written = new LinkedHashMap<>();
            values.forEach((name, value) -> written.put(name, draft.put(name, value)));
            return written;
        });
    }

    boolean delete(String name) {
        requireValidName(name);
        if (!contains(name)) {
            return false;
        }
        return mutate(draft -> draft.remove(name));
    }

    private <T> T mutate(Function<Draft, T> change) {
        long deadline = System.nanoTime() + lockTimeout.toNanos();
        acquireWriteLock();
        try (StoreFileLock ignored = StoreFileLock.acquire(lockPath, deadline, lockTimeout)) {
            Snapshot latest = withKeyMaterial(readSnapshot(snapshot));
            Draft draft = new Draft(latest.vault(), latest.store().records());
            T result = change.apply(draft);
            EncryptedStore next = latest.store().withRecords(draft.records);
            persist(next);
            synchronized (this) {
                snapshot = new Snapshot(next, latest.vault(), stamp());
            }
            return result;
        } catch (IOException ex) {
            throw new StoreIOException("Key store lock failed path=" + path, ex);
        } finally {
            writeLock.unlock();
        }
    }

    private void acquireWriteLock() {
        try {
            if (!writeLock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new LockTimeoutException(lockTimeout);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new StoreIOException("Interrupted while waiting for the key store write lock", ex);
        }
    }

    private void persist(EncryptedStore next) {
        byte[] content = codec.write(next);
        try {
            writer.write(path, content);
        } catch (IOException first) {
            log.warn("Key store write failed, retrying path={} error={}", path, first.getClass().getSimpleName());
            sleepBeforeRetry();
            try {
                writer.write(path, content);
            } catch (IOException second) {
                second.addSuppressed(first);
                throw new StoreIOException("Failed to write key store path=" + path, second);
            }
        }
    }

    private void sleepBeforeRetry() {
        try {
            Thread.sleep(WRITE_RETRY_BACKOFF_MS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new StoreIOException("Interrupted while retrying key store write", ex);
        }
    }

    private Snapshot current() {
        Snapshot current = snapshot;
        if (isStale(current)) {
            synchronized (this) {
                if (isStale(snapshot)) {
                    if (snapshot != null) {
                        log.info("Key store changed on disk, reloading path={}", path);
                    }
                    load();
                }
                current = snapshot;
            }
        }
        return current;
    }

    private boolean isStale(Snapshot current) {
        return current == null || !Objects.equals(current.stamp(), stamp());
    }

    private Snapshot readSnapshot(Snapshot previous) {
        FileStamp stamp = stamp();
        Optional<byte[]> content = readFile();
        if (content.isEmpty()) {
            return new Snapshot(EncryptedStore.empty(FORMAT_VERSION), null, null);
        }
        EncryptedStore store = codec.read(content.get(), FORMAT_VERSION);
        if (masterPassword == null) {
            if (!store.records().isEmpty()) {
                throw new MissingMasterPasswordException(masterPasswordEnv);
            }
            return new Snapshot(store, null, stamp);
        }
        SecretVault vault = previous != null
                && previous.vault() != null
                && Arrays.equals(previous.store().kdfSalt(), store.kdfSalt())
                ? previous.vault()
                : new AesGcmSecretVault(deriver.derive(masterPassword, store.kdfSalt()));
        verifyKeyCheck(store, vault);
        return new Snapshot(store, vault, stamp);
    }

    private Snapshot withKeyMaterial(Snapshot latest) {
        if (masterPassword == null) {
            throw new MissingMasterPasswordException(masterPasswordEnv);
        }
        EncryptedStore store = latest.store();
        if (store.initialized() && store.keyCheck() != null) {
            return latest;
        }
        byte[] salt = store.initialized() ? store.kdfSalt() : deriver.newSalt();
        SecretVault vault = latest.vault() != null ? latest.vault() : new AesGcmSecretVault(deriver.derive(masterPassword, salt));
        EncryptedSecret keyCheck = vault.encrypt(KEY_CHECK_MARKER, KEY_CHECK_AAD);
        log.info("Key store initialized path={}", path);
        return new Snapshot(new EncryptedStore(store.formatVersion(), salt, keyCheck, store.records()), vault, latest.stamp());
    }

    private void verifyKeyCheck(EncryptedStore store, SecretVault vault) {
        if (store.keyCheck() == null) {
            return;
        }
        try {
            byte[] marker = vault.decrypt(store.keyCheck(), KEY_CHECK_AAD);
            if (!Arrays.equals(marker, KEY_CHECK_MARKER)) {
                throw DecryptionException.forStore();
            }
        } catch (AEADBadTagException ex) {
            throw DecryptionException.forStore();
        }
    }

    private Optional<byte[]> readFile() {
        try {
            return Optional.of(Files.readAllBytes(path));
        } catch (NoSuchFileException ex) {
            return Optional.empty();
        } catch (IOException ex) {
            throw new StoreIOException("Failed to read key store path=" + path, ex);
        }
    }

    private FileStamp stamp() {
        try {
            BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
            return new FileStamp(attributes.fileKey(), attributes.lastModifiedTime(), attributes.size());
        } catch (NoSuchFileException ex) {
            return null;
        } catch (IOException ex) {
            throw new StoreIOException("Failed to stat key store path=" + path, ex);
        }
    }

    private SecretVault requireVault(Snapshot current) {
        if (current.vault() == null) {
            throw new MissingMasterPasswordException(masterPasswordEnv);
        }
        return current.vault();
    }

    private static String decrypt(SecretVault vault, SecretRecord record) {
        try {
            byte[] plaintext = vault.decrypt(new EncryptedSecret(record.ciphertext(), record.nonce()), aad(record.name(), record.version()));
            return new String(plaintext, StandardCharsets.UTF_8);
        } catch (AEADBadTagException ex) {
            throw DecryptionException.forSecret(record.name());
        }
    }

    private static byte[] aad(String name, int version) {
        return (name + "|" + version).getBytes(StandardCharsets.UTF_8);
    }

    static boolean isValidName(String name) {
        return name != null && NAME_PATTERN.matcher(name).matches();
    }

    static void requireValidName(String name) {
        if (!isValidName(name)) {
            throw new IllegalArgumentException("Invalid secret name: " + name);
        }
    }

    private record Snapshot(EncryptedStore store, SecretVault vault, FileStamp stamp) {
    }

    // fileKey changes with every atomic replace on filesystems that expose inodes
    private record FileStamp(Object fileKey, FileTime modified, long size) {
    }

    private final class Draft {

        private final SecretVault vault;
        private final TreeMap<String, SecretRecord> records;

        private Draft(SecretVault vault, Map<String, SecretRecord> records) {
            this.vault = vault;
            this.records = new TreeMap<>(records);
        }

        private SecretRecord put(String name, String value) {
            SecretRecord previous = records.get(name);
            Instant now = clock.instant();
            int version = previous == null ? 1 : previous.version() + 1;
            EncryptedSecret encrypted = vault.encrypt(value.getBytes(StandardCharsets.UTF_8), aad(name, version));
            SecretRecord record = new SecretRecord(
                    name,
                    encrypted.ciphertext(),
                    encrypted.nonce(),
                    version,
                    previous == null ? now : previous.createdAt(),
                    previous == null ? null : now
            );
            records.put(name, record);
            return record;
        }

        private boolean remove(String name) {
            return records.remove(name) != null;
        }
    }
}
