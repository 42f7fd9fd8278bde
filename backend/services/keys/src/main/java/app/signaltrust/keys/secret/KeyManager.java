package app.signaltrust.keys.secret;

import app.signaltrust.keys.env.ProcessEnvironment;
import app.signaltrust.keys.error.ConfigurationException;
import app.signaltrust.keys.error.DecryptionException;
import app.signaltrust.keys.validation.KeyValidator;
import app.signaltrust.keys.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Entry point for credential access. Created once at startup and closed at teardown, which
 * flushes writes made with {@code save = false}.
 *
 * <p>Lookup order is fixed: unsaved values set through this manager, then {@link ResolutionSource#STORE},
 * then {@link ResolutionSource#ENVIRONMENT}, then {@link ResolutionSource#NONE}. A store record that
 * fails authentication is reported as a warning and lookup continues with the environment.
 */
public class KeyManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(KeyManager.class);
    public static final String ENV_KEY_SUFFIX = "_KEY";
    public static final List<ResolutionSource> RESOLUTION_ORDER =
            List.of(ResolutionSource.STORE, ResolutionSource.ENVIRONMENT, ResolutionSource.NONE);

    private final SecretStore store;
    private final ProcessEnvironment environment;
    private final KeyValidator validator;
    private final Map<String, String> pending = new LinkedHashMap<>();

    public KeyManager(SecretStore store, ProcessEnvironment environment, KeyValidator validator) {
        this.store = store;
        this.environment = environment;
        this.validator = validator;
    }

    public Optional<String> getKey(String name) {
        return resolve(name).valueOptional();
    }

    public KeyResolution resolve(String name) {
        String unsaved = pendingValue(name);
        if (unsaved != null) {
            return new KeyResolution(name, unsaved, ResolutionSource.STORE, null);
        }
        String warning = null;
        for (ResolutionSource source : RESOLUTION_ORDER) {
            switch (source) {
                case STORE -> {
                    try {
                        Optional<String> stored = store.get(name);
                        if (stored.isPresent()) {
                            return new KeyResolution(name, stored.get(), ResolutionSource.STORE, null);
                        }
                    } catch (DecryptionException ex) {
                        log.warn("Stored key failed authentication, falling back to environment name={}", name);
                        warning = ex.getMessage();
                    } catch (ConfigurationException ex) {
                        log.warn("Key store unavailable, falling back to environment name={} reason={}", name, ex.getMessage());
                        warning = ex.getMessage();
                    }
                }
                case ENVIRONMENT -> {
                    Optional<String> fromEnv = environment.get(name);
                    if (fromEnv.isPresent()) {
                        return new KeyResolution(name, fromEnv.get(), ResolutionSource.ENVIRONMENT, warning);
                    }
                }
                case NONE -> {
                    return new KeyResolution(name, null, ResolutionSource.NONE, warning);
                }
            }
        }
        return new KeyResolution(name, null, ResolutionSource.NONE, warning);
    }

    public void setKey(String name, String value, boolean save) {
        if (!save) {
            SecretStore.requireValidName(name);
            if (value == null || value.isEmpty()) {
                throw new IllegalArgumentException("Secret value is required for " + name);
            }
            synchronized (pending) {
                pending.put(name, value);
            }
            log.info("Key staged name={}", name);
            return;
        }
        store.set(name, value);
        synchronized (pending) {
            pending.remove(name);
        }
        log.info("Key stored name={}", name);
    }

    public void setKey(String name, String value) {
        setKey(name, value, true);
    }

    /**
     * Replaces an existing key in one atomic write. On failure the previous record stays in
     * place on disk and in memory.
     */
    public SecretRecord rotateKey(String name, String newValue) {
        if (!store.contains(name) && pendingValue(name) == null) {
            throw new IllegalArgumentException("No stored key to rotate: " + name);
        }
        log.info("Rotating key name={}", name);
        SecretRecord rotated = store.set(name, newValue);
        synchronized (pending) {
            pending.remove(name);
        }
        log.info("Key rotated name={} version={}", name, rotated.version());
        return rotated;
    }

    public boolean deleteKey(String name) {
        boolean removedPending;
        synchronized (pending) {
            removedPending = pending.remove(name) != null;
        }
        boolean removedStored = store.delete(name);
        if (removedPending || removedStored) {
            log.info("Key deleted name={}", name);
        }
        return removedPending || removedStored;
    }

    /**
     * Copies environment values into the store for names that have no stored record. Existing
     * records are never overwritten; that takes {@link #rotateKey}.
     */
    public int importFromEnv(Collection<String> names) {
        Map<String, String> imports = new LinkedHashMap<>();
        for (String name : names) {
            if (store.contains(name) || pendingValue(name) != null) {
                log.info("Skipping import, key already stored name={}", name);
                continue;
            }
            environment.get(name).ifPresent(value -> imports.put(name, value));
        }
        if (!imports.isEmpty()) {
            store.setAll(imports);
        }
        log.info("Imported {} keys from environment", imports.size());
        return imports.size();
    }

    /**
     * Imports every environment variable whose name ends in {@value #ENV_KEY_SUFFIX}.
     */
    public int importFromEnv() {
        List<String> candidates = environment.names().stream()
                .filter(name -> name.endsWith(ENV_KEY_SUFFIX))
                .filter(SecretStore::isValidName)
                .toList();
        return importFromEnv(candidates);
    }

    public int exportToEnv(Collection<String> names) {
        int count = 0;
        for (String name : names) {
            Optional<String> value = getKey(name);
            if (value.isPresent()) {
                environment.export(name, value.get());
                count++;
            }
        }
        log.info("Exported {} keys to process environment", count);
        return count;
    }

    public List<MaskedSecret> listKeys() {
        return store.list();
    }

    /**
     * Names of stored records, or an empty set when the store cannot be opened because the master
     * password is missing or wrong.
     */
    public Set<String> storedNames() {
        try {
            return store.names();
        } catch (ConfigurationException ex) {
            log.warn("Key store unavailable, listing no stored names reason={}", ex.getMessage());
            return Set.of();
        } catch (DecryptionException ex) {
            log.warn("Key store failed authentication, listing no stored names");
            return Set.of();
        }
    }

    public ValidationResult verifyKey(String name, boolean testConnection) {
        return validator.validateKey(name, getKey(name).orElse(null), testConnection);
    }

    public boolean hasPendingChanges() {
        synchronized (pending) {
            return !pending.isEmpty();
        }
    }

    public void flush() {
        Map<String, String> toWrite;
        synchronized (pending) {
            if (pending.isEmpty()) {
                return;
            }
            toWrite = new LinkedHashMap<>(pending);
        }
        store.setAll(toWrite);
        synchronized (pending) {
            toWrite.forEach(pending::remove);
        }
        log.info("Flushed {} staged keys", toWrite.size());
    }

    @Override
    public void close() {
        if (hasPendingChanges()) {
            flush();
        }
    }

    private String pendingValue(String name) {
        synchronized (pending) {
            return pending.get(name);
        }
    }
}
