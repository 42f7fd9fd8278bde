package app.signaltrust.keys.secret;

import app.signaltrust.keys.vault.EncryptedSecret;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable view of the store file. {@code kdfSalt} is null until the first record is written.
 */
public record EncryptedStore(
        int formatVersion,
        byte[] kdfSalt,
        EncryptedSecret keyCheck,
        SortedMap<String, SecretRecord> records
) {

    public EncryptedStore {
        records = Collections.unmodifiableSortedMap(new TreeMap<>(records));
    }

    static EncryptedStore empty(int formatVersion) {
        return new EncryptedStore(formatVersion, null, null, new TreeMap<>());
    }

    boolean initialized() {
        return kdfSalt != null;
    }

    EncryptedStore withRecords(Map<String, SecretRecord> next) {
        return new EncryptedStore(formatVersion, kdfSalt, keyCheck, new TreeMap<>(next));
    }
}
