package app.signaltrust.keys.secret;

import app.signaltrust.keys.crypto.MasterKeyDeriver;
import app.signaltrust.keys.error.StoreCorruptException;
import app.signaltrust.keys.error.StoreMigrationRequiredException;
import app.signaltrust.keys.vault.EncryptedSecret;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads and writes the JSON layout of the store file. Binary fields are base64 encoded by
 * Jackson. The format version is checked before the rest of the document is mapped so a store
 * written by another release fails with a migration error instead of a parse error.
 */
public class StoreFileCodec {

    private final ObjectMapper objectMapper;

    public StoreFileCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public byte[] write(EncryptedStore store) {
        Map<String, RecordDocument> records = new LinkedHashMap<>();
        store.records().forEach((name, record) -> records.put(name, new RecordDocument(
                record.nonce(),
                record.ciphertext(),
                record.version(),
                record.createdAt(),
                record.rotatedAt()
        )));
        SealedDocument keyCheck = store.keyCheck() == null
                ? null
                : new SealedDocument(store.keyCheck().nonce(), store.keyCheck().ciphertext());
        StoreDocument document = new StoreDocument(
                store.formatVersion(),
                new KdfDocument(MasterKeyDeriver.ALGORITHM, MasterKeyDeriver.ITERATIONS, store.kdfSalt()),
                keyCheck,
                records
        );
        try {
            return objectMapper.writeValueAsBytes(document);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize key store", ex);
        }
    }

    public EncryptedStore read(byte[] content, int supportedVersion) {
        if (content == null || content.length == 0) {
            throw new StoreCorruptException("Key store file is empty");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (IOException ex) {
            throw new StoreCorruptException("Key store file is not valid JSON", ex);
        }
        if (root == null || !root.isObject()) {
            throw new StoreCorruptException("Key store root must be an object");
        }
        JsonNode versionNode = root.path("format_version");
        if (!versionNode.isInt()) {
            throw new StoreCorruptException("Key store is missing format_version");
        }
        if (versionNode.intValue() != supportedVersion) {
            throw new StoreMigrationRequiredException(versionNode.intValue(), supportedVersion);
        }

        StoreDocument document;
        try {
            document = objectMapper.treeToValue(root, StoreDocument.class);
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            throw new StoreCorruptException("Key store structure is malformed", ex);
        }
        return toStore(document, supportedVersion);
    }

    private EncryptedStore toStore(StoreDocument document, int supportedVersion) {
        KdfDocument kdf = document.kdf();
        if (kdf == null || kdf.salt() == null || kdf.salt().length != MasterKeyDeriver.SALT_LENGTH) {
            throw new StoreCorruptException("Key store header is missing a valid KDF salt");
        }
        if (!MasterKeyDeriver.ALGORITHM.equals(kdf.algorithm()) || kdf.iterations() == null
                || kdf.iterations() != MasterKeyDeriver.ITERATIONS) {
            throw new StoreCorruptException("Key store uses unsupported KDF parameters");
        }
        EncryptedSecret keyCheck = null;
        if (document.keyCheck() != null) {
            if (document.keyCheck().nonce() == null || document.keyCheck().ciphertext() == null) {
                throw new StoreCorruptException("Key store key check is incomplete");
            }
            keyCheck = new EncryptedSecret(document.keyCheck().ciphertext(), document.keyCheck().nonce());
        }

        TreeMap<String, SecretRecord> records = new TreeMap<>();
        if (document.records() != null) {
            document.records().forEach((name, entry) -> records.put(name, toRecord(name, entry)));
        }
        return new EncryptedStore(supportedVersion, kdf.salt(), keyCheck, records);
    }

    private SecretRecord toRecord(String name, RecordDocument entry) {
        if (entry == null
                || entry.nonce() == null
                || entry.ciphertext() == null
                || entry.version() == null
                || entry.version() < 1
                || entry.createdAt() == null) {
            throw new StoreCorruptException("Key store record is malformed: " + name);
        }
        return new SecretRecord(name, entry.ciphertext(), entry.nonce(), entry.version(), entry.createdAt(), entry.rotatedAt());
    }

    record StoreDocument(
            @JsonProperty("format_version") Integer formatVersion,
            KdfDocument kdf,
            @JsonProperty("key_check") SealedDocument keyCheck,
            Map<String, RecordDocument> records
    ) {
    }

    record KdfDocument(
            String algorithm,
            Integer iterations,
            byte[] salt
    ) {
    }

    record SealedDocument(
            byte[] nonce,
            byte[] ciphertext
    ) {
    }

    record RecordDocument(
            byte[] nonce,
            byte[] ciphertext,
            Integer version,
            @JsonProperty("created_at") Instant createdAt,
            @JsonProperty("rotated_at") Instant rotatedAt
    ) {
    }
}
