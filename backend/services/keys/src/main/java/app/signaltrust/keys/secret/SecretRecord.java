package app.signaltrust.keys.secret;

import java.time.Instant;

public record SecretRecord(
        String name,
        byte[] ciphertext,
        byte[] nonce,
        int version,
        Instant createdAt,
        Instant rotatedAt
) {
}
