package app.signaltrust.keys.secret;

import java.time.Instant;

public record MaskedSecret(
        String name,
        String preview,
        int version,
        Instant createdAt,
        Instant rotatedAt
) {
}
