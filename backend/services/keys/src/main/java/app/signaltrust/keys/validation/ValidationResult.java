package app.signaltrust.keys.validation;

import java.time.Instant;

/**
 * Outcome of one validation. {@code connectionValid} and {@code retryable} are null when no
 * connection check ran.
 */
public record ValidationResult(
        String name,
        boolean formatValid,
        Boolean connectionValid,
        Boolean retryable,
        String error,
        Instant checkedAt
) {

    public boolean valid() {
        return formatValid && (connectionValid == null || connectionValid);
    }
}
