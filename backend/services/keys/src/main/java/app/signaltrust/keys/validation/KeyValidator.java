package app.signaltrust.keys.validation;

import app.signaltrust.keys.error.ValidationNetworkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Format checks against the provider rule table and optional live probes. Probes run on their
 * own threads with a shared deadline per call; a probe that misses the deadline is cancelled and
 * recorded as a retryable failure without touching the other entries.
 */
public class KeyValidator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(KeyValidator.class);
    private static final Duration HEALTHY_WINDOW = Duration.ofHours(1);
    private static final Duration NEEDS_CHECK_WINDOW = Duration.ofDays(1);

    private final ProviderRegistry registry;
    private final Duration timeout;
    private final Clock clock;
    private final ExecutorService executor;
    private final Map<String, Instant> lastConfirmed = new ConcurrentHashMap<>();

    public KeyValidator(ProviderRegistry registry, Duration timeout, Clock clock) {
        this.registry = registry;
        this.timeout = timeout;
        this.clock = clock;
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("key-validator-");
        threadFactory.setDaemon(true);
        this.executor = Executors.newCachedThreadPool(threadFactory);
    }

    public ProviderRegistry registry() {
        return registry;
    }

    public ValidationResult validateKey(String name, String value, boolean testConnection) {
        ProviderRule rule = registry.rule(name);
        Optional<String> formatError = rule.format().check(value);
        if (formatError.isPresent()) {
            return result(name, false, null, null, formatError.get());
        }
        if (!testConnection || !rule.hasProbe()) {
            return result(name, true, null, null, null);
        }
        Future<ValidationResult> probe = executor.submit(() -> probe(name, rule, value));
        return await(name, probe, System.nanoTime() + timeout.toNanos());
    }

    public ValidationReport validateAllKeys(Map<String, String> keys, boolean testConnection) {
        long startedAt = System.nanoTime();
        long deadline = startedAt + timeout.toNanos();
        Map<String, ValidationResult> collected = new ConcurrentHashMap<>();
        Map<String, Future<ValidationResult>> pending = new LinkedHashMap<>();

        keys.forEach((name, value) -> {
            ProviderRule rule = registry.rule(name);
            Optional<String> formatError = rule.format().check(value);
            if (formatError.isPresent()) {
                collected.put(name, result(name, false, null, null, formatError.get()));
            } else if (!testConnection || !rule.hasProbe()) {
                collected.put(name, result(name, true, null, null, null));
            } else {
                pending.put(name, executor.submit(() -> probe(name, rule, value)));
            }
        });
        pending.forEach((name, future) -> collected.put(name, await(name, future, deadline)));

        Map<String, ValidationResult> ordered = new LinkedHashMap<>();
        for (String name : keys.keySet()) {
            ordered.put(name, collected.get(name));
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startedAt);
        log.info("Key validation finished keys={} connectionChecks={} elapsedMs={}", keys.size(), pending.size(), elapsed.toMillis());
        return new ValidationReport(Collections.unmodifiableMap(ordered), elapsed);
    }

    public KeyHealth health(String name) {
        Instant confirmed = lastConfirmed.get(name);
        if (confirmed == null) {
            return KeyHealth.UNKNOWN;
        }
        Duration age = Duration.between(confirmed, clock.instant());
        if (age.compareTo(HEALTHY_WINDOW) < 0) {
            return KeyHealth.HEALTHY;
        }
        if (age.compareTo(NEEDS_CHECK_WINDOW) < 0) {
            return KeyHealth.NEEDS_CHECK;
        }
        return KeyHealth.STALE;
    }

    private ValidationResult probe(String name, ProviderRule rule, String value) {
        try {
            ProbeOutcome outcome = rule.connectionProbe().probe(value);
            if (outcome.accepted()) {
                lastConfirmed.put(name, clock.instant());
                return result(name, true, true, false, null);
            }
            log.warn("Key rejected by provider name={} provider={} retryable={}", name, rule.provider(), outcome.retryable());
            return result(name, true, false, outcome.retryable(), outcome.error());
        } catch (ValidationNetworkException ex) {
            log.warn("Key validation probe failed name={} provider={} error={}", name, rule.provider(), ex.getMessage());
            return result(name, true, false, true, ex.getMessage());
        } catch (RuntimeException ex) {
            log.warn("Key validation probe failed name={} provider={} errorType={}", name, rule.provider(), ex.getClass().getSimpleName());
            return result(name, true, false, true, "Connection check failed (" + ex.getClass().getSimpleName() + ")");
        }
    }

    private ValidationResult await(String name, Future<ValidationResult> future, long deadlineNanos) {
        long remaining = Math.max(deadlineNanos - System.nanoTime(), 0L);
        try {
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("Key validation probe timed out name={} timeoutMs={}", name, timeout.toMillis());
            return result(name, true, false, true, "Connection check timed out after " + timeout.toMillis() + "ms");
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return result(name, true, false, true, "Connection check interrupted");
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            return result(name, true, false, true, "Connection check failed (" + cause.getClass().getSimpleName() + ")");
        }
    }

    private ValidationResult result(String name, boolean formatValid, Boolean connectionValid, Boolean retryable, String error) {
        return new ValidationResult(name, formatValid, connectionValid, retryable, error, clock.instant());
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
