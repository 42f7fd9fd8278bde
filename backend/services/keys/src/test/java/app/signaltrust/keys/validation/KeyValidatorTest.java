package app.signaltrust.keys.validation;

import app.signaltrust.keys.error.ValidationNetworkException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KeyValidatorTest {

    private static final String OPENAI_VALUE = "sk-" + "a".repeat(40);
    private static final String GROQ_VALUE = "gsk_" + "b".repeat(30);
    private static final String COINGECKO_VALUE = "CG-" + "c".repeat(24);

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    private KeyValidator validator;

    @AfterEach
    void tearDown() {
        if (validator != null) {
            validator.close();
        }
    }

    @Test
    void formatFailureSkipsProbe() {
        AtomicInteger calls = new AtomicInteger();
        validator = validator(Duration.ofSeconds(1), Map.of(Provider.OPENAI, secret -> {
            calls.incrementAndGet();
            return ProbeOutcome.ok();
        }));

        ValidationResult result = validator.validateKey("OPENAI_API_KEY", "not-a-key", true);

        assertFalse(result.formatValid());
        assertNull(result.connectionValid());
        assertEquals(0, calls.get());
    }

    @Test
    void connectionCheckIsOptIn() {
        AtomicInteger calls = new AtomicInteger();
        validator = validator(Duration.ofSeconds(1), Map.of(Provider.OPENAI, secret -> {
            calls.incrementAndGet();
            return ProbeOutcome.ok();
        }));

        ValidationResult offline = validator.validateKey("OPENAI_API_KEY", OPENAI_VALUE, false);
        ValidationResult online = validator.validateKey("OPENAI_API_KEY", OPENAI_VALUE, true);

        assertTrue(offline.valid());
        assertNull(offline.connectionValid());
        assertTrue(online.connectionValid());
        assertFalse(online.retryable());
        assertEquals(1, calls.get());
    }

    @Test
    void rejectedAndRetryableOutcomesAreKeptApart() {
        validator = validator(Duration.ofSeconds(1), Map.of(
                Provider.OPENAI, secret -> ProbeOutcome.fromStatus(401),
                Provider.GROQ, secret -> ProbeOutcome.fromStatus(503),
                Provider.COINGECKO, secret -> {
                    throw new ValidationNetworkException("CoinGecko is unreachable (ConnectException)");
                }
        ));

        ValidationReport report = validator.validateAllKeys(keys(), true);

        ValidationResult openAi = report.results().get("OPENAI_API_KEY");
        assertFalse(openAi.connectionValid());
        assertFalse(openAi.retryable());
        assertEquals("Invalid API key (401 Unauthorized)", openAi.error());

        ValidationResult groq = report.results().get("GROQ_API_KEY");
        assertFalse(groq.connectionValid());
        assertTrue(groq.retryable());

        ValidationResult coinGecko = report.results().get("COINGECKO_API_KEY");
        assertTrue(coinGecko.retryable());
        assertEquals("CoinGecko is unreachable (ConnectException)", coinGecko.error());
        assertFalse(report.allValid());
        assertThat(report.failures()).hasSize(3);
    }

    @Test
    void slowProbeTimesOutWithoutAffectingOthers() {
        CountDownLatch never = new CountDownLatch(1);
        validator = validator(Duration.ofMillis(500), Map.of(
                Provider.OPENAI, secret -> ProbeOutcome.ok(),
                Provider.GROQ, secret -> {
                    try {
                        never.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException ex) {
                        Thread.currentThread().interrupt();
                    }
                    return ProbeOutcome.ok();
                },
                Provider.COINGECKO, secret -> ProbeOutcome.ok()
        ));

        long startedAt = System.nanoTime();
        ValidationReport report = validator.validateAllKeys(keys(), true);
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startedAt);

        assertThat(elapsed).isLessThan(Duration.ofMillis(1_500));
        ValidationResult groq = report.results().get("GROQ_API_KEY");
        assertFalse(groq.connectionValid());
        assertTrue(groq.retryable());
        assertEquals("Connection check timed out after 500ms", groq.error());
        assertTrue(report.results().get("OPENAI_API_KEY").connectionValid());
        assertTrue(report.results().get("COINGECKO_API_KEY").connectionValid());
    }

    @Test
    void probeExceptionIsRecordedAsRetryableFailure() {
        validator = validator(Duration.ofSeconds(1), Map.of(Provider.OPENAI, secret -> {
            throw new IllegalStateException("boom " + secret);
        }));

        ValidationResult result = validator.validateKey("OPENAI_API_KEY", OPENAI_VALUE, true);

        assertTrue(result.retryable());
        assertThat(result.error()).isEqualTo("Connection check failed (IllegalStateException)");
    }

    @Test
    void reportKeepsInputOrder() {
        validator = validator(Duration.ofSeconds(1), Map.of());
        Map<String, String> keys = new LinkedHashMap<>();
        keys.put("ZETA_TOKEN", "0123456789");
        keys.put("OPENAI_API_KEY", OPENAI_VALUE);
        keys.put("ALPHA_TOKEN", "short");

        ValidationReport report = validator.validateAllKeys(keys, false);

        assertThat(report.results()).containsOnlyKeys("ZETA_TOKEN", "OPENAI_API_KEY", "ALPHA_TOKEN");
        assertThat(report.results().keySet()).containsExactly("ZETA_TOKEN", "OPENAI_API_KEY", "ALPHA_TOKEN");
        assertThat(report.failures()).extracting(ValidationResult::name).containsExactly("ALPHA_TOKEN");
    }

    @Test
    void healthFollowsLastSuccessfulCheck() {
        validator = validator(Duration.ofSeconds(1), Map.of(Provider.OPENAI, secret -> ProbeOutcome.ok()));

        assertEquals(KeyHealth.UNKNOWN, validator.health("OPENAI_API_KEY"));

        validator.validateKey("OPENAI_API_KEY", OPENAI_VALUE, true);
        assertEquals(KeyHealth.HEALTHY, validator.health("OPENAI_API_KEY"));

        clock.advance(Duration.ofHours(2));
        assertEquals(KeyHealth.NEEDS_CHECK, validator.health("OPENAI_API_KEY"));

        clock.advance(Duration.ofDays(1));
        assertEquals(KeyHealth.STALE, validator.health("OPENAI_API_KEY"));
    }

    private KeyValidator validator(Duration timeout, Map<Provider, ConnectionProbe> probes) {
        return new KeyValidator(ProviderRegistry.builder().registerAll(probes).build(), timeout, clock);
    }

    private static Map<String, String> keys() {
        Map<String, String> keys = new LinkedHashMap<>();
        keys.put("OPENAI_API_KEY", OPENAI_VALUE);
        keys.put("GROQ_API_KEY", GROQ_VALUE);
        keys.put("COINGECKO_API_KEY", COINGECKO_VALUE);
        return keys;
    }
}
