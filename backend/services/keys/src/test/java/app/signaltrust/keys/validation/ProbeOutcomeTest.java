package app.signaltrust.keys.validation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProbeOutcomeTest {

    @Test
    void okIsAcceptedAndNotRetryable() {
        ProbeOutcome outcome = ProbeOutcome.ok();

        assertTrue(outcome.accepted());
        assertFalse(outcome.retryable());
        assertNull(outcome.error());
    }

    @Test
    void classifiesStatusCodes() {
        assertTrue(ProbeOutcome.fromStatus(200).accepted());
        assertTrue(ProbeOutcome.fromStatus(204).accepted());

        assertFalse(ProbeOutcome.fromStatus(401).retryable());
        assertFalse(ProbeOutcome.fromStatus(403).retryable());
        assertFalse(ProbeOutcome.fromStatus(404).retryable());
        assertEquals("Unexpected response (404)", ProbeOutcome.fromStatus(404).error());

        assertTrue(ProbeOutcome.fromStatus(429).retryable());
        assertTrue(ProbeOutcome.fromStatus(502).retryable());
        assertFalse(ProbeOutcome.fromStatus(502).accepted());
    }
}
