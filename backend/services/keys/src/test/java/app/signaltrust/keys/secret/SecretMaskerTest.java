package app.signaltrust.keys.secret;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SecretMaskerTest {

    @Test
    void keepsOnlyLastFourCharacters() {
        assertEquals("****7890", SecretMasker.mask("sk-abcdef1234567890"));
        assertEquals("****5678", SecretMasker.mask("12345678"));
    }

    @Test
    void shortValuesAreFullyHidden() {
        assertEquals("****", SecretMasker.mask("1234567"));
        assertEquals("****", SecretMasker.mask(""));
        assertEquals("****", SecretMasker.mask(null));
    }
}
