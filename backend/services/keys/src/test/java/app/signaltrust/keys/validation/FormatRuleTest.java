package app.signaltrust.keys.validation;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FormatRuleTest {

    private final ProviderRegistry registry = ProviderRegistry.formatOnly();

    @Test
    void acceptsWellFormedProviderKeys() {
        assertValid("OPENAI_API_KEY", "sk-" + "a".repeat(40));
        assertValid("ANTHROPIC_API_KEY", "sk-ant-api03-" + "b".repeat(80));
        assertValid("GROQ_API_KEY", "gsk_" + "C1".repeat(20));
        assertValid("COINGECKO_API_KEY", "CG-" + "d2".repeat(12));
        assertValid("ALPHAVANTAGE_API_KEY", "ABCDEFGH12345678");
        assertValid("WHALEALERT_API_KEY", "w".repeat(32));
        assertValid("NEWS_CATCHER_API_KEY", "n_-".repeat(12));
        assertValid("ETHERSCAN_API_KEY", "E".repeat(34));
    }

    @Test
    void rejectsWrongPrefixOrShape() {
        assertInvalid("OPENAI_API_KEY", "pk-" + "a".repeat(40));
        assertInvalid("ANTHROPIC_API_KEY", "sk-" + "b".repeat(60));
        assertInvalid("GROQ_API_KEY", "gsk_short");
        assertInvalid("ALPHAVANTAGE_API_KEY", "abcdefgh12345678");
        assertInvalid("ETHERSCAN_API_KEY", "E".repeat(33));
        assertInvalid("WHALEALERT_API_KEY", "w".repeat(65));
    }

    @Test
    void emptyValueIsInvalidForEveryProvider() {
        for (Provider provider : Provider.values()) {
            assertThat(registry.rule(provider.keyName()).format().check(""))
                    .as(provider.keyName())
                    .contains("Key value is empty");
        }
        assertThat(registry.rule("SOMETHING_ELSE").format().check(null)).contains("Key value is empty");
    }

    @Test
    void unknownNamesOnlyNeedMinimumLength() {
        ProviderRule rule = registry.rule("INTERNAL_SERVICE_TOKEN");

        assertFalse(registry.isKnown("INTERNAL_SERVICE_TOKEN"));
        assertFalse(rule.hasProbe());
        assertTrue(rule.format().check("0123456789").isEmpty());
        assertThat(rule.format().check("012345678")).hasValueSatisfying(
                error -> assertThat(error).startsWith("Key is too short"));
    }

    @Test
    void errorMessagesNeverEchoTheValue() {
        String value = "sk-" + "x".repeat(5) + "!!";

        assertThat(registry.rule("OPENAI_API_KEY").format().check(value))
                .hasValueSatisfying(error -> assertThat(error).doesNotContain(value).startsWith("Format invalid"));
    }

    @Test
    void registryKnowsEveryProviderKeyName() {
        assertEquals(Provider.values().length, registry.knownKeyNames().size());
        assertThat(Provider.fromKeyName("GROQ_API_KEY")).contains(Provider.GROQ);
        assertThat(Provider.fromKeyName("UNKNOWN")).isEmpty();
    }

    private void assertValid(String name, String value) {
        assertThat(registry.rule(name).format().check(value)).as(name).isEmpty();
    }

    private void assertInvalid(String name, String value) {
        assertThat(registry.rule(name).format().check(value)).as(name).isPresent();
    }
}
