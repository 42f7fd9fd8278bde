package app.signaltrust.keys.validation;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Explicitly registered provider rules keyed by credential name. Names without a registration
 * fall back to a generic minimum-length rule with no connection probe.
 */
public class ProviderRegistry {

    static final int GENERIC_MIN_LENGTH = 10;

    private final Map<String, ProviderRule> rules;

    private ProviderRegistry(Map<String, ProviderRule> rules) {
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
    }

    public ProviderRule rule(String keyName) {
        ProviderRule rule = rules.get(keyName);
        if (rule != null) {
            return rule;
        }
        return new ProviderRule(keyName, "generic", FormatRule.minLength(GENERIC_MIN_LENGTH), null);
    }

    public boolean isKnown(String keyName) {
        return rules.containsKey(keyName);
    }

    public Set<String> knownKeyNames() {
        return rules.keySet();
    }

    public static ProviderRegistry formatOnly() {
        return builder().registerAll(new EnumMap<>(Provider.class)).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private final Map<String, ProviderRule> rules = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(ProviderRule rule) {
            rules.put(rule.keyName(), rule);
            return this;
        }

        public Builder register(Provider provider, ConnectionProbe probe) {
            return register(ProviderRule.of(provider, probe));
        }

        /**
         * Registers every {@link Provider}, attaching the probes present in {@code probes}.
         */
        public Builder registerAll(Map<Provider, ConnectionProbe> probes) {
            for (Provider provider : Provider.values()) {
                register(provider, probes.get(provider));
            }
            return this;
        }

        public ProviderRegistry build() {
            return new ProviderRegistry(rules);
        }
    }
}
