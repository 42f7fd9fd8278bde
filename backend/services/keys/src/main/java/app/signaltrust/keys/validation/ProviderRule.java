package app.signaltrust.keys.validation;

/**
 * One entry of the rule table: a format rule and, optionally, a connection probe.
 */
public record ProviderRule(
        String keyName,
        String provider,
        FormatRule format,
        ConnectionProbe connectionProbe
) {

    public static ProviderRule of(Provider provider, ConnectionProbe probe) {
        return new ProviderRule(provider.keyName(), provider.displayName(), provider.formatRule(), probe);
    }

    public boolean hasProbe() {
        return connectionProbe != null;
    }
}
