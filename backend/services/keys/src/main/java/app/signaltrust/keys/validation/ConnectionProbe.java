package app.signaltrust.keys.validation;

/**
 * One low-cost authenticated request against a provider.
 *
 * @throws app.signaltrust.keys.error.ValidationNetworkException when the provider cannot be reached
 */
@FunctionalInterface
public interface ConnectionProbe {
    ProbeOutcome probe(String secret);
}
