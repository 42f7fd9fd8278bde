package app.signaltrust.keys.secret;

/**
 * Where a credential was resolved from. Declaration order is the lookup order.
 */
public enum ResolutionSource {
    STORE,
    ENVIRONMENT,
    NONE
}
