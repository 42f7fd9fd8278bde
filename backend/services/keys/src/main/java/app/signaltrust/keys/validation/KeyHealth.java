package app.signaltrust.keys.validation;

public enum KeyHealth {
    UNKNOWN,
    HEALTHY,
    NEEDS_CHECK,
    STALE
}
