package app.signaltrust.keys.secret;

public final class SecretMasker {

    public static final String UNDECRYPTABLE = "<undecryptable>";
    private static final String MASK = "****";
    private static final int MIN_REVEAL_LENGTH = 8;
    private static final int VISIBLE_SUFFIX = 4;

    private SecretMasker() {
    }

    public static String mask(String value) {
        if (value == null || value.length() < MIN_REVEAL_LENGTH) {
            return MASK;
        }
        return MASK + value.substring(value.length() - VISIBLE_SUFFIX);
    }
}
