package app.signaltrust.keys.error;

/**
 * Authentication check failed on read. Reading a single secret reports {@link #forSecret} whether
 * the master password is wrong or the record was tampered with; {@link #forStore} is only raised
 * when the whole store is opened.
 */
public class DecryptionException extends CredentialException {

    private DecryptionException(String message) {
        super(message);
    }

    public static DecryptionException forSecret(String name) {
        return new DecryptionException("Unable to decrypt secret " + name);
    }

    public static DecryptionException forStore() {
        return new DecryptionException("Unable to decrypt key store");
    }
}
