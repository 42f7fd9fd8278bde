package app.signaltrust.keys.error;

/**
 * Base type for every failure raised by the credential store and its validation layer.
 * Messages carry credential names only, never values.
 */
public class CredentialException extends RuntimeException {

    public CredentialException(String message) {
        super(message);
    }

    public CredentialException(String message, Throwable cause) {
        super(message, cause);
    }
}
