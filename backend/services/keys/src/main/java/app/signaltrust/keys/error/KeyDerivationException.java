package app.signaltrust.keys.error;

public class KeyDerivationException extends CredentialException {

    public KeyDerivationException(String message) {
        super(message);
    }

    public KeyDerivationException(String message, Throwable cause) {
        super(message, cause);
    }
}
