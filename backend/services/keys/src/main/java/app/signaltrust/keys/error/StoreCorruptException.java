package app.signaltrust.keys.error;

public class StoreCorruptException extends CredentialException {

    public StoreCorruptException(String message) {
        super(message);
    }

    public StoreCorruptException(String message, Throwable cause) {
        super(message, cause);
    }
}
