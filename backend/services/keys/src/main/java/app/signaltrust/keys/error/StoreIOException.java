package app.signaltrust.keys.error;

public class StoreIOException extends CredentialException {

    public StoreIOException(String message) {
        super(message);
    }

    public StoreIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
