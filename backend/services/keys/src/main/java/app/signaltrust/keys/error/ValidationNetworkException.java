package app.signaltrust.keys.error;

/**
 * Provider could not be reached during a connection check. Built without the transport
 * exception as cause because transport messages can carry request URLs with credentials.
 */
public class ValidationNetworkException extends CredentialException {

    public ValidationNetworkException(String message) {
        super(message);
    }
}
