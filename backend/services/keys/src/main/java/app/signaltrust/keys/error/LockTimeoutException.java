package app.signaltrust.keys.error;

import java.time.Duration;

public class LockTimeoutException extends StoreIOException {

    public LockTimeoutException(Duration timeout) {
        super("Timed out after " + timeout.toMillis() + "ms waiting for the key store write lock");
    }
}
