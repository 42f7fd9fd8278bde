package app.signaltrust.keys.error;

public class ConfigurationException extends CredentialException {

    public ConfigurationException(String message) {
        super(message);
    }
}
