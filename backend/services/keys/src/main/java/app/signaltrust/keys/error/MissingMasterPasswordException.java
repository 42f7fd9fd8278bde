package app.signaltrust.keys.error;

public class MissingMasterPasswordException extends ConfigurationException {

    public MissingMasterPasswordException(String passwordEnv) {
        super("Master password is not configured (set " + passwordEnv + ")");
    }
}
