package app.signaltrust.keys.error;

public class StoreMigrationRequiredException extends CredentialException {

    private final int foundVersion;
    private final int supportedVersion;

    public StoreMigrationRequiredException(int foundVersion, int supportedVersion) {
        super("Key store format version " + foundVersion + " requires migration (supported: " + supportedVersion + ")");
        this.foundVersion = foundVersion;
        this.supportedVersion = supportedVersion;
    }

    public int foundVersion() {
        return foundVersion;
    }

    public int supportedVersion() {
        return supportedVersion;
    }
}
