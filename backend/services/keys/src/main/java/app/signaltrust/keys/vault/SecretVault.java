package app.signaltrust.keys.vault;

public interface SecretVault {
    EncryptedSecret encrypt(byte[] plaintext, byte[] aad);

    /**
     * @throws javax.crypto.AEADBadTagException when the tag does not verify
     */
    byte[] decrypt(EncryptedSecret secret, byte[] aad) throws javax.crypto.AEADBadTagException;
}
