package app.signaltrust.keys.vault;

public record EncryptedSecret(
        byte[] ciphertext,
        byte[] nonce
) {
}
