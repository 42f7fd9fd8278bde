package app.signaltrust.keys.vault;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;

/**
 * AES-256-GCM over a key derived from the master password. Every encryption draws a fresh
 * random 96-bit nonce.
 */
public class AesGcmSecretVault implements SecretVault {

    public static final int NONCE_LENGTH = 12;
    private static final int TAG_LENGTH_BITS = 128;
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";

    private final SecretKey key;
    private final SecureRandom random = new SecureRandom();

    public AesGcmSecretVault(SecretKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key is required");
        }
        this.key = key;
    }

    @Override
    public EncryptedSecret encrypt(byte[] plaintext, byte[] aad) {
        if (plaintext == null) {
            throw new IllegalArgumentException("plaintext is required");
        }
        byte[] nonce = randomNonce();
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, nonce));
            if (aad != null && aad.length > 0) {
                cipher.updateAAD(aad);
            }
            return new EncryptedSecret(cipher.doFinal(plaintext), nonce);
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("Failed to encrypt secret", ex);
        }
    }

    @Override
    public byte[] decrypt(EncryptedSecret secret, byte[] aad) throws AEADBadTagException {
        if (secret == null) {
            throw new IllegalArgumentException("secret is required");
        }
        if (secret.nonce() == null || secret.nonce().length != NONCE_LENGTH || secret.ciphertext() == null) {
            throw new AEADBadTagException("Malformed nonce or ciphertext");
        }
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, secret.nonce()));
            if (aad != null && aad.length > 0) {
                cipher.updateAAD(aad);
            }
            return cipher.doFinal(secret.ciphertext());
        } catch (AEADBadTagException ex) {
            throw ex;
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("Failed to decrypt secret", ex);
        }
    }

    private byte[] randomNonce() {
        byte[] nonce = new byte[NONCE_LENGTH];
        random.nextBytes(nonce);
        return nonce;
    }
}
