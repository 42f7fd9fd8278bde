package app.signaltrust.keys.crypto;

import app.signaltrust.keys.error.KeyDerivationException;

import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;

/**
 * Derives the store encryption key from the master password and the salt kept in the store
 * header. PBKDF2 with HMAC-SHA256 and a fixed round count; the output is an AES-256 key.
 */
public class MasterKeyDeriver {

    public static final String ALGORITHM = "PBKDF2WithHmacSHA256";
    public static final int ITERATIONS = 210_000;
    public static final int MIN_ITERATIONS = 100_000;
    public static final int SALT_LENGTH = 32;
    public static final int KEY_LENGTH_BITS = 256;

    private final SecureRandom random = new SecureRandom();

    public SecretKey derive(char[] password, byte[] salt) {
        if (password == null || password.length == 0) {
            throw new KeyDerivationException("Master password is empty");
        }
        if (salt == null || salt.length != SALT_LENGTH) {
            throw new KeyDerivationException("KDF salt must be " + SALT_LENGTH + " bytes");
        }
        PBEKeySpec spec = new PBEKeySpec(password, salt, ITERATIONS, KEY_LENGTH_BITS);
        try {
            byte[] encoded = SecretKeyFactory.getInstance(ALGORITHM).generateSecret(spec).getEncoded();
            return new SecretKeySpec(encoded, "AES");
        } catch (GeneralSecurityException ex) {
            throw new KeyDerivationException("Key derivation failed", ex);
        } finally {
            spec.clearPassword();
        }
    }

    public byte[] newSalt() {
        byte[] salt = new byte[SALT_LENGTH];
        random.nextBytes(salt);
        return salt;
    }
}
