package app.signaltrust.keys.crypto;

import app.signaltrust.keys.error.KeyDerivationException;
import org.junit.jupiter.api.Test;

import javax.crypto.SecretKey;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MasterKeyDeriverTest {

    private final MasterKeyDeriver deriver = new MasterKeyDeriver();

    @Test
    void deriveIsDeterministicForSamePasswordAndSalt() {
        byte[] salt = deriver.newSalt();

        SecretKey first = deriver.derive("correct horse".toCharArray(), salt);
        SecretKey second = deriver.derive("correct horse".toCharArray(), salt);

        assertThat(first.getEncoded()).hasSize(32).isEqualTo(second.getEncoded());
        assertThat(first.getAlgorithm()).isEqualTo("AES");
    }

    @Test
    void deriveDependsOnPasswordAndSalt() {
        byte[] salt = deriver.newSalt();

        byte[] base = deriver.derive("password-one".toCharArray(), salt).getEncoded();
        byte[] otherPassword = deriver.derive("password-two".toCharArray(), salt).getEncoded();
        byte[] otherSalt = deriver.derive("password-one".toCharArray(), deriver.newSalt()).getEncoded();

        assertThat(otherPassword).isNotEqualTo(base);
        assertThat(otherSalt).isNotEqualTo(base);
    }

    @Test
    void iterationCountMeetsDocumentedMinimum() {
        assertThat(MasterKeyDeriver.ITERATIONS).isGreaterThanOrEqualTo(MasterKeyDeriver.MIN_ITERATIONS);
    }

    @Test
    void emptyPasswordIsRejected() {
        byte[] salt = deriver.newSalt();
        assertThrows(KeyDerivationException.class, () -> deriver.derive(new char[0], salt));
        assertThrows(KeyDerivationException.class, () -> deriver.derive(null, salt));
    }

    @Test
    void wrongLengthSaltIsRejected() {
        assertThrows(KeyDerivationException.class, () -> deriver.derive("pw".toCharArray(), new byte[16]));
        assertThrows(KeyDerivationException.class, () -> deriver.derive("pw".toCharArray(), null));
    }

    @Test
    void newSaltIsRandom() {
        assertThat(deriver.newSalt()).hasSize(MasterKeyDeriver.SALT_LENGTH).isNotEqualTo(deriver.newSalt());
    }
}
