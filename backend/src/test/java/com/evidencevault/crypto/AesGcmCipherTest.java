package com.evidencevault.crypto;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AES-GCM primitive through the BouncyCastle provider. No Spring context, no
 * mocks: raw crypto assertions only.
 */
class AesGcmCipherTest {

    private final AesGcmCipher cipher = new AesGcmCipher();
    private final SecureRandom random = new SecureRandom();

    private byte[] randomBytes(int length) {
        byte[] bytes = new byte[length];
        random.nextBytes(bytes);
        return bytes;
    }

    @Test
    void encryptDecryptRoundTrip() throws Exception {
        byte[] key = randomBytes(32);
        byte[] nonce = randomBytes(AeadCipher.NONCE_LENGTH);
        byte[] plaintext = "evidence payload".getBytes(StandardCharsets.UTF_8);

        AeadCipher.Sealed sealed = cipher.encrypt(key, nonce, plaintext);

        assertEquals(plaintext.length, sealed.ciphertext().length, "GCM adds no padding");
        assertEquals(AeadCipher.TAG_LENGTH, sealed.tag().length);
        assertArrayEquals(plaintext, cipher.decrypt(key, nonce, sealed.ciphertext(), sealed.tag()));
    }

    @Test
    void freshNonceGivesDifferentCiphertextForSamePlaintext() throws Exception {
        byte[] key = randomBytes(32);
        byte[] plaintext = "same plaintext".getBytes(StandardCharsets.UTF_8);

        AeadCipher.Sealed first = cipher.encrypt(key, randomBytes(AeadCipher.NONCE_LENGTH), plaintext);
        AeadCipher.Sealed second = cipher.encrypt(key, randomBytes(AeadCipher.NONCE_LENGTH), plaintext);

        assertFalse(java.util.Arrays.equals(first.ciphertext(), second.ciphertext()));
    }

    @Test
    void decryptionFailsWithWrongKey() throws Exception {
        byte[] nonce = randomBytes(AeadCipher.NONCE_LENGTH);
        AeadCipher.Sealed sealed = cipher.encrypt(randomBytes(32), nonce, "secret".getBytes(StandardCharsets.UTF_8));

        assertThrows(GeneralSecurityException.class,
                () -> cipher.decrypt(randomBytes(32), nonce, sealed.ciphertext(), sealed.tag()),
                "A wrong key must fail tag verification");
    }

    @Test
    void decryptionFailsWhenTagIsFlipped() throws Exception {
        byte[] key = randomBytes(32);
        byte[] nonce = randomBytes(AeadCipher.NONCE_LENGTH);
        AeadCipher.Sealed sealed = cipher.encrypt(key, nonce, "secret".getBytes(StandardCharsets.UTF_8));
        byte[] tag = sealed.tag().clone();
        tag[0] ^= 0x01;

        assertThrows(GeneralSecurityException.class,
                () -> cipher.decrypt(key, nonce, sealed.ciphertext(), tag));
    }

    @Test
    void decryptionFailsWithWrongNonce() throws Exception {
        byte[] key = randomBytes(32);
        AeadCipher.Sealed sealed = cipher.encrypt(key, randomBytes(AeadCipher.NONCE_LENGTH),
                "secret".getBytes(StandardCharsets.UTF_8));

        assertThrows(GeneralSecurityException.class,
                () -> cipher.decrypt(key, randomBytes(AeadCipher.NONCE_LENGTH), sealed.ciphertext(), sealed.tag()));
    }
}
