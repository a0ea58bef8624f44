package com.evidencevault.crypto;

import java.security.GeneralSecurityException;

/**
 * Authenticated encryption primitive consumed by the sealing service.
 * Implementations must not retain keys or nonces between calls.
 */
public interface AeadCipher {

    int NONCE_LENGTH = 12;   // 96-bit IV
    int TAG_LENGTH = 16;     // 128-bit authentication tag

    Sealed encrypt(byte[] key, byte[] nonce, byte[] plaintext) throws GeneralSecurityException;

    /**
     * @throws javax.crypto.AEADBadTagException when ciphertext, tag, nonce or key do not authenticate
     */
    byte[] decrypt(byte[] key, byte[] nonce, byte[] ciphertext, byte[] tag) throws GeneralSecurityException;

    record Sealed(byte[] ciphertext, byte[] tag) {}
}
