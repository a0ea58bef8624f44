package com.evidencevault.crypto;

import java.security.GeneralSecurityException;
import java.util.Arrays;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.stereotype.Component;

import com.evidencevault.config.CryptoConfig;

/**
 * AES-256-GCM through the BouncyCastle provider. The JCA output is
 * ciphertext||tag; it is split so the tag can be stored on its own.
 */
@Component
public class AesGcmCipher implements AeadCipher {

    private static final String AES_ALGO = "AES/GCM/NoPadding";
    private static final String PROVIDER = "BC";
    private static final int TAG_BITS = TAG_LENGTH * 8;

    static {
        CryptoConfig.registerBouncyCastle();
    }

    @Override
    public Sealed encrypt(byte[] key, byte[] nonce, byte[] plaintext) throws GeneralSecurityException {
        Cipher cipher = Cipher.getInstance(AES_ALGO, PROVIDER);
        cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_BITS, nonce));
        byte[] output = cipher.doFinal(plaintext);

        int split = output.length - TAG_LENGTH;
        return new Sealed(Arrays.copyOfRange(output, 0, split), Arrays.copyOfRange(output, split, output.length));
    }

    @Override
    public byte[] decrypt(byte[] key, byte[] nonce, byte[] ciphertext, byte[] tag) throws GeneralSecurityException {
        byte[] input = new byte[ciphertext.length + tag.length];
        System.arraycopy(ciphertext, 0, input, 0, ciphertext.length);
        System.arraycopy(tag, 0, input, ciphertext.length, tag.length);

        Cipher cipher = Cipher.getInstance(AES_ALGO, PROVIDER);
        cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_BITS, nonce));
        return cipher.doFinal(input);
    }
}
