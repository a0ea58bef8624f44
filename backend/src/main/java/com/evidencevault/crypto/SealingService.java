package com.evidencevault.crypto;

import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;

import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.datastax.oss.driver.api.core.uuid.Uuids;
import com.evidencevault.error.IntegrityException;
import com.evidencevault.vault.EvidenceMetadata;
import com.evidencevault.vault.SealedEvidenceItem;

import reactor.core.publisher.Mono;

/**
 * Seals single evidence payloads under the current key and opens them again.
 *
 * <p><strong>Fail-closed contract:</strong> {@link #unseal} either returns the
 * exact plaintext that was sealed or signals {@link IntegrityException}. A tag
 * failure and a checksum mismatch are treated the same way; no partial output is
 * ever emitted.
 */
@Service
public class SealingService {

    private static final Logger logger = LoggerFactory.getLogger(SealingService.class);

    private final KeyProvider keyProvider;
    private final AeadCipher cipher;
    private final SecureRandom random;
    private final Clock clock;

    public SealingService(KeyProvider keyProvider, AeadCipher cipher, SecureRandom random, Clock clock) {
        this.keyProvider = keyProvider;
        this.cipher = cipher;
        this.random = random;
        this.clock = clock;
    }

    public Mono<SealedEvidenceItem> seal(byte[] plaintext, EvidenceMetadata metadata) {
        return keyProvider.currentKey().map(key -> {
            // fresh nonce per call; never reused under the same key
            byte[] nonce = new byte[AeadCipher.NONCE_LENGTH];
            random.nextBytes(nonce);

            AeadCipher.Sealed sealed;
            try {
                sealed = cipher.encrypt(key.material(), nonce, plaintext);
            } catch (GeneralSecurityException e) {
                throw new IllegalStateException("AEAD encryption failed under key " + key.keyId(), e);
            }

            return new SealedEvidenceItem(
                    Uuids.timeBased().toString(),
                    metadata.kind(),
                    sealed.ciphertext(),
                    nonce,
                    sealed.tag(),
                    key.keyId(),
                    checksum(plaintext),
                    metadata.conversationId(),
                    metadata.messageId(),
                    metadata.capturedBy(),
                    metadata.relevanceScore(),
                    metadata.legalReferences(),
                    clock.instant());
        });
    }

    public Mono<byte[]> unseal(SealedEvidenceItem item) {
        return Mono.defer(() -> {
            if (item.keyId() == null || item.keyId().isBlank()) {
                logger.error("SECURITY evidence {} carries no sealing key id", item.id());
                return Mono.error(new IntegrityException(item.id(), "Missing sealing key id"));
            }
            return unsealWithKey(item);
        });
    }

    private Mono<byte[]> unsealWithKey(SealedEvidenceItem item) {
        return keyProvider.keyById(item.keyId())
                .onErrorMap(e -> !(e instanceof IntegrityException),
                        e -> new IntegrityException(item.id(), "Sealing key unavailable: " + item.keyId(), e))
                .map(key -> {
                    byte[] plaintext;
                    try {
                        plaintext = cipher.decrypt(key.material(), item.iv(), item.ciphertext(), item.authTag());
                    } catch (GeneralSecurityException | IllegalArgumentException e) {
                        logger.error("SECURITY authentication failed for evidence {} (key {})", item.id(), item.keyId());
                        throw new IntegrityException(item.id(), "Authentication tag mismatch", e);
                    }
                    verifyChecksum(item, plaintext);
                    return plaintext;
                });
    }

    public static String checksum(byte[] plaintext) {
        try {
            return Hex.toHexString(MessageDigest.getInstance("SHA-256").digest(plaintext));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    private static void verifyChecksum(SealedEvidenceItem item, byte[] plaintext) {
        byte[] stored;
        try {
            stored = Hex.decode(item.checksum() == null ? "" : item.checksum());
        } catch (DecoderException e) {
            stored = new byte[0];
        }
        byte[] recomputed = Hex.decode(checksum(plaintext));
        if (!MessageDigest.isEqual(stored, recomputed)) {
            logger.error("SECURITY checksum mismatch for evidence {}", item.id());
            throw new IntegrityException(item.id(), "Plaintext checksum mismatch");
        }
    }
}
