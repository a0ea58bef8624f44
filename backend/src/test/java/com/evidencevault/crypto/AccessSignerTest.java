package com.evidencevault.crypto;

import java.time.Instant;

import java.time.Duration;

import org.junit.jupiter.api.Test;

import com.evidencevault.config.VaultProperties;

import static org.junit.jupiter.api.Assertions.*;

class AccessSignerTest {

    private static final Instant AT = Instant.parse("2025-03-01T10:15:30Z");

    private final AccessSigner signer = new AccessSigner("unit-test-secret");

    @Test
    void signatureIsDeterministicHexHmac() {
        String first = signer.sign("officer-7", "vault-1", AT);
        String second = signer.sign("officer-7", "vault-1", AT);

        assertEquals(first, second);
        assertEquals(64, first.length(), "HMAC-SHA256 is 32 bytes, 64 hex chars");
        assertTrue(first.matches("[0-9a-f]+"));
    }

    @Test
    void verifyAcceptsOnlyTheExactAccess() {
        String signature = signer.sign("officer-7", "vault-1", AT);

        assertTrue(signer.verify("officer-7", "vault-1", AT, signature));
        assertFalse(signer.verify("officer-8", "vault-1", AT, signature), "other accessor");
        assertFalse(signer.verify("officer-7", "vault-2", AT, signature), "other vault");
        assertFalse(signer.verify("officer-7", "vault-1", AT.plusMillis(1), signature), "other time");
        assertFalse(signer.verify("officer-7", "vault-1", AT, null));
    }

    @Test
    void differentSecretsProduceDifferentSignatures() {
        AccessSigner other = new AccessSigner("another-secret");

        assertNotEquals(signer.sign("a", "v", AT), other.sign("a", "v", AT));
        assertFalse(other.verify("a", "v", AT, signer.sign("a", "v", AT)));
    }

    @Test
    void missingSecretRefusesToStart() {
        VaultProperties unset = new VaultProperties(
                new VaultProperties.Store(VaultProperties.StoreType.IN_MEMORY),
                new VaultProperties.Classification(0.7),
                new VaultProperties.Retention(Duration.ofDays(365), Duration.ofDays(30), false, "0 0 3 * * *"),
                new VaultProperties.Crypto(32, null));

        assertThrows(IllegalStateException.class, () -> new AccessSigner(unset));
        assertThrows(IllegalStateException.class, () -> new AccessSigner(""));
        assertThrows(IllegalStateException.class, () -> new AccessSigner("   "));
    }
}
