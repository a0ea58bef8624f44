package com.evidencevault.vault;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import org.bouncycastle.util.encoders.Hex;

/**
 * Deterministic identifiers. Repeated captures for the same case and subject
 * converge on the same vault id instead of minting random ones.
 */
public final class VaultIds {

    private VaultIds() {
    }

    public static String vaultId(String caseId, String subjectId) {
        return "vault-" + digest(caseId + "\u0000" + subjectId, 16);
    }

    /** Case id used when a capture arrives without one: one case per reporter and subject. */
    public static String caseId(String reporterId, String subjectId) {
        return "case-" + digest(reporterId + "\u0000" + subjectId, 12);
    }

    private static String digest(String value, int bytes) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
            return Hex.toHexString(hash, 0, bytes);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
