package com.evidencevault.crypto;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Instant;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import org.bouncycastle.util.encoders.Hex;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.evidencevault.config.VaultProperties;

/**
 * Chain-of-custody signatures: HMAC-SHA256 over accessor, vault and access time.
 */
@Component
public class AccessSigner {

    private static final String HMAC_ALGO = "HmacSHA256";

    private final byte[] secret;

    @Autowired
    public AccessSigner(VaultProperties properties) {
        this(properties.crypto().accessSigningSecret());
    }

    AccessSigner(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException(
                    "vault.crypto.access-signing-secret is not set; provide it through VAULT_ACCESS_SIGNING_SECRET");
        }
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
    }

    public String sign(String accessorId, String vaultId, Instant timestamp) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGO);
            mac.init(new SecretKeySpec(secret, HMAC_ALGO));
            String payload = accessorId + "|" + vaultId + "|" + timestamp.toEpochMilli();
            return Hex.toHexString(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }

    public boolean verify(String accessorId, String vaultId, Instant timestamp, String signature) {
        if (signature == null) {
            return false;
        }
        byte[] expected = sign(accessorId, vaultId, timestamp).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, signature.getBytes(StandardCharsets.US_ASCII));
    }
}
