package com.evidencevault.crypto;

import java.time.Instant;

/**
 * A symmetric sealing key. Immutable once issued; rotation issues a new key id
 * and never overwrites an existing one.
 */
public record VaultKey(String keyId, byte[] material, Instant createdAt) {

    @Override
    public String toString() {
        return "VaultKey[keyId=" + keyId + ", createdAt=" + createdAt + "]";
    }
}
