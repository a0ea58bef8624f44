package com.evidencevault.crypto;

import reactor.core.publisher.Mono;

/**
 * Persistence for sealing keys and the pointer to the key currently used for
 * new seals.
 */
public interface KeyRecordStore {

    Mono<VaultKey> findById(String keyId);

    /** Emits true when the key was written, false when the id already existed. */
    Mono<Boolean> insertIfAbsent(VaultKey key);

    /** Empty until the first key has been issued. */
    Mono<String> currentKeyId();

    /**
     * Atomically moves the current pointer from {@code expected} to {@code next}.
     * A null {@code expected} means "only if no pointer exists yet".
     */
    Mono<Boolean> compareAndSetCurrent(String expected, String next);
}
