package com.evidencevault.crypto;

import reactor.core.publisher.Mono;

public interface KeyProvider {

    /** Key for new seals, created on first use. */
    Mono<VaultKey> currentKey();

    /** Any key ever issued; old key ids stay resolvable after rotation. */
    Mono<VaultKey> keyById(String keyId);

    /** Issues a new key id for future seals and returns it. */
    Mono<VaultKey> rotate();
}
