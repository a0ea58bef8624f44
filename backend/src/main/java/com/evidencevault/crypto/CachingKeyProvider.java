package com.evidencevault.crypto;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.evidencevault.config.VaultProperties;
import com.evidencevault.error.NotFoundException;

import reactor.core.publisher.Mono;

/**
 * {@link KeyProvider} over a {@link KeyRecordStore} with a read-mostly key cache.
 *
 * <p>Keys are immutable, so cache entries are only ever added. The current-key
 * pointer is not cached: every seal reads it, so a rotation made by another
 * node is picked up on the next seal.
 */
@Component
public class CachingKeyProvider implements KeyProvider {

    private static final Logger logger = LoggerFactory.getLogger(CachingKeyProvider.class);

    private final KeyRecordStore store;
    private final SecureRandom random;
    private final Clock clock;
    private final int keyLength;

    private final Map<String, VaultKey> cache = new ConcurrentHashMap<>();

    public CachingKeyProvider(KeyRecordStore store, SecureRandom random, Clock clock, VaultProperties properties) {
        this.store = store;
        this.random = random;
        this.clock = clock;
        this.keyLength = properties.crypto().keyLengthBytes();
    }

    @Override
    public Mono<VaultKey> currentKey() {
        return store.currentKeyId()
                .flatMap(this::keyById)
                .switchIfEmpty(Mono.defer(this::issueFirstKey));
    }

    @Override
    public Mono<VaultKey> keyById(String keyId) {
        if (keyId == null) {
            return Mono.error(new NotFoundException("Sealing key", "<none>"));
        }
        VaultKey cached = cache.get(keyId);
        if (cached != null) {
            return Mono.just(cached);
        }
        return store.findById(keyId)
                .map(key -> cache.computeIfAbsent(key.keyId(), id -> key))
                .switchIfEmpty(Mono.error(new NotFoundException("Sealing key", keyId)));
    }

    @Override
    public Mono<VaultKey> rotate() {
        return store.currentKeyId()
                .map(Optional::of)
                .defaultIfEmpty(Optional.<String>empty())
                .flatMap(previous -> {
                    VaultKey next = generate();
                    return store.insertIfAbsent(next)
                            .then(store.compareAndSetCurrent(previous.orElse(null), next.keyId()))
                            .flatMap(applied -> {
                                if (applied) {
                                    cache.putIfAbsent(next.keyId(), next);
                                    logger.info("Sealing key rotated: {} -> {}", previous.orElse("<none>"), next.keyId());
                                    return Mono.just(next);
                                }
                                logger.warn("Concurrent key rotation detected; using the winning key");
                                return currentKey();
                            });
                });
    }

    private Mono<VaultKey> issueFirstKey() {
        VaultKey first = generate();
        return store.insertIfAbsent(first)
                .then(store.compareAndSetCurrent(null, first.keyId()))
                .flatMap(applied -> {
                    if (applied) {
                        cache.putIfAbsent(first.keyId(), first);
                        logger.info("Issued initial sealing key {}", first.keyId());
                        return Mono.just(first);
                    }
                    // lost the race to another node; its key is the current one
                    return store.currentKeyId().flatMap(this::keyById);
                });
    }

    private VaultKey generate() {
        byte[] material = new byte[keyLength];
        random.nextBytes(material);
        return new VaultKey("key-" + UUID.randomUUID(), material, clock.instant());
    }
}
