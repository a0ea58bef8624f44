package com.evidencevault.crypto;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import reactor.core.publisher.Mono;

@Component
@ConditionalOnProperty(prefix = "vault.store", name = "type", havingValue = "in-memory")
public class InMemoryKeyRecordStore implements KeyRecordStore {

    private final Map<String, VaultKey> keys = new ConcurrentHashMap<>();
    private final AtomicReference<String> current = new AtomicReference<>();

    @Override
    public Mono<VaultKey> findById(String keyId) {
        return Mono.fromSupplier(() -> keys.get(keyId));
    }

    @Override
    public Mono<Boolean> insertIfAbsent(VaultKey key) {
        return Mono.fromSupplier(() -> keys.putIfAbsent(key.keyId(), key) == null);
    }

    @Override
    public Mono<String> currentKeyId() {
        return Mono.fromSupplier(current::get);
    }

    @Override
    public Mono<Boolean> compareAndSetCurrent(String expected, String next) {
        return Mono.fromSupplier(() -> {
            String witness = current.get();
            return Objects.equals(witness, expected) && current.compareAndSet(witness, next);
        });
    }
}
