package com.evidencevault.crypto.cassandra;

import java.nio.ByteBuffer;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.cassandra.core.ReactiveCassandraOperations;
import org.springframework.data.cassandra.core.cql.ReactiveCqlOperations;
import org.springframework.stereotype.Component;

import com.evidencevault.crypto.KeyRecordStore;
import com.evidencevault.crypto.VaultKey;

import reactor.core.publisher.Mono;

@Component
@ConditionalOnProperty(prefix = "vault.store", name = "type", havingValue = "cassandra", matchIfMissing = true)
public class CassandraKeyRecordStore implements KeyRecordStore {

    private static final String CURRENT = "current";

    private static final String INSERT_KEY =
            "INSERT INTO vault_keys (key_id, material, created_at) VALUES (?, ?, ?) IF NOT EXISTS";
    private static final String SELECT_CURRENT =
            "SELECT current_key_id FROM vault_key_state WHERE name = ?";
    private static final String INIT_CURRENT =
            "INSERT INTO vault_key_state (name, current_key_id) VALUES (?, ?) IF NOT EXISTS";
    private static final String SWAP_CURRENT =
            "UPDATE vault_key_state SET current_key_id = ? WHERE name = ? IF current_key_id = ?";

    private final VaultKeyRepository keys;
    private final ReactiveCqlOperations cql;

    public CassandraKeyRecordStore(VaultKeyRepository keys, ReactiveCassandraOperations operations) {
        this.keys = keys;
        this.cql = operations.getReactiveCqlOperations();
    }

    @Override
    public Mono<VaultKey> findById(String keyId) {
        return keys.findById(keyId)
                .map(e -> {
                    ByteBuffer buffer = e.getMaterial().duplicate();
                    byte[] material = new byte[buffer.remaining()];
                    buffer.get(material);
                    return new VaultKey(e.getKeyId(), material, e.getCreatedAt());
                });
    }

    @Override
    public Mono<Boolean> insertIfAbsent(VaultKey key) {
        return cql.execute(INSERT_KEY, key.keyId(), ByteBuffer.wrap(key.material()), key.createdAt());
    }

    @Override
    public Mono<String> currentKeyId() {
        return cql.queryForFlux(SELECT_CURRENT, String.class, CURRENT).next();
    }

    @Override
    public Mono<Boolean> compareAndSetCurrent(String expected, String next) {
        return expected == null
                ? cql.execute(INIT_CURRENT, CURRENT, next)
                : cql.execute(SWAP_CURRENT, next, CURRENT, expected);
    }
}
