package com.evidencevault.vault.cassandra;

import java.io.Serializable;
import java.util.UUID;

import org.springframework.data.cassandra.core.cql.Ordering;
import org.springframework.data.cassandra.core.cql.PrimaryKeyType;
import org.springframework.data.cassandra.core.mapping.PrimaryKeyClass;
import org.springframework.data.cassandra.core.mapping.PrimaryKeyColumn;

/**
 * Key of the append-only collections owned by a vault: one partition per vault,
 * clustered by a time-based UUID so rows read back in append order.
 */
@PrimaryKeyClass
public record VaultChildKey(
    @PrimaryKeyColumn(name = "vault_id", ordinal = 0, type = PrimaryKeyType.PARTITIONED)
    String vaultId,

    @PrimaryKeyColumn(name = "id", ordinal = 1, type = PrimaryKeyType.CLUSTERED, ordering = Ordering.ASCENDING)
    UUID id
) implements Serializable {}
