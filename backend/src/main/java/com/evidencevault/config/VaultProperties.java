package com.evidencevault.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Externalised settings for the vault, bound from the {@code vault.*} namespace.
 */
@ConfigurationProperties(prefix = "vault")
public record VaultProperties(
        @DefaultValue Store store,
        @DefaultValue Classification classification,
        @DefaultValue Retention retention,
        @DefaultValue Crypto crypto
) {

    public enum StoreType { CASSANDRA, IN_MEMORY }

    public record Store(
            @DefaultValue("cassandra") StoreType type
    ) {}

    public record Classification(
            @DefaultValue("0.7") double reviewThreshold
    ) {}

    /**
     * @param retentionPeriod creation to retention deadline
     * @param gracePeriod     retention deadline to hard-delete deadline
     * @param sweepCron       schedule of the retention sweep, read by {@code RetentionScheduler}
     */
    public record Retention(
            @DefaultValue("365d") Duration retentionPeriod,
            @DefaultValue("30d") Duration gracePeriod,
            @DefaultValue("true") boolean sweepEnabled,
            @DefaultValue("0 0 3 * * *") String sweepCron
    ) {}

    /**
     * @param accessSigningSecret HMAC key for custody signatures; no default, the
     *                            application refuses to start without one
     */
    public record Crypto(
            @DefaultValue("32") int keyLengthBytes,
            String accessSigningSecret
    ) {}
}
