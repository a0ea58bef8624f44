package com.evidencevault;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import com.evidencevault.classification.ClassificationContext;
import com.evidencevault.classification.ClassificationEngine;
import com.evidencevault.config.VaultProperties;
import com.evidencevault.crypto.AccessSigner;
import com.evidencevault.crypto.AesGcmCipher;
import com.evidencevault.crypto.CachingKeyProvider;
import com.evidencevault.crypto.InMemoryKeyRecordStore;
import com.evidencevault.crypto.SealingService;
import com.evidencevault.event.VaultEvent;
import com.evidencevault.event.VaultEventPublisher;
import com.evidencevault.export.ExportService;
import com.evidencevault.export.InMemoryExportRequestStore;
import com.evidencevault.retention.InMemoryLegalHoldStore;
import com.evidencevault.retention.LegalHoldService;
import com.evidencevault.retention.RetentionService;
import com.evidencevault.vault.CaptureReceipt;
import com.evidencevault.vault.CaptureRequest;
import com.evidencevault.vault.CustodyLog;
import com.evidencevault.vault.EvidenceKind;
import com.evidencevault.vault.InMemoryVaultStore;
import com.evidencevault.vault.VaultService;
import com.evidencevault.vault.VaultStore;

/**
 * Wires the whole vault over the in-memory stores, a fixed-start clock and a
 * recording event publisher. No Spring context involved.
 */
public class VaultTestHarness {

    public static final Instant START = Instant.parse("2025-01-01T00:00:00Z");

    public final MutableClock clock = new MutableClock(START);
    public final List<VaultEvent> events = new CopyOnWriteArrayList<>();
    public final VaultProperties properties = properties(0.7);

    public final VaultStore vaultStore;
    public final InMemoryKeyRecordStore keyStore = new InMemoryKeyRecordStore();
    public final InMemoryExportRequestStore exportStore;
    public final InMemoryLegalHoldStore holdStore = new InMemoryLegalHoldStore();

    public final VaultEventPublisher publisher = new VaultEventPublisher(event -> {
        if (event instanceof VaultEvent vaultEvent) {
            events.add(vaultEvent);
        }
    });

    public final CachingKeyProvider keyProvider;
    public final SealingService sealingService;
    public final CustodyLog custodyLog;
    public final ClassificationEngine classifier = new ClassificationEngine(0.7);
    public final LegalHoldService legalHolds;
    public final VaultService vaults;
    public final ExportService exports;
    public final RetentionService retention;

    public VaultTestHarness() {
        this(new InMemoryVaultStore());
    }

    public VaultTestHarness(VaultStore vaultStore) {
        this(vaultStore, new InMemoryExportRequestStore());
    }

    public VaultTestHarness(VaultStore vaultStore, InMemoryExportRequestStore exportStore) {
        this.vaultStore = vaultStore;
        this.exportStore = exportStore;
        SecureRandom random = new SecureRandom();
        this.keyProvider = new CachingKeyProvider(keyStore, random, clock, properties);
        this.sealingService = new SealingService(keyProvider, new AesGcmCipher(), random, clock);
        this.custodyLog = new CustodyLog(vaultStore, new AccessSigner(properties), clock);
        this.legalHolds = new LegalHoldService(holdStore, vaultStore, publisher, clock);
        this.vaults = new VaultService(classifier, sealingService, vaultStore, custodyLog, legalHolds,
                publisher, properties, clock);
        this.exports = new ExportService(exportStore, vaultStore, sealingService, custodyLog, publisher, clock);
        this.retention = new RetentionService(vaultStore, holdStore, publisher, clock);
    }

    public static VaultProperties properties(double reviewThreshold) {
        return new VaultProperties(
                new VaultProperties.Store(VaultProperties.StoreType.IN_MEMORY),
                new VaultProperties.Classification(reviewThreshold),
                new VaultProperties.Retention(Duration.ofDays(365), Duration.ofDays(30), false, "0 0 3 * * *"),
                new VaultProperties.Crypto(32, "test-access-signing-secret"));
    }

    /** Captures a death threat from {@code subjectId} reported by {@code reporterId}. */
    public CaptureReceipt captureThreat(String reporterId, String subjectId, String messageId) {
        return vaults.captureQualifyingContent(new CaptureRequest(
                        "I will kill you if you don't send money",
                        EvidenceKind.MESSAGE,
                        null,
                        reporterId,
                        reporterId,
                        ClassificationContext.directMessage(subjectId, reporterId, "conv-1", messageId)))
                .block();
    }

    public <T extends VaultEvent> List<T> eventsOf(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).toList();
    }
}
