package com.evidencevault.vault.cassandra;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledIfEnvironmentVariable;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ContextConfiguration;
import org.testcontainers.junit.jupiter.Testcontainers;

import com.datastax.oss.driver.api.core.uuid.Uuids;
import com.evidencevault.CassandraContainerInitializer;
import com.evidencevault.classification.Severity;
import com.evidencevault.classification.ViolationCategory;
import com.evidencevault.error.IllegalTransitionException;
import com.evidencevault.vault.AccessAction;
import com.evidencevault.vault.AccessLogEntry;
import com.evidencevault.vault.EvidenceKind;
import com.evidencevault.vault.ExportSummary;
import com.evidencevault.vault.SealedEvidenceItem;
import com.evidencevault.vault.VaultRecord;
import com.evidencevault.vault.VaultStore;

import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link CassandraVaultStore} against a real Cassandra node: the lightweight
 * transactions behind vault creation, hold markers and the purge commit.
 *
 * Disabled where Docker is unavailable or {@code SKIP_DB_TESTS=true}.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
@DisabledIfEnvironmentVariable(named = "SKIP_DB_TESTS", matches = "true")
@ContextConfiguration(initializers = CassandraContainerInitializer.class)
class CassandraVaultStoreIntegrationTest {

    @Autowired
    private VaultStore store;

    // ── Helpers ───────────────────────────────────────────────────────────────

    private static VaultRecord candidate(String caseId, String vaultId, Instant hardDelete) {
        Instant created = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        return new VaultRecord(vaultId, caseId, "reporter-1", "subject-" + caseId,
                ViolationCategory.BLACKMAIL_EXTORTION, Severity.HIGH, Set.of("US", "EU"),
                created, created.plus(Duration.ofDays(365)), hardDelete, Set.of(), 0, false);
    }

    private static String unique(String prefix) {
        return prefix + "-" + UUID.randomUUID();
    }

    private VaultRecord created(String caseId) {
        return store.insertIfAbsent(candidate(caseId, unique("vault"), Instant.now().plus(Duration.ofDays(395))))
                .block().vault();
    }

    private static SealedEvidenceItem item(String messageId) {
        return new SealedEvidenceItem(Uuids.timeBased().toString(), EvidenceKind.MESSAGE,
                "ciphertext".getBytes(StandardCharsets.UTF_8), new byte[12], new byte[16], "key-1",
                "ab".repeat(32), "conv-1", messageId, "reporter-1", 0.95, List.of("18 U.S.C. 875"),
                Instant.now().truncatedTo(ChronoUnit.MILLIS));
    }

    // ── Tests ─────────────────────────────────────────────────────────────────

    @Test
    void secondInsertForTheSameCaseReturnsTheExistingVault() {
        String caseId = unique("case");
        VaultRecord first = created(caseId);

        StepVerifier.create(store.insertIfAbsent(candidate(caseId, unique("other"), Instant.now())))
                .assertNext(insertion -> {
                    assertFalse(insertion.created());
                    assertEquals(first.id(), insertion.vault().id());
                    assertEquals(Set.of("US", "EU"), insertion.vault().jurisdictions());
                })
                .verifyComplete();

        StepVerifier.create(store.findByCaseId(caseId))
                .assertNext(vault -> assertEquals(first.id(), vault.id()))
                .verifyComplete();
    }

    @Test
    void evidenceBytesRoundTripInOrder() {
        VaultRecord vault = created(unique("case"));
        SealedEvidenceItem first = item("msg-1");
        SealedEvidenceItem second = item("msg-2");

        store.appendEvidence(vault.id(), first).block();
        store.appendEvidence(vault.id(), second).block();

        List<SealedEvidenceItem> items = store.findEvidence(vault.id()).collectList().block();
        assertEquals(List.of(first.id(), second.id()), items.stream().map(SealedEvidenceItem::id).toList());
        assertArrayEquals(first.ciphertext(), items.get(0).ciphertext());
        assertArrayEquals(first.authTag(), items.get(0).authTag());
        assertEquals(first.legalReferences(), items.get(0).legalReferences());
    }

    @Test
    void heldVaultCannotBeCommittedForDeletion() {
        VaultRecord vault = created(unique("case"));

        assertTrue(store.addHold(vault.id(), "hold-a").block());
        assertTrue(store.addHold(vault.id(), "hold-b").block());
        assertTrue(store.addHold(vault.id(), "hold-a").block(), "Adding the same hold twice is a no-op");
        assertEquals(2, store.findById(vault.id()).block().holdCount());

        assertFalse(store.markPurgingIfUnheld(vault.id()).block());

        store.removeHold(vault.id(), "hold-a").block();
        store.removeHold(vault.id(), "hold-b").block();
        assertTrue(store.markPurgingIfUnheld(vault.id()).block());
        assertFalse(store.addHold(vault.id(), "hold-late").block(), "No hold attaches once deletion is committed");
    }

    @Test
    void purgeRemovesTheVaultButKeepsItsCustodyLog() {
        String caseId = unique("case");
        VaultRecord vault = created(caseId);
        store.appendEvidence(vault.id(), item("msg-1")).block();
        store.appendExportSummary(vault.id(), new ExportSummary("req-1", "COURT_SUBPOENA", "PENDING",
                "clerk-1", Instant.now())).block();
        store.appendAccessLog(vault.id(), new AccessLogEntry(Uuids.timeBased().toString(), vault.id(), "reporter-1",
                AccessAction.EVIDENCE_SEALED, Instant.now(), "sig", "capture", null)).block();

        StepVerifier.create(store.purge(vault.id()))
                .expectError(IllegalTransitionException.class)
                .verify();

        store.markPurgingIfUnheld(vault.id()).block();
        store.purge(vault.id()).block();

        assertNull(store.findById(vault.id()).block());
        assertNull(store.findByCaseId(caseId).block());
        assertEquals(0, store.findEvidence(vault.id()).count().block());
        assertEquals(0, store.findExportSummaries(vault.id()).count().block());
        assertEquals(1, store.findAccessLog(vault.id()).count().block());
    }

    @Test
    void sweepQueryReturnsOnlyOverdueVaults() {
        VaultRecord overdue = store.insertIfAbsent(candidate(unique("case"), unique("vault"),
                Instant.now().minus(Duration.ofDays(1)))).block().vault();
        VaultRecord current = created(unique("case"));

        List<String> due = store.findHardDeleteDue(Instant.now()).map(VaultRecord::id).collectList().block();

        assertTrue(due.contains(overdue.id()));
        assertFalse(due.contains(current.id()));
    }
}
