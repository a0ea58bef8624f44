package com.evidencevault.vault;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.evidencevault.VaultTestHarness;
import com.evidencevault.classification.ClassificationContext;
import com.evidencevault.classification.Severity;
import com.evidencevault.classification.ViolationCategory;
import com.evidencevault.error.IllegalTransitionException;
import com.evidencevault.error.NotFoundException;
import com.evidencevault.error.ValidationException;
import com.evidencevault.event.VaultEvent;
import com.evidencevault.retention.HoldReason;
import com.evidencevault.retention.HoldScope;
import com.evidencevault.retention.SweepReport;

import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.spy;

/**
 * Capture and vault lifecycle over the in-memory store.
 */
class VaultServiceTest {

    private VaultTestHarness harness;
    private VaultService service;

    @BeforeEach
    void setup() {
        harness = new VaultTestHarness();
        service = harness.vaults;
    }

    private static CaptureRequest request(String content, String messageId) {
        return new CaptureRequest(content, EvidenceKind.MESSAGE, null, "reporter-1", "reporter-1",
                ClassificationContext.directMessage("subject-1", "reporter-1", "conv-1", messageId));
    }

    // ── Capture ───────────────────────────────────────────────────────────────

    @Test
    void threatIsSealedIntoANewVault() {
        CaptureReceipt receipt = harness.captureThreat("reporter-1", "subject-1", "msg-1");

        assertNotNull(receipt);
        VaultRecord vault = harness.vaultStore.findById(receipt.vaultId()).block();
        assertNotNull(vault);
        assertEquals(VaultIds.caseId("reporter-1", "subject-1"), vault.caseId());
        assertEquals("subject-1", vault.subjectId());
        assertEquals(ViolationCategory.VIOLENCE_THREATS, vault.category());
        assertEquals(Severity.CRITICAL, vault.severity());

        List<SealedEvidenceItem> items = harness.vaultStore.findEvidence(receipt.vaultId()).collectList().block();
        assertEquals(1, items.size());
        assertEquals(receipt.evidenceId(), items.get(0).id());
        assertEquals("msg-1", items.get(0).messageId());

        List<AccessLogEntry> log = harness.vaultStore.findAccessLog(receipt.vaultId()).collectList().block();
        assertEquals(AccessAction.EVIDENCE_SEALED, log.get(0).action());
        assertTrue(harness.custodyLog.verify(log.get(0)));

        List<VaultEvent.EvidenceCaptured> captured = harness.eventsOf(VaultEvent.EvidenceCaptured.class);
        assertEquals(1, captured.size());
        assertEquals(receipt.evidenceId(), captured.get(0).evidenceId());
    }

    @Test
    void repeatedCapturesForTheSameCaseShareOneVault() {
        CaptureReceipt first = harness.captureThreat("reporter-1", "subject-1", "msg-1");
        CaptureReceipt second = harness.captureThreat("reporter-1", "subject-1", "msg-2");

        assertEquals(first.vaultId(), second.vaultId());
        List<SealedEvidenceItem> items = harness.vaultStore.findEvidence(first.vaultId()).collectList().block();
        assertEquals(List.of("msg-1", "msg-2"), items.stream().map(SealedEvidenceItem::messageId).toList(),
                "Items are kept in capture order");
    }

    @Test
    void privateContentProducesNothing() {
        StepVerifier.create(service.captureQualifyingContent(request("you're so sexy, I'd love to meet up", "msg-1")))
                .verifyComplete();

        assertEquals(0, harness.vaultStore.findAll().count().block());
        assertTrue(harness.events.isEmpty(), "No event may describe private content");
    }

    @Test
    void ambiguousContentIsQueuedForReviewNotStored() {
        StepVerifier.create(service.captureQualifyingContent(request("you are such an idiot", "msg-9")))
                .verifyComplete();

        assertEquals(0, harness.vaultStore.findAll().count().block());
        List<VaultEvent.ReviewRequired> reviews = harness.eventsOf(VaultEvent.ReviewRequired.class);
        assertEquals(1, reviews.size());
        assertEquals("msg-9", reviews.get(0).messageId());
        assertEquals("HARASSMENT_HATE", reviews.get(0).category());
    }

    @Test
    void explicitCaseIdOverridesTheDerivedOne() {
        CaptureRequest request = new CaptureRequest("I will kill you", EvidenceKind.MESSAGE, "case-court-42",
                "reporter-1", "moderator-3",
                ClassificationContext.directMessage("subject-1", "reporter-1", "conv-1", "msg-1"));

        CaptureReceipt receipt = service.captureQualifyingContent(request).block();

        StepVerifier.create(service.findVaultByCase("case-court-42"))
                .assertNext(vault -> assertEquals(receipt.vaultId(), vault.id()))
                .verifyComplete();
    }

    // ── getOrCreateVault ──────────────────────────────────────────────────────

    @Test
    void getOrCreateVaultIsIdempotentPerCase() {
        String first = service.getOrCreateVault("case-1", "reporter-1", "subject-1",
                ViolationCategory.FRAUD_FINANCIAL_CRIME, Severity.HIGH, Set.of("US")).block();
        String second = service.getOrCreateVault("case-1", "reporter-1", "subject-1",
                ViolationCategory.FRAUD_FINANCIAL_CRIME, Severity.HIGH, Set.of("US")).block();

        assertEquals(first, second);
        assertEquals(VaultIds.vaultId("case-1", "subject-1"), first);
    }

    @Test
    void concurrentCreationConvergesOnOneVault() {
        List<String> ids = Flux.range(0, 32)
                .flatMap(i -> service.getOrCreateVault("case-race", "reporter-" + i, "subject-" + (i % 3),
                                ViolationCategory.VIOLENCE_THREATS, Severity.HIGH, Set.of())
                        .subscribeOn(Schedulers.parallel()))
                .collectList()
                .block();

        assertEquals(1, Set.copyOf(ids).size(), "All callers must receive the same vault id");
        assertEquals(1, harness.vaultStore.findAll().count().block());
    }

    @Test
    void deadlinesFollowRetentionAndGracePeriods() {
        String vaultId = service.getOrCreateVault("case-1", "reporter-1", "subject-1",
                ViolationCategory.IP_THEFT, Severity.MEDIUM, Set.of()).block();

        VaultRecord vault = harness.vaultStore.findById(vaultId).block();
        assertEquals(VaultTestHarness.START, vault.createdAt());
        assertEquals(VaultTestHarness.START.plus(Duration.ofDays(365)), vault.retentionDeadline());
        assertEquals(VaultTestHarness.START.plus(Duration.ofDays(395)), vault.hardDeleteDeadline());
    }

    @Test
    void blankCaseIdIsRejected() {
        StepVerifier.create(service.getOrCreateVault(" ", "reporter-1", "subject-1",
                        ViolationCategory.IP_THEFT, Severity.MEDIUM, Set.of()))
                .expectError(ValidationException.class)
                .verify();
    }

    @Test
    void newVaultIsMarkedByAnActiveHoldOnItsSubject() {
        harness.legalHolds.createLegalHoldCase("hold-1", HoldReason.COURT_ORDER, HoldScope.user("subject-1"),
                Set.of(), "counsel-a", "preservation order", "admin-1").block();

        String vaultId = service.getOrCreateVault("case-1", "reporter-1", "subject-1",
                ViolationCategory.VIOLENCE_THREATS, Severity.HIGH, Set.of()).block();

        VaultRecord vault = harness.vaultStore.findById(vaultId).block();
        assertEquals(Set.of("hold-1"), vault.heldBy());
        assertTrue(harness.legalHolds.getLegalHold("hold-1").block().vaultIds().contains(vaultId));
    }

    // ── Reads and appends ─────────────────────────────────────────────────────

    @Test
    void viewingAVaultIsItselfLogged() {
        CaptureReceipt receipt = harness.captureThreat("reporter-1", "subject-1", "msg-1");

        StepVerifier.create(service.getVault(receipt.vaultId(), "auditor-1", "internal audit"))
                .assertNext(vault -> {
                    assertEquals(receipt.vaultId(), vault.id());
                    assertEquals(1, vault.items().size());
                    AccessLogEntry view = vault.accessLog().get(vault.accessLog().size() - 1);
                    assertEquals(AccessAction.METADATA_VIEWED, view.action());
                    assertEquals("auditor-1", view.accessorId());
                    assertEquals("internal audit", view.legalBasis());
                })
                .verifyComplete();
    }

    @Test
    void unknownVaultIsNotFound() {
        StepVerifier.create(service.getVault("vault-missing", "auditor-1", "audit"))
                .expectError(NotFoundException.class)
                .verify();
        StepVerifier.create(service.findVaultByCase("case-missing"))
                .expectError(NotFoundException.class)
                .verify();
    }

    @Test
    void purgingVaultRejectsNewEvidence() {
        CaptureReceipt receipt = harness.captureThreat("reporter-1", "subject-1", "msg-1");
        harness.vaultStore.markPurgingIfUnheld(receipt.vaultId()).block();

        StepVerifier.create(service.captureQualifyingContent(request("I will kill you", "msg-2")))
                .expectError(IllegalTransitionException.class)
                .verify();
    }

    @Test
    void evidenceArrivingWhileTheVaultIsPurgedIsRefusedAndLeavesNothingBehind() {
        InMemoryVaultStore store = spy(new InMemoryVaultStore());
        VaultTestHarness racing = new VaultTestHarness(store);
        String vaultId = racing.captureThreat("reporter-1", "subject-1", "msg-1").vaultId();
        racing.clock.advance(Duration.ofDays(400));

        // the sweep deletes the vault after the capture checked it but before the item is written
        SweepReport[] sweep = new SweepReport[1];
        doAnswer(invocation -> {
            sweep[0] = racing.retention.expireVaults().block();
            return invocation.callRealMethod();
        }).when(store).appendEvidence(eq(vaultId), any());

        StepVerifier.create(racing.vaults.captureQualifyingContent(request("I will kill you", "msg-2")))
                .expectError(IllegalTransitionException.class)
                .verify();

        assertEquals(List.of(vaultId), sweep[0].deleted());
        assertNull(store.findById(vaultId).block());
        assertEquals(0, store.findEvidence(vaultId).count().block(), "No orphaned evidence outlives the purge");
        long sealed = store.findAccessLog(vaultId)
                .filter(entry -> entry.action() == AccessAction.EVIDENCE_SEALED)
                .count().block();
        assertEquals(1, sealed, "Only the first capture is in the custody log");
    }
}
