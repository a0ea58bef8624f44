package com.evidencevault.retention;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.evidencevault.VaultTestHarness;
import com.evidencevault.event.VaultEvent;
import com.evidencevault.retention.SweepReport.Status;
import com.evidencevault.vault.AccessLogEntry;
import com.evidencevault.vault.InMemoryVaultStore;
import com.evidencevault.vault.VaultRecord;

import reactor.core.publisher.Mono;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.spy;

class RetentionServiceTest {

    private static final Duration PAST_HARD_DELETE = Duration.ofDays(400);

    // ── Expiry ────────────────────────────────────────────────────────────────

    @Test
    void unheldVaultIsDeletedOnceItsHardDeleteDeadlinePasses() {
        VaultTestHarness harness = new VaultTestHarness();
        String vaultId = harness.captureThreat("reporter-1", "subject-1", "msg-1").vaultId();
        harness.clock.advance(PAST_HARD_DELETE);

        SweepReport report = harness.retention.expireVaults().block();

        assertEquals(List.of(vaultId), report.deleted());
        assertNull(harness.vaultStore.findById(vaultId).block());
        assertEquals(0, harness.vaultStore.findEvidence(vaultId).count().block());
        List<AccessLogEntry> log = harness.vaultStore.findAccessLog(vaultId).collectList().block();
        assertFalse(log.isEmpty(), "The custody log outlives the vault");

        assertEquals(vaultId, harness.eventsOf(VaultEvent.VaultExpired.class).get(0).vaultId());
    }

    @Test
    void vaultWithinItsGracePeriodIsNotTouched() {
        VaultTestHarness harness = new VaultTestHarness();
        String vaultId = harness.captureThreat("reporter-1", "subject-1", "msg-1").vaultId();
        harness.clock.advance(Duration.ofDays(380));

        SweepReport report = harness.retention.expireVaults().block();

        assertTrue(report.outcomes().isEmpty());
        assertNotNull(harness.vaultStore.findById(vaultId).block());
    }

    @Test
    void deletedCaseStartsAFreshVault() {
        VaultTestHarness harness = new VaultTestHarness();
        String first = harness.captureThreat("reporter-1", "subject-1", "msg-1").vaultId();
        harness.clock.advance(PAST_HARD_DELETE);
        harness.retention.expireVaults().block();

        String second = harness.captureThreat("reporter-1", "subject-1", "msg-2").vaultId();

        assertEquals(first, second, "Vault ids are derived from the case");
        assertEquals(1, harness.vaultStore.findEvidence(second).count().block());
    }

    // ── Holds ─────────────────────────────────────────────────────────────────

    @Test
    void heldVaultsAreSkippedWhateverTheScope() {
        VaultTestHarness harness = new VaultTestHarness();
        String byCase = harness.captureThreat("reporter-1", "subject-1", "msg-1").vaultId();
        String byUser = harness.captureThreat("reporter-2", "subject-2", "msg-2").vaultId();
        String free = harness.captureThreat("reporter-3", "subject-3", "msg-3").vaultId();
        String caseId = harness.vaultStore.findById(byCase).block().caseId();

        harness.legalHolds.createLegalHoldCase(caseId, HoldReason.FRAUD_INVESTIGATION, HoldScope.user("nobody"),
                Set.of(), "counsel-a", "fraud ring", "admin-1").block();
        harness.legalHolds.createLegalHoldCase("hold-user", HoldReason.COURT_ORDER, HoldScope.user("subject-2"),
                Set.of(), "counsel-a", "order 9", "admin-1").block();
        harness.clock.advance(PAST_HARD_DELETE);

        SweepReport report = harness.retention.expireVaults().block();

        assertEquals(List.of(free), report.deleted());
        assertEquals(Set.of(byCase, byUser), Set.copyOf(report.skipped()));
        assertNotNull(harness.vaultStore.findById(byCase).block());
        assertNotNull(harness.vaultStore.findById(byUser).block());
    }

    @Test
    void globalHoldFreezesEveryDeletion() {
        VaultTestHarness harness = new VaultTestHarness();
        harness.captureThreat("reporter-1", "subject-1", "msg-1");
        harness.captureThreat("reporter-2", "subject-2", "msg-2");
        harness.legalHolds.createLegalHoldCase("regulator-lock", HoldReason.REGULATOR_REQUEST, HoldScope.global(),
                Set.of(), "counsel-a", "regulator inquiry", "admin-1").block();
        harness.clock.advance(PAST_HARD_DELETE);

        SweepReport report = harness.retention.expireVaults().block();

        assertTrue(report.deleted().isEmpty());
        assertEquals(2, report.skipped().size());
    }

    @Test
    void closedHoldNoLongerProtects() {
        VaultTestHarness harness = new VaultTestHarness();
        String vaultId = harness.captureThreat("reporter-1", "subject-1", "msg-1").vaultId();
        harness.legalHolds.createLegalHoldCase("hold-1", HoldReason.COURT_ORDER, HoldScope.user("subject-1"),
                Set.of(), "counsel-a", "order 9", "admin-1").block();
        harness.legalHolds.closeLegalHoldCase("hold-1", "admin-2").block();
        harness.clock.advance(PAST_HARD_DELETE);

        SweepReport report = harness.retention.expireVaults().block();

        assertEquals(List.of(vaultId), report.deleted());
    }

    @Test
    void holdPlacedJustBeforeTheDeleteCommitWins() {
        InMemoryVaultStore store = spy(new InMemoryVaultStore());
        VaultTestHarness harness = new VaultTestHarness(store);
        String vaultId = harness.captureThreat("reporter-1", "subject-1", "msg-1").vaultId();
        harness.clock.advance(PAST_HARD_DELETE);

        // the hold lands after the sweep read the registry but before it commits the delete
        doAnswer(invocation -> {
            harness.legalHolds.createLegalHoldCase("late-hold", HoldReason.COURT_ORDER,
                    HoldScope.user("subject-1"), Set.of(), "counsel-a", "emergency order", "admin-1").block();
            return invocation.callRealMethod();
        }).when(store).markPurgingIfUnheld(vaultId);

        SweepReport report = harness.retention.expireVaults().block();

        assertEquals(Status.SKIPPED_HELD, report.outcomes().get(0).status());
        assertNotNull(store.findById(vaultId).block(), "The vault must survive the race");
        assertEquals(1, store.findEvidence(vaultId).count().block());
    }

    @Test
    void holdRegisteredButNotYetMarkedWithdrawsTheDeleteCommit() {
        InMemoryVaultStore store = spy(new InMemoryVaultStore());
        VaultTestHarness harness = new VaultTestHarness(store);
        String vaultId = harness.captureThreat("reporter-1", "subject-1", "msg-1").vaultId();
        String caseId = store.findById(vaultId).block().caseId();
        harness.clock.advance(PAST_HARD_DELETE);

        // the registry row exists but its creator has not reached the vault markers yet
        doAnswer(invocation -> {
            harness.holdStore.insertIfAbsent(new LegalHoldCase(caseId, HoldReason.COURT_ORDER,
                    HoldScope.user("nobody"), Set.of(), "counsel-a", "emergency order", true, "admin-1",
                    harness.clock.instant(), null, null)).block();
            return invocation.callRealMethod();
        }).when(store).markPurgingIfUnheld(vaultId);

        SweepReport report = harness.retention.expireVaults().block();

        assertEquals(Status.SKIPPED_HELD, report.outcomes().get(0).status());
        VaultRecord survivor = store.findById(vaultId).block();
        assertNotNull(survivor, "The vault must survive the race");
        assertFalse(survivor.purging(), "The deletion commit is withdrawn");
        assertEquals(Set.of(caseId), survivor.heldBy());
        assertEquals(1, store.findEvidence(vaultId).count().block());
        assertTrue(harness.holdStore.findByCaseId(caseId).block().vaultIds().contains(vaultId));
        assertTrue(harness.eventsOf(VaultEvent.VaultExpired.class).isEmpty());

        SweepReport next = harness.retention.expireVaults().block();
        assertEquals(List.of(vaultId), next.skipped());
    }

    // ── Failures ──────────────────────────────────────────────────────────────

    @Test
    void failedPurgeIsIsolatedAndResumedByTheNextSweep() {
        InMemoryVaultStore store = spy(new InMemoryVaultStore());
        VaultTestHarness harness = new VaultTestHarness(store);
        String broken = harness.captureThreat("reporter-1", "subject-1", "msg-1").vaultId();
        String healthy = harness.captureThreat("reporter-2", "subject-2", "msg-2").vaultId();
        harness.clock.advance(PAST_HARD_DELETE);

        doReturn(Mono.error(new IllegalStateException("node unavailable")))
                .doCallRealMethod()
                .when(store).purge(broken);

        SweepReport first = harness.retention.expireVaults().block();

        assertEquals(List.of(broken), first.failed());
        assertEquals(List.of(healthy), first.deleted());
        assertTrue(store.findById(broken).block().purging(), "Deletion stays committed after a failed purge");

        SweepReport second = harness.retention.expireVaults().block();

        assertEquals(List.of(broken), second.deleted());
        assertNull(store.findById(broken).block());
    }
}
