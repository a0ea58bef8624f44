package com.evidencevault.retention.cassandra;

import java.time.Instant;
import java.util.Set;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.cassandra.core.ReactiveCassandraOperations;
import org.springframework.data.cassandra.core.cql.ReactiveCqlOperations;
import org.springframework.stereotype.Component;

import com.evidencevault.retention.HoldReason;
import com.evidencevault.retention.HoldScope;
import com.evidencevault.retention.LegalHoldCase;
import com.evidencevault.retention.LegalHoldStore;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Component
@ConditionalOnProperty(prefix = "vault.store", name = "type", havingValue = "cassandra", matchIfMissing = true)
public class CassandraLegalHoldStore implements LegalHoldStore {

    private static final String INSERT_HOLD =
            "INSERT INTO legal_holds (case_id, reason, scope_type, scope_user_id, vault_ids, counsel, justification, "
                    + "active, created_by, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, true, ?, ?) IF NOT EXISTS";
    private static final String REOPEN_HOLD =
            "UPDATE legal_holds SET reason = ?, scope_type = ?, scope_user_id = ?, vault_ids = ?, counsel = ?, "
                    + "justification = ?, active = true, created_by = ?, created_at = ?, closed_by = null, "
                    + "closed_at = null WHERE case_id = ? IF active = false";
    private static final String CLOSE_HOLD =
            "UPDATE legal_holds SET active = false, closed_by = ?, closed_at = ? WHERE case_id = ? IF active = true";
    private static final String ADD_VAULT =
            "UPDATE legal_holds SET vault_ids = vault_ids + ? WHERE case_id = ? IF EXISTS";

    private final LegalHoldRepository holds;
    private final ReactiveCqlOperations cql;

    public CassandraLegalHoldStore(LegalHoldRepository holds, ReactiveCassandraOperations operations) {
        this.holds = holds;
        this.cql = operations.getReactiveCqlOperations();
    }

    @Override
    public Mono<Boolean> insertIfAbsent(LegalHoldCase h) {
        return cql.execute(INSERT_HOLD, h.caseId(), h.reason().name(), h.scope().type().name(), h.scope().userId(),
                h.vaultIds(), h.counsel(), h.justification(), h.createdBy(), h.createdAt());
    }

    @Override
    public Mono<Boolean> reopen(LegalHoldCase h) {
        return cql.execute(REOPEN_HOLD, h.reason().name(), h.scope().type().name(), h.scope().userId(),
                h.vaultIds(), h.counsel(), h.justification(), h.createdBy(), h.createdAt(), h.caseId());
    }

    @Override
    public Mono<Boolean> close(String caseId, String closedBy, Instant closedAt) {
        return cql.execute(CLOSE_HOLD, closedBy, closedAt, caseId);
    }

    @Override
    public Mono<LegalHoldCase> findByCaseId(String caseId) {
        return holds.findById(caseId).map(CassandraLegalHoldStore::toHold);
    }

    @Override
    public Flux<LegalHoldCase> findActive() {
        return holds.findAllByActive(true).map(CassandraLegalHoldStore::toHold);
    }

    @Override
    public Mono<Void> addProtectedVault(String caseId, String vaultId) {
        return cql.execute(ADD_VAULT, Set.of(vaultId), caseId).then();
    }

    private static LegalHoldCase toHold(LegalHoldEntity e) {
        return new LegalHoldCase(
                e.getCaseId(),
                HoldReason.valueOf(e.getReason()),
                new HoldScope(HoldScope.Type.valueOf(e.getScopeType()), e.getScopeUserId()),
                e.getVaultIds(),
                e.getCounsel(),
                e.getJustification(),
                e.isActive(),
                e.getCreatedBy(),
                e.getCreatedAt(),
                e.getClosedBy(),
                e.getClosedAt());
    }
}
