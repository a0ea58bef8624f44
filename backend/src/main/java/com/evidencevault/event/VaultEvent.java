package com.evidencevault.event;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed domain events emitted by the vault. Subsystems outside the vault
 * (notifications, moderation, audit delivery) subscribe to these instead of
 * being called directly.
 *
 * <p>Events carry identifiers and classifications only, never content.
 */
public sealed interface VaultEvent {

    Instant occurredAt();

    String eventType();

    Map<String, Object> attributes();

    record EvidenceCaptured(Instant occurredAt, String vaultId, String caseId, String evidenceId,
                            String category, String severity) implements VaultEvent {
        public String eventType() { return "EVIDENCE_CAPTURED"; }

        public Map<String, Object> attributes() {
            return attrs("vaultId", vaultId, "caseId", caseId, "evidenceId", evidenceId,
                    "category", category, "severity", severity);
        }
    }

    record ReviewRequired(Instant occurredAt, String conversationId, String messageId,
                          String category, double confidence) implements VaultEvent {
        public String eventType() { return "REVIEW_REQUIRED"; }

        public Map<String, Object> attributes() {
            return attrs("conversationId", conversationId, "messageId", messageId,
                    "category", category, "confidence", confidence);
        }
    }

    record ExportRequested(Instant occurredAt, String requestId, String vaultId, String requestType,
                           String requesterId) implements VaultEvent {
        public String eventType() { return "EXPORT_REQUESTED"; }

        public Map<String, Object> attributes() {
            return attrs("requestId", requestId, "vaultId", vaultId, "requestType", requestType,
                    "requesterId", requesterId);
        }
    }

    record ExportApproved(Instant occurredAt, String requestId, String vaultId, String approverId,
                          String deliveryMethod) implements VaultEvent {
        public String eventType() { return "EXPORT_APPROVED"; }

        public Map<String, Object> attributes() {
            return attrs("requestId", requestId, "vaultId", vaultId, "approverId", approverId,
                    "deliveryMethod", deliveryMethod);
        }
    }

    record ExportRejected(Instant occurredAt, String requestId, String vaultId, String rejecterId,
                          String reason) implements VaultEvent {
        public String eventType() { return "EXPORT_REJECTED"; }

        public Map<String, Object> attributes() {
            return attrs("requestId", requestId, "vaultId", vaultId, "rejecterId", rejecterId, "reason", reason);
        }
    }

    record ExportDelivered(Instant occurredAt, String requestId, String vaultId, String accessorId,
                           int deliveredItems, int withheldItems) implements VaultEvent {
        public String eventType() { return "EXPORT_DELIVERED"; }

        public Map<String, Object> attributes() {
            return attrs("requestId", requestId, "vaultId", vaultId, "accessorId", accessorId,
                    "deliveredItems", deliveredItems, "withheldItems", withheldItems);
        }
    }

    record LegalHoldCreated(Instant occurredAt, String caseId, String reason, String scope,
                            int protectedVaults) implements VaultEvent {
        public String eventType() { return "LEGAL_HOLD_CREATED"; }

        public Map<String, Object> attributes() {
            return attrs("caseId", caseId, "reason", reason, "scope", scope, "protectedVaults", protectedVaults);
        }
    }

    record LegalHoldClosed(Instant occurredAt, String caseId, String closerId) implements VaultEvent {
        public String eventType() { return "LEGAL_HOLD_CLOSED"; }

        public Map<String, Object> attributes() {
            return attrs("caseId", caseId, "closerId", closerId);
        }
    }

    record VaultExpired(Instant occurredAt, String vaultId, String caseId) implements VaultEvent {
        public String eventType() { return "VAULT_EXPIRED"; }

        public Map<String, Object> attributes() {
            return attrs("vaultId", vaultId, "caseId", caseId);
        }
    }

    record IntegrityViolation(Instant occurredAt, String vaultId, String evidenceId,
                              String detail) implements VaultEvent {
        public String eventType() { return "INTEGRITY_VIOLATION"; }

        public Map<String, Object> attributes() {
            return attrs("vaultId", vaultId, "evidenceId", evidenceId, "detail", detail);
        }
    }

    private static Map<String, Object> attrs(Object... pairs) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            if (pairs[i + 1] != null) {
                map.put((String) pairs[i], pairs[i + 1]);
            }
        }
        return map;
    }
}
