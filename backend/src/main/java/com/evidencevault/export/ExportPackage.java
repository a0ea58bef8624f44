package com.evidencevault.export;

import java.time.Instant;
import java.util.List;

import com.evidencevault.classification.Severity;
import com.evidencevault.classification.ViolationCategory;
import com.evidencevault.vault.EvidenceKind;

/**
 * What a delivery hands over: vault metadata, every item that passed
 * verification, and the ids of the items withheld for failing it.
 *
 * @param itemCount total items in the vault, delivered plus withheld
 * @param complete  false when any item was withheld; a partial production
 * @param signature access signature of the delivery, as written to both access logs
 */
public record ExportPackage(
        String requestId,
        String vaultId,
        String caseId,
        ViolationCategory category,
        Severity severity,
        int itemCount,
        List<DeliveredItem> items,
        List<WithheldItem> withheld,
        boolean complete,
        String accessorId,
        String legalBasis,
        String signature,
        DeliveryMethod deliveryMethod,
        String recipient,
        Instant deliveredAt
) {

    public ExportPackage {
        items = List.copyOf(items);
        withheld = List.copyOf(withheld);
    }

    public record DeliveredItem(
            String evidenceId,
            EvidenceKind kind,
            String conversationId,
            String messageId,
            String checksum,
            Instant capturedAt,
            byte[] content
    ) {

        @Override
        public String toString() {
            return "DeliveredItem[evidenceId=" + evidenceId + ", kind=" + kind + ", messageId=" + messageId + "]";
        }
    }

    public record WithheldItem(String evidenceId, String reason) {}
}
