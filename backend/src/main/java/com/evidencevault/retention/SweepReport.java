package com.evidencevault.retention;

import java.util.List;

/**
 * Outcome of one retention sweep, one entry per vault that was past its
 * hard-delete deadline.
 */
public record SweepReport(List<Outcome> outcomes) {

    public enum Status {
        DELETED,
        SKIPPED_HELD,
        FAILED
    }

    public record Outcome(String vaultId, String caseId, Status status, String detail) {}

    public SweepReport {
        outcomes = List.copyOf(outcomes);
    }

    public List<String> deleted() {
        return idsWith(Status.DELETED);
    }

    public List<String> skipped() {
        return idsWith(Status.SKIPPED_HELD);
    }

    public List<String> failed() {
        return idsWith(Status.FAILED);
    }

    private List<String> idsWith(Status status) {
        return outcomes.stream()
                .filter(outcome -> outcome.status() == status)
                .map(Outcome::vaultId)
                .toList();
    }
}
