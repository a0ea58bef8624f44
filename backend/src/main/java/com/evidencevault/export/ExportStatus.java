package com.evidencevault.export;

/**
 * Export request lifecycle: {@code PENDING -> APPROVED -> DELIVERED} or
 * {@code PENDING -> REJECTED}. Terminal states have no way out.
 */
public enum ExportStatus {
    PENDING,
    APPROVED,
    REJECTED,
    DELIVERED;

    public boolean canTransitionTo(ExportStatus next) {
        return switch (this) {
            case PENDING -> next == APPROVED || next == REJECTED;
            case APPROVED -> next == DELIVERED;
            case REJECTED, DELIVERED -> false;
        };
    }

    public boolean isTerminal() {
        return switch (this) {
            case PENDING, APPROVED -> false;
            case REJECTED, DELIVERED -> true;
        };
    }
}
