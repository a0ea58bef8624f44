package com.evidencevault.retention;

import com.evidencevault.error.ValidationException;
import com.evidencevault.vault.VaultRecord;

/**
 * What a hold protects beyond its own case and listed vaults: every vault
 * ({@code GLOBAL}, a regulator lock) or every vault reported against one user.
 */
public record HoldScope(Type type, String userId) {

    public enum Type {
        GLOBAL,
        USER
    }

    public HoldScope {
        if (type == null) {
            throw new ValidationException("Hold scope type is required");
        }
        if (type == Type.USER && (userId == null || userId.isBlank())) {
            throw new ValidationException("A user-scoped hold requires a user id");
        }
        if (type == Type.GLOBAL) {
            userId = null;
        }
    }

    public static HoldScope global() {
        return new HoldScope(Type.GLOBAL, null);
    }

    public static HoldScope user(String userId) {
        return new HoldScope(Type.USER, userId);
    }

    boolean covers(VaultRecord vault) {
        return switch (type) {
            case GLOBAL -> true;
            case USER -> userId.equals(vault.subjectId());
        };
    }

    @Override
    public String toString() {
        return type == Type.GLOBAL ? "GLOBAL" : "USER(" + userId + ")";
    }
}
