package com.ascentful.access;

import java.time.Instant;

/**
 * The authenticated caller exactly as supplied by the identity provider adapter.
 * <p>
 * The engine only reads snapshots. A new snapshot is produced per authentication session;
 * it becomes {@link IdentityStatus#ABSENT} on sign-out. Only a {@link IdentityStatus#READY}
 * snapshot carries subject fields; the others carry nulls.
 *
 * @param status              load state
 * @param subjectId           identity provider subject (READY only)
 * @param sessionId           authentication session the snapshot belongs to (nullable)
 * @param role                real role of the caller (READY only)
 * @param organizationId      university affiliation (nullable)
 * @param onboardingCompleted whether onboarding was explicitly completed
 * @param createdAt           account creation time (nullable)
 * @param createdByAdmin      whether an administrator provisioned the account
 */
public record IdentitySnapshot(
        IdentityStatus status,
        String subjectId,
        String sessionId,
        Role role,
        String organizationId,
        boolean onboardingCompleted,
        Instant createdAt,
        boolean createdByAdmin
) {

    private static final IdentitySnapshot LOADING =
            new IdentitySnapshot(IdentityStatus.LOADING, null, null, null, null, false, null, false);

    private static final IdentitySnapshot ABSENT =
            new IdentitySnapshot(IdentityStatus.ABSENT, null, null, null, null, false, null, false);

    public IdentitySnapshot {
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        if (status == IdentityStatus.READY) {
            if (subjectId == null || subjectId.isBlank()) {
                throw new IllegalArgumentException("subjectId must not be null or blank for a ready identity");
            }
            if (role == null) {
                throw new IllegalArgumentException("role must not be null for a ready identity");
            }
        }
    }

    /** Snapshot returned while the identity provider handshake is in progress. */
    public static IdentitySnapshot loading() {
        return LOADING;
    }

    /** Snapshot for a signed-out caller. */
    public static IdentitySnapshot absent() {
        return ABSENT;
    }

    public boolean isReady() {
        return status == IdentityStatus.READY;
    }

    /**
     * Key of the authentication session this snapshot belongs to. Impersonation overlays are
     * scoped by this key. Falls back to the subject when the adapter supplies no session id.
     *
     * @throws IllegalStateException if the snapshot is not ready
     */
    public String sessionKey() {
        if (!isReady()) {
            throw new IllegalStateException("Only a ready identity has a session key, status=" + status);
        }
        return sessionId == null || sessionId.isBlank() ? subjectId : subjectId + ":" + sessionId;
    }
}
