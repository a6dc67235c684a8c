package com.ascentful.access;

/**
 * Why a guard evaluation ended the way it did. Recorded on every {@link Decision}.
 */
public enum DecisionReason {

    ALLOWED(DecisionOutcome.ALLOW),

    IDENTITY_LOADING(DecisionOutcome.PENDING),
    FLAG_UNKNOWN(DecisionOutcome.PENDING),
    /** A collaborator failed; retryable. */
    SOURCE_UNAVAILABLE(DecisionOutcome.PENDING),
    /** The session ended while the decision was computed; the result was discarded. */
    SESSION_ENDED(DecisionOutcome.PENDING),

    UNAUTHENTICATED(DecisionOutcome.DENY),
    ROLE_NOT_ALLOWED(DecisionOutcome.DENY),
    FLAG_DISABLED(DecisionOutcome.DENY),
    ONBOARDING_REQUIRED(DecisionOutcome.DENY);

    private final DecisionOutcome outcome;

    DecisionReason(DecisionOutcome outcome) {
        this.outcome = outcome;
    }

    /** The only outcome this reason can accompany. */
    public DecisionOutcome outcome() {
        return outcome;
    }
}
