package com.ascentful.access;

/**
 * Result of evaluating a {@link RouteGuardSpec}.
 * <p>
 * {@code redirectPath} is set exactly when the outcome is {@link DecisionOutcome#DENY}.
 * Under any outcome other than allow, no protected content may be rendered.
 *
 * @param outcome      allow, pending or deny
 * @param redirectPath navigation target for a deny, otherwise null
 * @param reason       why the evaluation ended here
 */
public record Decision(DecisionOutcome outcome, String redirectPath, DecisionReason reason) {

    private static final Decision ALLOW = new Decision(DecisionOutcome.ALLOW, null, DecisionReason.ALLOWED);

    public Decision {
        if (outcome == null || reason == null) {
            throw new IllegalArgumentException("outcome and reason must not be null");
        }
        if (reason.outcome() != outcome) {
            throw new IllegalArgumentException("reason %s does not belong to outcome %s".formatted(reason, outcome));
        }
        if ((outcome == DecisionOutcome.DENY) != (redirectPath != null)) {
            throw new IllegalArgumentException("redirectPath must be set for, and only for, a deny");
        }
    }

    public static Decision allow() {
        return ALLOW;
    }

    public static Decision pending(DecisionReason reason) {
        return new Decision(DecisionOutcome.PENDING, null, reason);
    }

    public static Decision deny(String redirectPath, DecisionReason reason) {
        return new Decision(DecisionOutcome.DENY, redirectPath, reason);
    }

    public boolean isAllowed() {
        return outcome == DecisionOutcome.ALLOW;
    }

    public boolean isPending() {
        return outcome == DecisionOutcome.PENDING;
    }

    public boolean isDenied() {
        return outcome == DecisionOutcome.DENY;
    }
}
