package com.ascentful.access;

import com.ascentful.access.flags.FlagState;

/**
 * The guard state machine. Pure: all inputs are resolved by the caller beforehand.
 * <p>
 * Check order, first match wins:
 * <ol>
 *   <li>identity loading: pending</li>
 *   <li>identity absent: deny to sign-in</li>
 *   <li>required flag unknown: pending</li>
 *   <li>effective role not allowed: deny to the guard's mismatch redirect, else the role's home</li>
 *   <li>required flag disabled: deny to dashboard</li>
 *   <li>onboarding check requested and required: deny to onboarding</li>
 *   <li>allow</li>
 * </ol>
 * Sign-in beats role mismatch, which beats flag gating, which beats onboarding.
 */
public final class AccessPolicyEvaluator {

    private AccessPolicyEvaluator() {
        // utility class
    }

    /**
     * @param spec               guard being evaluated
     * @param status             load state of the real identity
     * @param identity           effective identity; null unless {@code status} is READY
     * @param onboardingRequired result of the onboarding evaluator
     * @param flag               state of {@code spec.requiredFlag()}; ignored when no flag is required
     */
    public static Decision decide(
            RouteGuardSpec spec,
            IdentityStatus status,
            EffectiveIdentity identity,
            boolean onboardingRequired,
            FlagState flag) {

        if (status == IdentityStatus.LOADING) {
            return Decision.pending(DecisionReason.IDENTITY_LOADING);
        }
        if (status == IdentityStatus.ABSENT || identity == null) {
            return Decision.deny(RedirectTargetResolver.SIGN_IN, DecisionReason.UNAUTHENTICATED);
        }

        FlagState effectiveFlag = spec.hasRequiredFlag() ? flag : FlagState.ENABLED;
        if (effectiveFlag == null || effectiveFlag == FlagState.UNKNOWN) {
            return Decision.pending(DecisionReason.FLAG_UNKNOWN);
        }

        if (!spec.allows(identity.role())) {
            String target = spec.roleMismatchRedirect() != null
                    ? spec.roleMismatchRedirect()
                    : RedirectTargetResolver.redirectFor(identity);
            return Decision.deny(target, DecisionReason.ROLE_NOT_ALLOWED);
        }
        if (effectiveFlag == FlagState.DISABLED) {
            return Decision.deny(RedirectTargetResolver.DASHBOARD, DecisionReason.FLAG_DISABLED);
        }
        if (spec.requiresOnboardingCheck() && onboardingRequired) {
            return Decision.deny(RedirectTargetResolver.ONBOARDING, DecisionReason.ONBOARDING_REQUIRED);
        }
        return Decision.allow();
    }
}
