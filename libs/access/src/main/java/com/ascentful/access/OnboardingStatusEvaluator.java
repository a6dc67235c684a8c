package com.ascentful.access;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Decides whether a caller must still go through onboarding.
 * <p>
 * The rule reads the real snapshot only, so impersonation can neither trigger nor suppress
 * onboarding for the administrator's own account. Onboarding is skipped when any holds:
 * <ul>
 *   <li>the real role is administrative</li>
 *   <li>onboarding was explicitly completed</li>
 *   <li>the account has an organization</li>
 *   <li>an administrator provisioned the account</li>
 *   <li>the account is older than the grace window (default five minutes)</li>
 * </ul>
 * The grace window is a best-effort UX heuristic for pre-existing accounts that were never
 * marked complete. It is not an access guarantee: an account crossing the boundary during
 * a slow sign-up skips onboarding.
 */
public class OnboardingStatusEvaluator {

    private static final Logger log = LoggerFactory.getLogger(OnboardingStatusEvaluator.class);

    public static final Duration DEFAULT_GRACE_WINDOW = Duration.ofMinutes(5);

    private final Clock clock;
    private final Duration graceWindow;

    public OnboardingStatusEvaluator() {
        this(Clock.systemUTC(), DEFAULT_GRACE_WINDOW);
    }

    public OnboardingStatusEvaluator(Clock clock, Duration graceWindow) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        if (graceWindow == null || graceWindow.isNegative()) {
            throw new IllegalArgumentException("graceWindow must be zero or positive");
        }
        this.clock = clock;
        this.graceWindow = graceWindow;
    }

    /**
     * @param identity    effective identity; only used for diagnostics
     * @param rawSnapshot real, non-overlaid snapshot the rule is evaluated against
     */
    public boolean requiresOnboarding(EffectiveIdentity identity, IdentitySnapshot rawSnapshot) {
        boolean required = requiresOnboarding(rawSnapshot);
        if (identity != null && identity.impersonating()) {
            log.debug("Onboarding evaluated on real account {} while impersonating {}: {}",
                    rawSnapshot.subjectId(), identity.role().value(), required);
        }
        return required;
    }

    /**
     * Same rule, straight from the real snapshot. A snapshot that is not ready never
     * requires onboarding.
     */
    public boolean requiresOnboarding(IdentitySnapshot rawSnapshot) {
        if (rawSnapshot == null || !rawSnapshot.isReady()) {
            return false;
        }
        if (rawSnapshot.role().isAdministrative()
                || rawSnapshot.onboardingCompleted()
                || rawSnapshot.organizationId() != null
                || rawSnapshot.createdByAdmin()) {
            return false;
        }
        return !olderThanGraceWindow(rawSnapshot.createdAt());
    }

    public Duration graceWindow() {
        return graceWindow;
    }

    private boolean olderThanGraceWindow(Instant createdAt) {
        if (createdAt == null) {
            return false;
        }
        return Duration.between(createdAt, clock.instant()).compareTo(graceWindow) > 0;
    }
}
