package com.ascentful.access;

import com.ascentful.access.flags.FeatureFlagEvaluator;
import com.ascentful.access.flags.FeatureFlagState;
import com.ascentful.access.flags.FlagState;
import com.ascentful.access.impersonation.ImpersonationOverlay;
import com.ascentful.access.impersonation.ImpersonationOverlayStore;
import com.ascentful.access.impersonation.ImpersonationResult;
import com.ascentful.access.impersonation.ImpersonationTarget;
import com.ascentful.observability.CorrelationContextHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Entry point for protected views: resolves the caller's effective identity and evaluates
 * route guards against it.
 * <p>
 * One evaluation reads the identity, the session's overlay and the flag values exactly once
 * and decides on that snapshot. Collaborator failures resolve to
 * {@link DecisionReason#SOURCE_UNAVAILABLE} and never escape {@link #evaluateGuard}. The
 * engine holds no state of its own; the overlay store is the only shared mutable resource.
 */
public class AccessEngine {

    private static final Logger log = LoggerFactory.getLogger(AccessEngine.class);

    private final IdentityProvider identityProvider;
    private final ImpersonationOverlayStore overlayStore;
    private final FeatureFlagEvaluator flagEvaluator;
    private final PlanSource planSource;
    private final OnboardingStatusEvaluator onboardingEvaluator;
    private final AccessMetrics metrics;

    public AccessEngine(
            IdentityProvider identityProvider,
            ImpersonationOverlayStore overlayStore,
            FeatureFlagEvaluator flagEvaluator,
            PlanSource planSource) {
        this(identityProvider, overlayStore, flagEvaluator, planSource,
                new OnboardingStatusEvaluator(), AccessMetrics.standalone());
    }

    public AccessEngine(
            IdentityProvider identityProvider,
            ImpersonationOverlayStore overlayStore,
            FeatureFlagEvaluator flagEvaluator,
            PlanSource planSource,
            OnboardingStatusEvaluator onboardingEvaluator,
            AccessMetrics metrics) {
        this.identityProvider = Objects.requireNonNull(identityProvider, "identityProvider");
        this.overlayStore = Objects.requireNonNull(overlayStore, "overlayStore");
        this.flagEvaluator = Objects.requireNonNull(flagEvaluator, "flagEvaluator");
        this.planSource = Objects.requireNonNull(planSource, "planSource");
        this.onboardingEvaluator = Objects.requireNonNull(onboardingEvaluator, "onboardingEvaluator");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Evaluates a guard for the current caller.
     *
     * @param spec the view's access requirement
     * @return allow, pending or deny with a redirect path; never throws for collaborator failures
     */
    public Decision evaluateGuard(RouteGuardSpec spec) {
        if (spec == null) {
            throw new IllegalArgumentException("spec must not be null");
        }
        Decision decision;
        Optional<IdentitySnapshot> snapshot = readIdentity();
        if (snapshot.isEmpty()) {
            decision = Decision.pending(DecisionReason.SOURCE_UNAVAILABLE);
        } else {
            decision = decide(spec, snapshot.get());
            if (snapshot.get().isReady() && sessionEnded(snapshot.get())) {
                log.info("Session {} ended during evaluation, discarding {} decision",
                        snapshot.get().subjectId(), decision.outcome());
                decision = Decision.pending(DecisionReason.SESSION_ENDED);
            }
        }
        log.debug("Guard {} -> {} ({}) redirect={}",
                spec.allowedRoles(), decision.outcome(), decision.reason(), decision.redirectPath());
        metrics.recordDecision(decision);
        return decision;
    }

    /**
     * Starts impersonating {@code target} for the current caller's session. Authorization is
     * checked against the caller's real identity.
     *
     * @throws SourceUnavailableException if the identity provider failed
     */
    public ImpersonationResult startImpersonation(ImpersonationTarget target) {
        ImpersonationResult result = overlayStore.start(identityProvider.currentIdentity(), target);
        metrics.recordImpersonation(result);
        return result;
    }

    /**
     * Stops the current session's impersonation, if any.
     *
     * @throws SourceUnavailableException if the identity provider failed
     */
    public void stopImpersonation() {
        overlayStore.stop(identityProvider.currentIdentity());
    }

    /**
     * @throws SourceUnavailableException if the identity provider failed
     */
    public Optional<ImpersonationOverlay> currentImpersonation() {
        return overlayStore.current(identityProvider.currentIdentity());
    }

    /**
     * Discards the overlay of a session that ended.
     */
    public boolean endSession(String sessionKey) {
        return overlayStore.endSession(sessionKey);
    }

    /**
     * Ends the caller's own session, discarding any overlay it carried. Called on sign-out while
     * the ending session's identity is still visible.
     *
     * @return true if an overlay was discarded
     * @throws SourceUnavailableException if the identity provider failed
     */
    public boolean endCurrentSession() {
        IdentitySnapshot snapshot = identityProvider.currentIdentity();
        if (snapshot == null || !snapshot.isReady()) {
            return false;
        }
        return overlayStore.endSession(snapshot.sessionKey());
    }

    /**
     * Effective identity of the current caller, including the billing plan. Empty unless the
     * identity is ready.
     *
     * @throws SourceUnavailableException if the identity provider failed
     */
    public Optional<EffectiveIdentity> effectiveIdentity() {
        IdentitySnapshot snapshot = identityProvider.currentIdentity();
        if (!snapshot.isReady()) {
            return Optional.empty();
        }
        ImpersonationOverlay overlay = overlayStore.current(snapshot).orElse(null);
        return Optional.of(resolve(snapshot, overlay));
    }

    public Optional<Role> effectiveRole() {
        return effectiveIdentity().map(EffectiveIdentity::role);
    }

    public Optional<Plan> effectivePlan() {
        return effectiveIdentity().flatMap(EffectiveIdentity::planIfKnown);
    }

    private Decision decide(RouteGuardSpec spec, IdentitySnapshot snapshot) {
        if (!snapshot.isReady()) {
            return AccessPolicyEvaluator.decide(spec, snapshot.status(), null, false, FlagState.UNKNOWN);
        }

        ImpersonationOverlay overlay = overlayStore.current(snapshot).orElse(null);
        EffectiveIdentity identity = resolve(snapshot, overlay);
        bindLoggingContext(identity, overlay);

        FlagState flag = FlagState.ENABLED;
        FeatureFlagState flags = null;
        if (spec.hasRequiredFlag()) {
            flags = flagEvaluator.snapshot(identity.organizationId());
            flag = flags.stateOf(spec.requiredFlag());
        }
        boolean onboardingRequired = spec.requiresOnboardingCheck()
                && onboardingEvaluator.requiresOnboarding(identity, snapshot);

        Decision decision = AccessPolicyEvaluator.decide(
                spec, snapshot.status(), identity, onboardingRequired, flag);
        if (decision.reason() == DecisionReason.FLAG_UNKNOWN && flags != null && flags.isSourceUnavailable()) {
            return Decision.pending(DecisionReason.SOURCE_UNAVAILABLE);
        }
        return decision;
    }

    private EffectiveIdentity resolve(IdentitySnapshot snapshot, ImpersonationOverlay overlay) {
        Plan realPlan = null;
        if (overlay == null || overlay.impersonatedPlan() == null) {
            realPlan = readPlan(snapshot.subjectId());
        }
        return EffectiveIdentityResolver.resolve(snapshot, overlay, realPlan);
    }

    private Optional<IdentitySnapshot> readIdentity() {
        try {
            return Optional.ofNullable(identityProvider.currentIdentity());
        } catch (RuntimeException e) {
            log.warn("Identity provider failed, decision is pending: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private Plan readPlan(String subjectId) {
        try {
            return planSource.planFor(subjectId).orElse(null);
        } catch (RuntimeException e) {
            log.warn("Billing source failed for {}, plan unknown: {}", subjectId, e.getMessage());
            return null;
        }
    }

    /**
     * True when the caller signed out or switched sessions after {@code evaluated} was read.
     */
    private boolean sessionEnded(IdentitySnapshot evaluated) {
        Optional<IdentitySnapshot> now = readIdentity();
        return now.isEmpty()
                || !now.get().isReady()
                || !now.get().sessionKey().equals(evaluated.sessionKey());
    }

    private static void bindLoggingContext(EffectiveIdentity identity, ImpersonationOverlay overlay) {
        CorrelationContextHolder.update(ctx -> ctx
                .withSubject(identity.subjectId(), identity.organizationId())
                .withActingAdmin(overlay == null ? null : overlay.actingAdminId()));
    }
}
