package com.ascentful.access;

import com.ascentful.access.flags.FeatureFlagEvaluator;
import com.ascentful.access.flags.FeatureFlagSource;
import com.ascentful.access.flags.InMemoryFeatureFlagSource;
import com.ascentful.access.impersonation.ImpersonationError;
import com.ascentful.access.impersonation.ImpersonationOverlayStore;
import com.ascentful.access.impersonation.ImpersonationResult;
import com.ascentful.access.impersonation.ImpersonationTarget;
import com.ascentful.access.testing.StubIdentityProvider;
import com.ascentful.access.testing.TestIdentityFactory;
import com.ascentful.observability.CorrelationContext;
import com.ascentful.observability.CorrelationContextHolder;
import com.ascentful.observability.MetricFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("AccessEngine")
class AccessEngineTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");
    private static final String UNI = "uni-1";

    private StubIdentityProvider identity;
    private ImpersonationOverlayStore store;
    private InMemoryFeatureFlagSource flags;
    private PlanSource plans;
    private SimpleMeterRegistry registry;
    private AccessEngine engine;

    @BeforeEach
    void setUp() {
        identity = new StubIdentityProvider();
        store = new ImpersonationOverlayStore();
        flags = new InMemoryFeatureFlagSource();
        plans = mock(PlanSource.class);
        when(plans.planFor(anyString())).thenReturn(Optional.of(Plan.FREE));
        registry = new SimpleMeterRegistry();
        engine = engineWith(identity, new FeatureFlagEvaluator(flags));
    }

    @AfterEach
    void tearDown() {
        CorrelationContextHolder.clear();
    }

    private AccessEngine engineWith(IdentityProvider provider, FeatureFlagEvaluator evaluator) {
        return new AccessEngine(provider, store, evaluator, plans,
                new OnboardingStatusEvaluator(Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofMinutes(5)),
                new AccessMetrics(new MetricFactory(registry, "access-test")));
    }

    @Nested
    @DisplayName("identity state")
    class IdentityState {

        @Test
        @DisplayName("is pending while the identity loads")
        void loading() {
            Decision decision = engine.evaluateGuard(StandardGuards.ADMIN);

            assertThat(decision.isPending()).isTrue();
            assertThat(decision.reason()).isEqualTo(DecisionReason.IDENTITY_LOADING);
        }

        @Test
        @DisplayName("sends a signed-out caller to sign-in")
        void absent() {
            identity.signOut();

            assertThat(engine.evaluateGuard(StandardGuards.ADVISOR))
                    .isEqualTo(Decision.deny("/sign-in", DecisionReason.UNAUTHENTICATED));
        }

        @Test
        @DisplayName("an identity provider outage is pending, not a deny")
        void providerOutage() {
            identity.failing(true);

            Decision decision = engine.evaluateGuard(StandardGuards.ADMIN);

            assertThat(decision.reason()).isEqualTo(DecisionReason.SOURCE_UNAVAILABLE);
            assertThatThrownBy(engine::effectiveIdentity).isInstanceOf(SourceUnavailableException.class);
        }
    }

    @Nested
    @DisplayName("impersonation")
    class Impersonation {

        @BeforeEach
        void signInAdmin() {
            identity.signIn(TestIdentityFactory.admin("admin-1"));
        }

        @Test
        @DisplayName("an admin impersonating a student is treated as that student")
        void adminAsStudent() {
            engine.startImpersonation(ImpersonationTarget.of(Role.STUDENT, UNI, Plan.UNIVERSITY)).orElseThrow();

            assertThat(engine.evaluateGuard(StandardGuards.STUDENT).isAllowed()).isTrue();
            assertThat(engine.evaluateGuard(StandardGuards.ADMIN))
                    .isEqualTo(Decision.deny("/university/student", DecisionReason.ROLE_NOT_ALLOWED));
            assertThat(engine.effectiveRole()).contains(Role.STUDENT);
            assertThat(engine.effectivePlan()).contains(Plan.UNIVERSITY);
            verify(plans, never()).planFor(anyString());
        }

        @Test
        @DisplayName("stopping restores the real identity")
        void stop() {
            engine.startImpersonation(ImpersonationTarget.of(Role.STAFF));
            engine.stopImpersonation();

            assertThat(engine.currentImpersonation()).isEmpty();
            assertThat(engine.evaluateGuard(StandardGuards.ADMIN).isAllowed()).isTrue();
            assertThat(engine.effectivePlan()).contains(Plan.FREE);
        }

        @Test
        @DisplayName("the overlay's real onboarding state is the admin's")
        void onboardingUsesRealAccount() {
            engine.startImpersonation(ImpersonationTarget.of(Role.INDIVIDUAL));

            assertThat(engine.evaluateGuard(StandardGuards.DASHBOARD).isAllowed()).isTrue();
        }

        @Test
        @DisplayName("a student cannot escalate through the engine")
        void studentCannotEscalate() {
            identity.signIn(TestIdentityFactory.withRole(Role.STUDENT, UNI));

            ImpersonationResult result = engine.startImpersonation(ImpersonationTarget.of(Role.STAFF));

            assertThat(result.error()).isEqualTo(ImpersonationError.UNAUTHORIZED);
            assertThat(engine.effectiveRole()).contains(Role.STUDENT);
        }

        @Test
        @DisplayName("ending the session discards the overlay")
        void endSession() {
            IdentitySnapshot admin = TestIdentityFactory.admin("admin-1");
            engine.startImpersonation(ImpersonationTarget.of(Role.STAFF));

            assertThat(engine.endSession(admin.sessionKey())).isTrue();
            assertThat(engine.effectiveRole()).contains(Role.ADMIN);
        }

        @Test
        @DisplayName("signing out through the engine discards the overlay before the next sign-in")
        void endCurrentSession() {
            engine.startImpersonation(ImpersonationTarget.of(Role.INDIVIDUAL));

            assertThat(engine.endCurrentSession()).isTrue();
            identity.signOut();
            assertThat(engine.endCurrentSession()).isFalse();

            identity.signIn(TestIdentityFactory.admin("admin-1"));
            assertThat(engine.currentImpersonation()).isEmpty();
            assertThat(engine.effectiveRole()).contains(Role.ADMIN);
        }

        @Test
        @DisplayName("binds the acting admin into the logging context")
        void loggingContext() {
            CorrelationContextHolder.set(CorrelationContext.of("corr-1"));
            engine.startImpersonation(ImpersonationTarget.of(Role.STUDENT, UNI, null));

            engine.evaluateGuard(StandardGuards.STUDENT);

            CorrelationContext ctx = CorrelationContextHolder.get().orElseThrow();
            assertThat(ctx.subjectId()).isEqualTo("admin-1");
            assertThat(ctx.actingAdminId()).isEqualTo("admin-1");
            assertThat(ctx.organizationId()).isEqualTo(UNI);
        }

        @Test
        @DisplayName("starting while the identity provider is down propagates the outage")
        void startDuringOutage() {
            identity.failing(true);

            assertThatThrownBy(() -> engine.startImpersonation(ImpersonationTarget.of(Role.STAFF)))
                    .isInstanceOf(SourceUnavailableException.class);
        }
    }

    @Nested
    @DisplayName("feature flags")
    class Flags {

        @BeforeEach
        void signInAdvisor() {
            identity.signIn(TestIdentityFactory.withRole(Role.ADVISOR, UNI));
        }

        @Test
        @DisplayName("an unloaded flag is pending")
        void unknown() {
            assertThat(engine.evaluateGuard(StandardGuards.ADVISOR).reason()).isEqualTo(DecisionReason.FLAG_UNKNOWN);
        }

        @Test
        @DisplayName("a disabled flag sends the advisor to the dashboard")
        void disabled() {
            flags.setPlatformDefault(StandardGuards.ADVISOR_DASHBOARD_FLAG, false);

            assertThat(engine.evaluateGuard(StandardGuards.ADVISOR))
                    .isEqualTo(Decision.deny("/dashboard", DecisionReason.FLAG_DISABLED));
        }

        @Test
        @DisplayName("a tenant override for the advisor's university enables the view")
        void tenantOverride() {
            flags.setPlatformDefault(StandardGuards.ADVISOR_DASHBOARD_FLAG, false);
            flags.setTenantOverride(UNI, StandardGuards.ADVISOR_DASHBOARD_FLAG, true);

            assertThat(engine.evaluateGuard(StandardGuards.ADVISOR).isAllowed()).isTrue();
        }

        @Test
        @DisplayName("the impersonated organization selects the tenant override")
        void impersonatedTenant() {
            identity.signIn(TestIdentityFactory.admin("admin-1"));
            flags.setPlatformDefault(StandardGuards.ADVISOR_DASHBOARD_FLAG, false);
            flags.setTenantOverride("uni-2", StandardGuards.ADVISOR_DASHBOARD_FLAG, true);
            engine.startImpersonation(ImpersonationTarget.of(Role.ADVISOR, "uni-2", null));

            assertThat(engine.evaluateGuard(StandardGuards.ADVISOR).isAllowed()).isTrue();
        }

        @Test
        @DisplayName("a failing flag source is pending as unavailable")
        void failingSource() {
            FeatureFlagSource failing = mock(FeatureFlagSource.class);
            when(failing.currentValues()).thenThrow(new SourceUnavailableException("flags", "down"));
            AccessEngine engine = engineWith(identity, new FeatureFlagEvaluator(failing));

            assertThat(engine.evaluateGuard(StandardGuards.ADVISOR))
                    .isEqualTo(Decision.pending(DecisionReason.SOURCE_UNAVAILABLE));
        }
    }

    @Nested
    @DisplayName("onboarding")
    class Onboarding {

        @Test
        @DisplayName("a brand-new account is sent to onboarding")
        void newAccount() {
            identity.signIn(TestIdentityFactory.newAccount(NOW.minusSeconds(30)));

            assertThat(engine.evaluateGuard(StandardGuards.DASHBOARD))
                    .isEqualTo(Decision.deny("/onboarding", DecisionReason.ONBOARDING_REQUIRED));
        }

        @Test
        @DisplayName("an account past the grace window is let through")
        void oldAccount() {
            identity.signIn(TestIdentityFactory.newAccount(NOW.minus(Duration.ofHours(1))));

            assertThat(engine.evaluateGuard(StandardGuards.DASHBOARD).isAllowed()).isTrue();
        }
    }

    @Nested
    @DisplayName("session lifecycle")
    class Session {

        @Test
        @DisplayName("a sign-out during evaluation discards the decision")
        void signOutDuringEvaluation() {
            IdentityProvider provider = mock(IdentityProvider.class);
            when(provider.currentIdentity())
                    .thenReturn(TestIdentityFactory.admin("admin-1"), IdentitySnapshot.absent());

            Decision decision = engineWith(provider, new FeatureFlagEvaluator(flags))
                    .evaluateGuard(StandardGuards.ADMIN);

            assertThat(decision).isEqualTo(Decision.pending(DecisionReason.SESSION_ENDED));
        }

        @Test
        @DisplayName("a session switch during evaluation discards the decision")
        void sessionSwitch() {
            IdentitySnapshot admin = TestIdentityFactory.admin("admin-1");
            IdentityProvider provider = mock(IdentityProvider.class);
            when(provider.currentIdentity()).thenReturn(admin, TestIdentityFactory.inSession(admin, "sess-2"));

            Decision decision = engineWith(provider, new FeatureFlagEvaluator(flags))
                    .evaluateGuard(StandardGuards.ADMIN);

            assertThat(decision.reason()).isEqualTo(DecisionReason.SESSION_ENDED);
        }
    }

    @Nested
    @DisplayName("billing")
    class Billing {

        @Test
        @DisplayName("a billing outage leaves the plan unknown and the decision intact")
        void billingOutage() {
            identity.signIn(TestIdentityFactory.withRole(Role.STAFF));
            when(plans.planFor(anyString())).thenThrow(new SourceUnavailableException("billing", "down"));

            assertThat(engine.effectivePlan()).isEmpty();
            assertThat(engine.effectiveRole()).contains(Role.STAFF);
            assertThat(engine.evaluateGuard(RouteGuardSpec.allowing(Role.STAFF)).isAllowed()).isTrue();
        }
    }

    @Test
    @DisplayName("counts decisions by outcome and reason")
    void metrics() {
        engine.evaluateGuard(StandardGuards.ADMIN);
        engine.evaluateGuard(StandardGuards.ADMIN);
        identity.signOut();
        engine.evaluateGuard(StandardGuards.ADMIN);

        assertThat(registry.get(AccessMetrics.DECISIONS)
                .tags("outcome", "PENDING", "reason", "IDENTITY_LOADING").counter().count()).isEqualTo(2.0);
        assertThat(registry.get(AccessMetrics.DECISIONS)
                .tags("outcome", "DENY", "reason", "UNAUTHENTICATED").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("rejects a null guard")
    void nullSpec() {
        assertThatThrownBy(() -> engine.evaluateGuard(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
