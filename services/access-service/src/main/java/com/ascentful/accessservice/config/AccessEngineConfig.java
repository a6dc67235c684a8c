package com.ascentful.accessservice.config;

import com.ascentful.access.AccessEngine;
import com.ascentful.access.AccessMetrics;
import com.ascentful.access.GuardEnforcer;
import com.ascentful.access.IdentityProvider;
import com.ascentful.access.OnboardingStatusEvaluator;
import com.ascentful.access.PlanSource;
import com.ascentful.access.flags.FeatureFlagEvaluator;
import com.ascentful.access.flags.FlagValues;
import com.ascentful.access.flags.InMemoryFeatureFlagSource;
import com.ascentful.access.impersonation.ImpersonationAuditLogger;
import com.ascentful.access.impersonation.ImpersonationOverlayStore;
import com.ascentful.accessservice.infrastructure.web.RequestScopedIdentityProvider;
import com.ascentful.accessservice.infrastructure.web.RequestScopedPlanSource;
import com.ascentful.observability.MetricFactory;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the access engine and its collaborators.
 *
 * <p>The overlay store and the flag source are singletons shared by all request threads. The
 * identity and plan adapters read the request being served.
 */
@Configuration
public class AccessEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(AccessEngineConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, AccessServiceProperties properties) {
        return new MetricFactory(registry, properties.name());
    }

    @Bean
    public ImpersonationOverlayStore impersonationOverlayStore(Clock clock) {
        return new ImpersonationOverlayStore(clock, new ImpersonationAuditLogger());
    }

    @Bean
    public InMemoryFeatureFlagSource featureFlagSource(AccessServiceProperties properties) {
        var source = new InMemoryFeatureFlagSource();
        source.publish(new FlagValues(properties.flags(), properties.tenantFlags()));
        log.info("Seeded feature flags from configuration: defaults={}, tenants={}",
                properties.flags().keySet(), properties.tenantFlags().keySet());
        return source;
    }

    @Bean
    public FeatureFlagEvaluator featureFlagEvaluator(InMemoryFeatureFlagSource source) {
        return new FeatureFlagEvaluator(source);
    }

    @Bean
    public IdentityProvider identityProvider() {
        return new RequestScopedIdentityProvider();
    }

    @Bean
    public PlanSource planSource(AccessServiceProperties properties) {
        return new RequestScopedPlanSource(properties.resolvedDefaultPlan());
    }

    @Bean
    public AccessEngine accessEngine(
            IdentityProvider identityProvider,
            ImpersonationOverlayStore store,
            FeatureFlagEvaluator flagEvaluator,
            PlanSource planSource,
            Clock clock,
            MetricFactory metricFactory,
            AccessServiceProperties properties) {
        return new AccessEngine(
                identityProvider,
                store,
                flagEvaluator,
                planSource,
                new OnboardingStatusEvaluator(clock, properties.onboardingGraceWindow()),
                new AccessMetrics(metricFactory));
    }

    @Bean
    public GuardEnforcer guardEnforcer(AccessEngine engine) {
        return new GuardEnforcer(engine);
    }
}
