package com.ascentful.accessservice.config;

import com.ascentful.access.OnboardingStatusEvaluator;
import com.ascentful.access.Plan;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration of the access service, bound from {@code ascentful.access.*}.
 *
 * <pre>
 * ascentful:
 *   access:
 *     name: access-service
 *     environment: production
 *     onboarding-grace-window: 5m
 *     default-plan: free
 *     flags:
 *       "[advisor.dashboard]": false
 *     tenant-flags:
 *       uni-1:
 *         "[advisor.dashboard]": true
 * </pre>
 *
 * @param name service name used in logs and metric tags. Required.
 * @param environment deployment environment (default {@code development})
 * @param onboardingGraceWindow age after which an account is never sent to onboarding
 * @param defaultPlan plan code assumed when the caller's plan is not supplied
 * @param flags platform flag defaults seeded at start-up
 * @param tenantFlags per-organization flag overrides seeded at start-up
 */
@ConfigurationProperties(prefix = "ascentful.access")
@Validated
public record AccessServiceProperties(
        @NotBlank String name,
        String environment,
        Duration onboardingGraceWindow,
        String defaultPlan,
        Map<String, Boolean> flags,
        Map<String, Map<String, Boolean>> tenantFlags) {

    public AccessServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (onboardingGraceWindow == null) {
            onboardingGraceWindow = OnboardingStatusEvaluator.DEFAULT_GRACE_WINDOW;
        }
        if (onboardingGraceWindow.isNegative()) {
            throw new IllegalArgumentException("onboardingGraceWindow must not be negative");
        }
        if (defaultPlan == null || defaultPlan.isBlank()) {
            defaultPlan = Plan.FREE.value();
        }
        if (Plan.fromString(defaultPlan).isEmpty()) {
            throw new IllegalArgumentException("Unknown defaultPlan: " + defaultPlan);
        }
        flags = flags == null ? Map.of() : Map.copyOf(flags);
        tenantFlags = tenantFlags == null ? Map.of() : Map.copyOf(tenantFlags);
    }

    public Plan resolvedDefaultPlan() {
        return Plan.fromString(defaultPlan).orElseThrow();
    }
}
