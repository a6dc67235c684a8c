package com.ascentful.access;

import com.ascentful.access.impersonation.ImpersonationResult;
import com.ascentful.observability.MetricFactory;

/**
 * Counters for guard decisions and impersonation requests.
 */
public class AccessMetrics {

    public static final String DECISIONS = "access.decisions";
    public static final String IMPERSONATIONS = "access.impersonations";

    private final MetricFactory metrics;

    public AccessMetrics(MetricFactory metrics) {
        this.metrics = metrics;
    }

    /** Metrics kept in a private registry, for embedded use. */
    public static AccessMetrics standalone() {
        return new AccessMetrics(MetricFactory.standalone("ascentful-access"));
    }

    public void recordDecision(Decision decision) {
        metrics.counter(DECISIONS, "Guard decisions by outcome and reason",
                "outcome", decision.outcome().name(),
                "reason", decision.reason().name())
                .increment();
    }

    public void recordImpersonation(ImpersonationResult result) {
        String outcome = result.isSuccess() ? "STARTED" : result.error().name();
        metrics.counter(IMPERSONATIONS, "Impersonation requests by outcome", "outcome", outcome)
                .increment();
    }
}
