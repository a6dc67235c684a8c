package com.ascentful.accessservice.infrastructure.web;

import com.ascentful.access.Plan;
import com.ascentful.access.PlanSource;
import java.util.Optional;

/**
 * Plan source backed by the {@code X-Subscription-Plan} header of the current request, falling
 * back to the configured default plan.
 */
public class RequestScopedPlanSource implements PlanSource {

    private final Plan defaultPlan;

    public RequestScopedPlanSource(Plan defaultPlan) {
        this.defaultPlan = defaultPlan;
    }

    @Override
    public Optional<Plan> planFor(String subjectId) {
        Plan asserted = RequestIdentityHolder.get()
                .filter(identity -> subjectId != null && subjectId.equals(identity.snapshot().subjectId()))
                .map(RequestIdentity::plan)
                .orElse(null);
        return Optional.ofNullable(asserted != null ? asserted : defaultPlan);
    }
}
