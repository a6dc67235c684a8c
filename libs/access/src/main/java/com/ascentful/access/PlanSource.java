package com.ascentful.access;

import java.util.Optional;

/**
 * Billing collaborator supplying the real subscription tier of a subject.
 */
public interface PlanSource {

    /**
     * @param subjectId the real subject
     * @return the subject's plan, or empty when billing knows none
     * @throws SourceUnavailableException if billing cannot be reached
     */
    Optional<Plan> planFor(String subjectId);
}
