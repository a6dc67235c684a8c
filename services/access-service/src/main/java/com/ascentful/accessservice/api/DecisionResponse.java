package com.ascentful.accessservice.api;

import com.ascentful.access.Decision;

/**
 * JSON view of a guard {@link Decision}.
 */
public record DecisionResponse(String outcome, String redirectPath, String reason) {

    public static DecisionResponse from(Decision decision) {
        return new DecisionResponse(
                decision.outcome().name(), decision.redirectPath(), decision.reason().name());
    }
}
