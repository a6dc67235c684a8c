package com.ascentful.access;

import java.util.function.Supplier;

/**
 * Thin adapter between the pure decision and the view. The protected content supplier is
 * invoked only on allow; every other outcome is handed to the {@link GuardOutcomeHandler}.
 */
public class GuardEnforcer {

    private final AccessEngine engine;

    public GuardEnforcer(AccessEngine engine) {
        this.engine = engine;
    }

    public <T> T enforce(RouteGuardSpec spec, Supplier<T> protectedContent, GuardOutcomeHandler<T> handler) {
        Decision decision = engine.evaluateGuard(spec);
        return switch (decision.outcome()) {
            case ALLOW -> protectedContent.get();
            case PENDING -> handler.onPending(decision);
            case DENY -> handler.onRedirect(decision.redirectPath(), decision);
        };
    }
}
