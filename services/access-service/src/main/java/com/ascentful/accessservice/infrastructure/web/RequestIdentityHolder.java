package com.ascentful.accessservice.infrastructure.web;

import java.util.Optional;

/**
 * Thread-local holder for the {@link RequestIdentity} of the request on this thread. Set and
 * cleared by {@link IdentityHeaderFilter}.
 */
public final class RequestIdentityHolder {

    private static final ThreadLocal<RequestIdentity> CURRENT = new ThreadLocal<>();

    private RequestIdentityHolder() {
        // utility class
    }

    public static void set(RequestIdentity identity) {
        if (identity == null) {
            throw new IllegalArgumentException("identity must not be null");
        }
        CURRENT.set(identity);
    }

    public static Optional<RequestIdentity> get() {
        return Optional.ofNullable(CURRENT.get());
    }

    public static void clear() {
        CURRENT.remove();
    }
}
