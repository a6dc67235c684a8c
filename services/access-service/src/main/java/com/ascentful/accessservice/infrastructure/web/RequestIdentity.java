package com.ascentful.accessservice.infrastructure.web;

import com.ascentful.access.IdentitySnapshot;
import com.ascentful.access.Plan;

/**
 * Caller of the request being served, as read from the identity headers.
 *
 * @param snapshot real identity of the caller
 * @param plan billing plan asserted by the gateway (nullable)
 */
public record RequestIdentity(IdentitySnapshot snapshot, Plan plan) {

    public RequestIdentity {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot must not be null");
        }
    }
}
