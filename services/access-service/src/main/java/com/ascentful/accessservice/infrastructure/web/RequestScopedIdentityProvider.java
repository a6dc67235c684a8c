package com.ascentful.accessservice.infrastructure.web;

import com.ascentful.access.IdentityProvider;
import com.ascentful.access.IdentitySnapshot;

/**
 * Identity provider backed by the identity headers of the current request. A thread that is
 * not serving a request sees a signed-out caller.
 */
public class RequestScopedIdentityProvider implements IdentityProvider {

    @Override
    public IdentitySnapshot currentIdentity() {
        return RequestIdentityHolder.get()
                .map(RequestIdentity::snapshot)
                .orElse(IdentitySnapshot.absent());
    }
}
