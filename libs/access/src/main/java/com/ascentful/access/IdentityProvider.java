package com.ascentful.access;

/**
 * Adapter over the external identity provider. Token issuance and validation stay on the
 * provider's side; this contract only exposes the resulting caller.
 */
public interface IdentityProvider {

    /**
     * Returns the current caller. Must not block: returns {@link IdentitySnapshot#loading()}
     * until the provider handshake has completed.
     *
     * @throws SourceUnavailableException if the provider cannot be reached
     */
    IdentitySnapshot currentIdentity();
}
