package com.ascentful.access;

/**
 * Load state of the caller's identity.
 * <p>
 * {@link #LOADING} and {@link #ABSENT} are distinct: loading blocks every decision
 * ({@code Pending}), absent is a definitive deny.
 */
public enum IdentityStatus {

    /** The identity provider adapter has not completed its handshake yet. */
    LOADING,

    /** An authenticated caller is known. */
    READY,

    /** Nobody is signed in. */
    ABSENT
}
