package com.ascentful.access.impersonation;

/**
 * Reasons an impersonation request is rejected. A rejection never modifies the store.
 */
public enum ImpersonationError {

    /** The caller's real role is not administrative. */
    UNAUTHORIZED,

    /** The session already has an overlay; it must be stopped first. */
    ALREADY_ACTIVE,

    /** The requested target is not a coherent identity (administrative role, missing organization). */
    INVALID_TARGET
}
