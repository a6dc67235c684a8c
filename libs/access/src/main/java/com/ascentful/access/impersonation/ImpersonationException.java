package com.ascentful.access.impersonation;

/**
 * Unchecked form of a failed {@link ImpersonationResult}, for callers that prefer to
 * propagate rejections (e.g., HTTP controllers mapped by an exception handler).
 */
public class ImpersonationException extends RuntimeException {

    private final ImpersonationError error;

    public ImpersonationException(ImpersonationError error, String message) {
        super(message);
        this.error = error;
    }

    public ImpersonationError error() {
        return error;
    }
}
