package com.ascentful.access.impersonation;

import java.util.Optional;

/**
 * Outcome of {@link ImpersonationOverlayStore#start}: either the committed overlay or the
 * reason it was rejected.
 *
 * @param overlay the committed overlay (null on failure)
 * @param error   rejection reason (null on success)
 * @param message human-readable rejection detail (null on success)
 */
public record ImpersonationResult(ImpersonationOverlay overlay, ImpersonationError error, String message) {

    public static ImpersonationResult ok(ImpersonationOverlay overlay) {
        return new ImpersonationResult(overlay, null, null);
    }

    public static ImpersonationResult fail(ImpersonationError error, String message) {
        return new ImpersonationResult(null, error, message);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<ImpersonationError> errorIfAny() {
        return Optional.ofNullable(error);
    }

    /**
     * Returns the overlay or throws the rejection as an {@link ImpersonationException}.
     */
    public ImpersonationOverlay orElseThrow() {
        if (error != null) {
            throw new ImpersonationException(error, message);
        }
        return overlay;
    }
}
