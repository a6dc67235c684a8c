package com.ascentful.access;

/**
 * Effectful side of a guard: what the caller renders when access is not granted.
 *
 * @param <T> what the view produces (a response, a page model, ...)
 */
public interface GuardOutcomeHandler<T> {

    /** Render a loading state. Must not include protected content. */
    T onPending(Decision decision);

    /** Navigate to {@code redirectPath}. Must not include protected content. */
    T onRedirect(String redirectPath, Decision decision);
}
