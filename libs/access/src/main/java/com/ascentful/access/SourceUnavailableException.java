package com.ascentful.access;

/**
 * Thrown by a collaborator (identity, flag or billing source) that failed to respond.
 * <p>
 * The condition is retryable. The engine never lets it escape a guard evaluation: it
 * resolves to a pending decision instead of a deny, so an outage cannot lock callers out.
 */
public class SourceUnavailableException extends RuntimeException {

    private final String source;

    public SourceUnavailableException(String source, String message) {
        super("%s unavailable: %s".formatted(source, message));
        this.source = source;
    }

    public SourceUnavailableException(String source, String message, Throwable cause) {
        super("%s unavailable: %s".formatted(source, message), cause);
        this.source = source;
    }

    /** Name of the collaborator that failed. */
    public String source() {
        return source;
    }
}
