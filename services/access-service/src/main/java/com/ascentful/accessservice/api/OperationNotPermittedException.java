package com.ascentful.accessservice.api;

/**
 * The real caller lacks the role an administrative endpoint requires. Mapped to 403.
 */
public class OperationNotPermittedException extends RuntimeException {

    public OperationNotPermittedException(String message) {
        super(message);
    }
}
