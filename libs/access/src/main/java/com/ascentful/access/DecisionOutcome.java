package com.ascentful.access;

/**
 * Terminal states of a guard evaluation.
 */
public enum DecisionOutcome {
    ALLOW,
    PENDING,
    DENY
}
