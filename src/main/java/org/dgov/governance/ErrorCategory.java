package org.dgov.governance;

/**
 * Coarse grouping of {@link GovernanceError} kinds.
 */
public enum ErrorCategory {
    AUTHORIZATION,
    VALIDATION,
    STATE,
    ELIGIBILITY,
    RESOURCE,
    TRANSPORT
}
