package org.dgov.governance;

/**
 * Every reason a governance call can be rejected. Callers and off-chain
 * tooling match on these, so a kind is never reused for a different cause.
 */
public enum GovernanceError {
    UNAUTHORIZED(ErrorCategory.AUTHORIZATION),

    DUPLICATE_ID(ErrorCategory.VALIDATION),
    DUPLICATE_PROPOSAL(ErrorCategory.VALIDATION),
    MALFORMED_PAYLOAD(ErrorCategory.VALIDATION),
    INVALID_ARGUMENT(ErrorCategory.VALIDATION),

    VOTING_NOT_ACTIVE(ErrorCategory.STATE),
    VOTING_STILL_ACTIVE(ErrorCategory.STATE),
    ALREADY_FINALIZED(ErrorCategory.STATE),
    PROPOSAL_NOT_FOUND(ErrorCategory.STATE),
    UNKNOWN_DAO(ErrorCategory.STATE),
    NOT_FOUND(ErrorCategory.STATE),

    NOT_ELIGIBLE(ErrorCategory.ELIGIBILITY),
    INSUFFICIENT_TOKENS(ErrorCategory.ELIGIBILITY),

    INSUFFICIENT_FEE(ErrorCategory.RESOURCE),

    DISPATCH_FAILED(ErrorCategory.TRANSPORT);

    private final ErrorCategory category;

    GovernanceError(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory category() {
        return category;
    }
}
