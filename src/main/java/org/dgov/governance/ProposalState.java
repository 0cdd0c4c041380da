package org.dgov.governance;

import org.dgov.util.TimeUtil;

/**
 * Lifecycle of a proposal, derived from the clock and the terminal flag.
 * Transitions only move forward; FINALIZED has no successor.
 */
public enum ProposalState {
    PENDING,
    ACTIVE,
    ENDED,
    FINALIZED;

    public static ProposalState of(long now, long start, long end, boolean finalized) {
        if (finalized) {
            return FINALIZED;
        }
        if (now < start) {
            return PENDING;
        }
        return TimeUtil.isExpired(now, end) ? ENDED : ACTIVE;
    }
}
