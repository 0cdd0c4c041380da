package org.dgov.governance;

/**
 * Result recorded when a proposal is finalized: PASSED when the accumulated
 * weight reached the quorum, REJECTED otherwise.
 */
public enum Outcome {
    PASSED,
    REJECTED;

    public static Outcome evaluate(long totalWeight, long quorum) {
        return totalWeight >= quorum ? PASSED : REJECTED;
    }
}
