package org.dgov.net;

/**
 * Body of a cross-chain message. Every kind targets exactly one proposal.
 */
public interface CrossChainPayload {

    String getProposalId();

    /**
     * @return the name of the first required field that is missing, or {@code null}
     */
    String missingField();
}
