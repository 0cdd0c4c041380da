package org.dgov.net;

/**
 * Closed set of cross-chain message kinds. The tag travels in every envelope
 * and is read before any body field.
 */
public enum MessageType {
    CREATE_PROPOSAL(CreateProposalPayload.class),
    VOTE(VotePayload.class),
    FINALIZE(FinalizePayload.class);

    private final Class<? extends CrossChainPayload> payloadClass;

    MessageType(Class<? extends CrossChainPayload> payloadClass) {
        this.payloadClass = payloadClass;
    }

    public Class<? extends CrossChainPayload> payloadClass() {
        return payloadClass;
    }
}
