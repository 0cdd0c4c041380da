package org.dgov.events;

public enum EventType {
    // Registry
    DAO_CREATED,
    DAO_UPDATED,
    CREATION_FEE_CHANGED,

    // Proposals and votes
    PROPOSAL_CREATED,
    VOTE_ACCEPTED,
    PROPOSAL_FINALIZED,

    // Cross-chain
    CROSS_CHAIN_PROPOSAL_DISPATCHED,
    CROSS_CHAIN_VOTE_DISPATCHED,
    CROSS_CHAIN_FINALIZE_DISPATCHED,
    CROSS_CHAIN_MESSAGE_REJECTED,
    CHAIN_TRUSTED,

    // Administration
    WHITELIST_UPDATED,
    FEES_WITHDRAWN
}
