package org.dgov.net;

import org.dgov.bc.SignatureUtil;
import org.dgov.constants.ConfigKey;
import org.dgov.db.GovernanceStore;
import org.dgov.events.EventLog;
import org.dgov.events.EventType;
import org.dgov.events.GovernanceEvent;
import org.dgov.governance.GovernanceError;
import org.dgov.governance.GovernanceException;
import org.dgov.governance.Identifiers;
import org.dgov.util.TimeUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Outbound half of the cross-chain extension: turns local requests into
 * signed envelopes and hands them to the transport.
 * <p>
 * Each destination has its own sequence counter, advanced only once the
 * transport accepted the payload. A rejected send is reported as
 * {@code DISPATCH_FAILED} and never retried here.
 */
public class CrossChainSender {

    private static final Logger log = LoggerFactory.getLogger(CrossChainSender.class);

    private final String chainId;
    private final EnvelopeCodec codec;
    private final MessageTransport transport;
    private final GovernanceStore store;
    private final EventLog eventLog;
    private final Clock clock;

    public CrossChainSender(EnvelopeCodec codec, MessageTransport transport, GovernanceStore store,
                            EventLog eventLog, Clock clock) {
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.chainId = codec.getChainId();
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Asks {@code destinationChain} to create a proposal; {@code caller} must
     * control the DAO there.
     *
     * @return id of the dispatched message
     */
    public String sendCreateProposal(String caller, String destinationChain, String daoId, String proposalId,
                                     String description, long start, long end, long quorum) {
        Identifiers.requireId(daoId, "dao id");
        Identifiers.requireId(proposalId, "proposal id");
        CreateProposalPayload body = new CreateProposalPayload(daoId, proposalId, description, start, end, quorum);
        return dispatch(MessageType.CREATE_PROPOSAL, EventType.CROSS_CHAIN_PROPOSAL_DISPATCHED, caller, destinationChain, body);
    }

    /**
     * Casts {@code caller}'s vote on a proposal that lives on {@code destinationChain}.
     */
    public String sendVote(String caller, String destinationChain, String proposalId, long weight) {
        Identifiers.requireId(proposalId, "proposal id");
        if (weight <= 0) {
            throw new GovernanceException(GovernanceError.INVALID_ARGUMENT, "weight must be positive");
        }
        VotePayload body = new VotePayload(proposalId, weight, caller);
        return dispatch(MessageType.VOTE, EventType.CROSS_CHAIN_VOTE_DISPATCHED, caller, destinationChain, body);
    }

    public String sendFinalize(String caller, String destinationChain, String proposalId) {
        Identifiers.requireId(proposalId, "proposal id");
        FinalizePayload body = new FinalizePayload(proposalId);
        return dispatch(MessageType.FINALIZE, EventType.CROSS_CHAIN_FINALIZE_DISPATCHED, caller, destinationChain, body);
    }

    /**
     * Next sequence number that will be used towards {@code destinationChain}.
     */
    public long nextSequence(String destinationChain) {
        String value = store.getConfig(ConfigKey.OUTBOUND_SEQUENCE.key(destinationChain));
        return value == null ? 0L : Long.parseLong(value);
    }

    private String dispatch(MessageType type, EventType eventType, String caller, String destinationChain,
                            CrossChainPayload body) {
        Identifiers.requireAddress(caller, "caller");
        if (destinationChain == null || destinationChain.isBlank()) {
            throw new GovernanceException(GovernanceError.INVALID_ARGUMENT, "destination chain must not be blank");
        }
        if (destinationChain.equals(chainId)) {
            throw new GovernanceException(GovernanceError.INVALID_ARGUMENT, "destination is this chain");
        }

        long sequence = nextSequence(destinationChain);
        String receiver = receiverOf(destinationChain);
        Message message = codec.seal(type, destinationChain, caller, receiver, sequence, body);
        byte[] payload = codec.encode(message);

        TransportReceipt receipt;
        try {
            receipt = transport.send(destinationChain, receiver, payload);
        } catch (TransportException e) {
            log.error("[CrossChainSender] " + type + " to " + destinationChain + " failed: " + e.getMessage());
            throw new GovernanceException(GovernanceError.DISPATCH_FAILED,
                    "transport rejected " + type + " for " + destinationChain, e);
        }
        GovernanceEvent event = GovernanceEvent.of(eventType, TimeUtil.getCurrentUnixTime(clock))
                .withProposal(body.getProposalId())
                .withActor(caller)
                .with("destinationChain", destinationChain)
                .with("messageId", message.getMessageId())
                .with("sequence", sequence);
        store.putConfig(ConfigKey.OUTBOUND_SEQUENCE.key(destinationChain), Long.toString(sequence + 1), event);

        log.info("[CrossChainSender] Dispatched " + type + " " + message.getMessageId() + " to " + destinationChain
                + " (seq " + sequence + ", " + receipt.getSize() + " bytes)");
        eventLog.notifyCommitted(event);
        return message.getMessageId();
    }

    /**
     * Address of the destination chain's trusted key, or {@code null} when the
     * destination has not been trusted locally.
     */
    private String receiverOf(String destinationChain) {
        String key = store.getTrustedChainKey(destinationChain);
        if (key == null) {
            return null;
        }
        try {
            return SignatureUtil.addressOf(SignatureUtil.getPublicKeyFromString(key));
        } catch (Exception e) {
            log.warn("[CrossChainSender] Trusted key for " + destinationChain + " is unreadable: " + e.getMessage());
            return null;
        }
    }
}
