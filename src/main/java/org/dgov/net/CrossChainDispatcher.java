package org.dgov.net;

import org.dgov.bc.SignatureUtil;
import org.dgov.db.GovernanceStore;
import org.dgov.events.EventLog;
import org.dgov.events.EventType;
import org.dgov.events.GovernanceEvent;
import org.dgov.governance.AccessControl;
import org.dgov.governance.FinalizationController;
import org.dgov.governance.GovernanceError;
import org.dgov.governance.GovernanceException;
import org.dgov.governance.ProposalStore;
import org.dgov.governance.VoteAggregator;
import org.dgov.governance.VoteSource;
import org.dgov.util.TimeUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Inbound half of the cross-chain extension.
 * <p>
 * Payloads are decoded, checked against the key trusted for their source
 * chain and routed by their kind tag to the same operations local callers
 * use. Payloads that do not decode, or do not come from a trusted chain with
 * its trusted key, are logged and dropped. Authenticated messages that fail
 * their operation are logged and recorded. Nothing propagates back to the
 * transport.
 */
public class CrossChainDispatcher implements MessageHandler {

    private static final Logger log = LoggerFactory.getLogger(CrossChainDispatcher.class);

    private final EnvelopeCodec codec;
    private final GovernanceStore store;
    private final AccessControl accessControl;
    private final ProposalStore proposals;
    private final VoteAggregator votes;
    private final FinalizationController finalization;
    private final EventLog eventLog;
    private final Clock clock;

    public CrossChainDispatcher(EnvelopeCodec codec, GovernanceStore store, AccessControl accessControl,
                                ProposalStore proposals, VoteAggregator votes, FinalizationController finalization,
                                EventLog eventLog, Clock clock) {
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.accessControl = Objects.requireNonNull(accessControl, "accessControl must not be null");
        this.proposals = Objects.requireNonNull(proposals, "proposals must not be null");
        this.votes = Objects.requireNonNull(votes, "votes must not be null");
        this.finalization = Objects.requireNonNull(finalization, "finalization must not be null");
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void onMessage(byte[] payload) {
        Envelope envelope;
        try {
            envelope = codec.decode(payload);
            authenticate(envelope);
        } catch (GovernanceException e) {
            // Unauthenticated traffic is logged, never stored.
            log.warn("[CrossChainDispatcher] Dropped inbound message: " + e.getMessage());
            return;
        } catch (RuntimeException e) {
            log.error("[CrossChainDispatcher] Failed to decode inbound message: " + e.getMessage(), e);
            return;
        }
        try {
            dispatch(envelope);
        } catch (GovernanceException e) {
            log.warn("[CrossChainDispatcher] Rejected " + describe(envelope) + ": " + e.getMessage());
            recordRejection(envelope, e.getError());
        } catch (RuntimeException e) {
            log.error("[CrossChainDispatcher] Failed to process " + describe(envelope) + ": " + e.getMessage(), e);
        }
    }

    /**
     * Applies an authenticated envelope.
     *
     * @return false if the message was a redelivery that had already been applied
     * @throws GovernanceException {@code UNAUTHORIZED} if the source chain is
     *                             not trusted with this key, {@code MALFORMED_PAYLOAD}
     *                             if addressed to another chain, or whatever the
     *                             routed operation throws
     */
    public boolean dispatch(Envelope envelope) {
        authenticate(envelope);
        String source = envelope.getSourceChain();
        if (!codec.getChainId().equals(envelope.getDestinationChain())) {
            throw new GovernanceException(GovernanceError.MALFORMED_PAYLOAD,
                    "message is addressed to " + envelope.getDestinationChain());
        }

        switch (envelope.getType()) {
            case CREATE_PROPOSAL: {
                CreateProposalPayload body = envelope.bodyAs(CreateProposalPayload.class);
                proposals.create(envelope.getSender(), body.getDaoId(), body.getProposalId(), body.getDescription(),
                        body.getStart(), body.getEnd(), body.getQuorum());
                return true;
            }
            case VOTE: {
                VotePayload body = envelope.bodyAs(VotePayload.class);
                if (!body.getVoter().equals(envelope.getSender())) {
                    throw new GovernanceException(GovernanceError.MALFORMED_PAYLOAD,
                            "vote for " + body.getVoter() + " sent by " + envelope.getSender());
                }
                return votes.applyVote(body.getProposalId(), body.getVoter(), body.getWeight(),
                        VoteSource.remote(source, envelope.getMessageId()));
            }
            case FINALIZE: {
                FinalizePayload body = envelope.bodyAs(FinalizePayload.class);
                finalization.finalizeFromRemote(body.getProposalId(), source);
                return true;
            }
            default:
                throw new GovernanceException(GovernanceError.MALFORMED_PAYLOAD, "unsupported kind " + envelope.getType());
        }
    }

    private void authenticate(Envelope envelope) {
        Objects.requireNonNull(envelope, "envelope must not be null");
        String source = envelope.getSourceChain();
        String trustedKey = store.getTrustedChainKey(source);
        if (trustedKey == null) {
            throw new GovernanceException(GovernanceError.UNAUTHORIZED, "chain " + source + " is not trusted");
        }
        if (!trustedKey.equals(envelope.getMessage().getSenderPublicKey())) {
            throw new GovernanceException(GovernanceError.UNAUTHORIZED,
                    "message from " + source + " is not signed with its trusted key");
        }
    }

    /**
     * Trusts {@code publicKey} for messages claiming to come from {@code chainId}.
     * Replaces any key trusted before.
     */
    public void trustChain(String caller, String chainId, String publicKey) {
        accessControl.requireAdministrator(caller);
        if (chainId == null || chainId.isBlank()) {
            throw new GovernanceException(GovernanceError.INVALID_ARGUMENT, "chain id must not be blank");
        }
        if (chainId.equals(codec.getChainId())) {
            throw new GovernanceException(GovernanceError.INVALID_ARGUMENT, "cannot trust this chain itself");
        }
        String address;
        try {
            address = SignatureUtil.addressOf(SignatureUtil.getPublicKeyFromString(publicKey));
        } catch (Exception e) {
            throw new GovernanceException(GovernanceError.INVALID_ARGUMENT, "public key is not a valid EC key", e);
        }
        GovernanceEvent event = GovernanceEvent.of(EventType.CHAIN_TRUSTED, TimeUtil.getCurrentUnixTime(clock))
                .withActor(caller)
                .with("chainId", chainId)
                .with("address", address);
        store.putTrustedChain(chainId, publicKey, event);
        log.info("[CrossChainDispatcher] Trusting chain " + chainId + " (" + address + ")");
        eventLog.notifyCommitted(event);
    }

    private void recordRejection(Envelope envelope, GovernanceError error) {
        GovernanceEvent event = GovernanceEvent.of(EventType.CROSS_CHAIN_MESSAGE_REJECTED, TimeUtil.getCurrentUnixTime(clock))
                .withProposal(envelope.getBody().getProposalId())
                .withActor(envelope.getSender())
                .with("error", error)
                .with("sourceChain", envelope.getSourceChain())
                .with("messageId", envelope.getMessageId())
                .with("kind", envelope.getType());
        try {
            eventLog.publish(event);
        } catch (RuntimeException e) {
            log.error("[CrossChainDispatcher] Could not record rejection: " + e.getMessage(), e);
        }
    }

    private static String describe(Envelope envelope) {
        return envelope.getType() + " " + envelope.getMessageId() + " from " + envelope.getSourceChain();
    }
}
