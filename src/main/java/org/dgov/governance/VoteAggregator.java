package org.dgov.governance;

import org.dgov.db.GovernanceStore;
import org.dgov.events.EventLog;
import org.dgov.events.EventType;
import org.dgov.events.GovernanceEvent;
import org.dgov.external.MembershipOracle;
import org.dgov.util.TimeUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Clock;
import java.util.Objects;

/**
 * Applies single votes, local or received from another chain, to a proposal's tally.
 * <p>
 * Weight is additive: every accepted vote adds to the voter's running total
 * and to the proposal total in one commit. Remote votes are applied at most
 * once per dedup key, so a redelivered message never counts twice.
 */
public class VoteAggregator {

    private static final Logger log = LoggerFactory.getLogger(VoteAggregator.class);

    private final GovernanceStore store;
    private final ProposalStore proposals;
    private final DaoRegistry daoRegistry;
    private final MembershipOracle oracle;
    private final EventLog eventLog;
    private final Clock clock;

    public VoteAggregator(GovernanceStore store, ProposalStore proposals, DaoRegistry daoRegistry,
                          MembershipOracle oracle, EventLog eventLog, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.proposals = Objects.requireNonNull(proposals, "proposals must not be null");
        this.daoRegistry = Objects.requireNonNull(daoRegistry, "daoRegistry must not be null");
        this.oracle = Objects.requireNonNull(oracle, "oracle must not be null");
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Applies one vote.
     * <p>
     * Checks run in a fixed order: weight, whitelist, proposal existence,
     * duplicate remote key, voting window, token balance.
     *
     * @return true if the vote was counted, false if it was a remote redelivery
     * that had already been counted
     * @throws GovernanceException {@code INVALID_ARGUMENT}, {@code NOT_ELIGIBLE},
     *                             {@code PROPOSAL_NOT_FOUND}, {@code VOTING_NOT_ACTIVE}
     *                             or {@code INSUFFICIENT_TOKENS}
     */
    public boolean applyVote(String proposalId, String voter, long weight, VoteSource source) {
        Objects.requireNonNull(source, "source must not be null");
        if (weight <= 0) {
            throw new GovernanceException(GovernanceError.INVALID_ARGUMENT, "weight must be positive");
        }
        if (!oracle.isWhitelisted(voter)) {
            throw new GovernanceException(GovernanceError.NOT_ELIGIBLE, voter + " is not whitelisted");
        }

        Proposal proposal = proposals.load(proposalId);

        if (source.isRemote() && store.isMessageApplied(proposalId, source.getDedupKey())) {
            log.info("[VoteAggregator] Duplicate delivery " + source.getDedupKey() + " from " + source.getChainId()
                    + " for proposal " + proposalId + " discarded.");
            return false;
        }

        long now = TimeUtil.getCurrentUnixTime(clock);
        if (proposal.stateAt(now) != ProposalState.ACTIVE) {
            throw new GovernanceException(GovernanceError.VOTING_NOT_ACTIVE,
                    "proposal " + proposalId + " accepts votes in [" + proposal.getStartTime() + ", "
                            + proposal.getEndTime() + "], now " + now);
        }

        Dao dao = daoRegistry.get(proposal.getDaoId());
        BigInteger balance = oracle.balanceOf(dao.getTokenRef(), voter);
        if (balance.compareTo(dao.getMinimumTokens()) < 0) {
            throw new GovernanceException(GovernanceError.INSUFFICIENT_TOKENS,
                    voter + " holds " + balance + " of " + dao.getTokenRef() + ", needs " + dao.getMinimumTokens());
        }

        try {
            proposal.addVote(voter, weight);
        } catch (ArithmeticException e) {
            throw new GovernanceException(GovernanceError.INVALID_ARGUMENT, "weight overflows the tally", e);
        }

        GovernanceEvent event = GovernanceEvent.of(EventType.VOTE_ACCEPTED, now)
                .withDao(dao.getId())
                .withProposal(proposalId)
                .withActor(voter)
                .with("weight", weight)
                .with("voterWeight", proposal.weightOf(voter))
                .with("totalWeight", proposal.getTotalWeight())
                .with("source", source.isRemote() ? source.getChainId() : "local");
        if (source.isRemote()) {
            event = event.with("messageId", source.getDedupKey());
        }

        String dedupKey = source.isRemote() ? source.getDedupKey() : null;
        if (!store.recordVote(proposalId, voter, weight, dedupKey, event)) {
            return false;
        }
        log.info("[VoteAggregator] Vote accepted on " + proposalId + " from " + voter + " (" + source + "), weight "
                + weight + ", total " + proposal.getTotalWeight());
        eventLog.notifyCommitted(event);
        return true;
    }
}
