package org.dgov.governance;

import org.dgov.db.GovernanceStore;
import org.dgov.events.EventLog;
import org.dgov.events.EventType;
import org.dgov.events.GovernanceEvent;
import org.dgov.util.TimeUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Moves proposals to their terminal state once the voting window is over and
 * records whether the tally reached the quorum.
 */
public class FinalizationController {

    private static final Logger log = LoggerFactory.getLogger(FinalizationController.class);

    private final GovernanceStore store;
    private final ProposalStore proposals;
    private final DaoRegistry daoRegistry;
    private final EventLog eventLog;
    private final Clock clock;

    public FinalizationController(GovernanceStore store, ProposalStore proposals, DaoRegistry daoRegistry,
                                  EventLog eventLog, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.proposals = Objects.requireNonNull(proposals, "proposals must not be null");
        this.daoRegistry = Objects.requireNonNull(daoRegistry, "daoRegistry must not be null");
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Finalizes on behalf of the owning DAO's controller.
     *
     * @throws GovernanceException {@code PROPOSAL_NOT_FOUND}, {@code UNAUTHORIZED},
     *                             {@code VOTING_STILL_ACTIVE} or {@code ALREADY_FINALIZED}
     */
    public ProposalSnapshot finalize(String proposalId, String caller) {
        Proposal proposal = proposals.load(proposalId);
        Dao dao = daoRegistry.get(proposal.getDaoId());
        if (!dao.isControlledBy(caller)) {
            throw new GovernanceException(GovernanceError.UNAUTHORIZED,
                    caller + " does not control DAO " + dao.getId() + " owning proposal " + proposalId);
        }
        return complete(proposal, caller, "local");
    }

    /**
     * Finalizes on request of a trusted remote chain. The message arrived over
     * an authenticated channel, so no controller check applies.
     */
    public ProposalSnapshot finalizeFromRemote(String proposalId, String sourceChain) {
        Proposal proposal = proposals.load(proposalId);
        return complete(proposal, null, sourceChain);
    }

    private ProposalSnapshot complete(Proposal proposal, String caller, String source) {
        long now = TimeUtil.getCurrentUnixTime(clock);
        if (!TimeUtil.isExpired(now, proposal.getEndTime())) {
            throw new GovernanceException(GovernanceError.VOTING_STILL_ACTIVE,
                    "proposal " + proposal.getId() + " voting ends at " + proposal.getEndTime() + ", now " + now);
        }
        if (proposal.isFinalized()) {
            throw new GovernanceException(GovernanceError.ALREADY_FINALIZED,
                    "proposal " + proposal.getId() + " was finalized at " + proposal.getFinalizedAt());
        }

        Outcome outcome = Outcome.evaluate(proposal.getTotalWeight(), proposal.getQuorum());
        GovernanceEvent event = GovernanceEvent.of(EventType.PROPOSAL_FINALIZED, now)
                .withDao(proposal.getDaoId())
                .withProposal(proposal.getId())
                .withActor(caller)
                .with("outcome", outcome)
                .with("totalWeight", proposal.getTotalWeight())
                .with("quorum", proposal.getQuorum())
                .with("source", source);
        if (!store.markFinalized(proposal.getId(), outcome, now, event)) {
            throw new GovernanceException(GovernanceError.ALREADY_FINALIZED,
                    "proposal " + proposal.getId() + " is already finalized");
        }
        proposal.finalizeWith(outcome, now);

        log.info("[FinalizationController] Proposal " + proposal.getId() + " finalized (" + source + "): " + outcome
                + " with " + proposal.getTotalWeight() + "/" + proposal.getQuorum());
        eventLog.notifyCommitted(event);
        return new ProposalSnapshot(proposal, now);
    }
}
