package org.dgov.governance;

import org.dgov.db.GovernanceStore;
import org.dgov.events.EventLog;
import org.dgov.events.EventType;
import org.dgov.events.GovernanceEvent;
import org.dgov.util.TimeUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Creates proposals and serves read-only snapshots of them.
 * <p>
 * Proposal ids are unique across the whole registry, and every proposal
 * stores the id of the DAO that owns it at creation time.
 */
public class ProposalStore {

    private static final Logger log = LoggerFactory.getLogger(ProposalStore.class);
    static final int MAX_DESCRIPTION_LENGTH = 4096;

    private final GovernanceStore store;
    private final DaoRegistry daoRegistry;
    private final EventLog eventLog;
    private final Clock clock;

    public ProposalStore(GovernanceStore store, DaoRegistry daoRegistry, EventLog eventLog, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.daoRegistry = Objects.requireNonNull(daoRegistry, "daoRegistry must not be null");
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Creates a proposal with an empty tally.
     *
     * @param start first second of the voting window (inclusive, must be positive)
     * @param end   last second of the voting window (inclusive, must be after start)
     * @throws GovernanceException {@code DUPLICATE_PROPOSAL} whenever the id exists,
     *                             else {@code UNKNOWN_DAO}, {@code UNAUTHORIZED} or
     *                             {@code INVALID_ARGUMENT}
     */
    public ProposalSnapshot create(String caller, String daoId, String proposalId, String description,
                                   long start, long end, long quorum) {
        Identifiers.requireId(proposalId, "proposal id");
        if (store.getProposal(proposalId) != null) {
            throw new GovernanceException(GovernanceError.DUPLICATE_PROPOSAL, "proposal " + proposalId + " already exists");
        }
        Dao dao = daoRegistry.get(daoId);
        if (!dao.isControlledBy(caller)) {
            throw new GovernanceException(GovernanceError.UNAUTHORIZED, caller + " does not control DAO " + daoId);
        }
        if (start <= 0) {
            throw new GovernanceException(GovernanceError.INVALID_ARGUMENT, "start must be positive");
        }
        if (end <= start) {
            throw new GovernanceException(GovernanceError.INVALID_ARGUMENT, "end must be after start");
        }
        if (quorum < 0) {
            throw new GovernanceException(GovernanceError.INVALID_ARGUMENT, "quorum must be zero or more");
        }
        String text = description == null ? "" : description;
        if (text.length() > MAX_DESCRIPTION_LENGTH) {
            throw new GovernanceException(GovernanceError.INVALID_ARGUMENT,
                    "description longer than " + MAX_DESCRIPTION_LENGTH + " characters");
        }

        Proposal proposal = new Proposal(proposalId, daoId, text, start, end, quorum);
        long now = TimeUtil.getCurrentUnixTime(clock);
        GovernanceEvent event = GovernanceEvent.of(EventType.PROPOSAL_CREATED, now)
                .withDao(daoId)
                .withProposal(proposalId)
                .withActor(caller)
                .with("start", start)
                .with("end", end)
                .with("quorum", quorum);
        if (!store.insertProposal(proposal, event)) {
            throw new GovernanceException(GovernanceError.DUPLICATE_PROPOSAL, "proposal " + proposalId + " already exists");
        }
        log.info("[ProposalStore] Created proposal " + proposalId + " for DAO " + daoId + " window [" + start + ", " + end + "]");
        eventLog.notifyCommitted(event);
        return new ProposalSnapshot(proposal, now);
    }

    /**
     * @throws GovernanceException {@code NOT_FOUND} if no such proposal
     */
    public ProposalSnapshot get(String proposalId) {
        Proposal proposal = proposalId == null ? null : store.getProposal(proposalId);
        if (proposal == null) {
            throw new GovernanceException(GovernanceError.NOT_FOUND, "proposal " + proposalId + " not found");
        }
        return new ProposalSnapshot(proposal, TimeUtil.getCurrentUnixTime(clock));
    }

    public ProposalState state(String proposalId) {
        return get(proposalId).getState();
    }

    /**
     * Proposals owned by a DAO, ordered by start time.
     */
    public List<ProposalSnapshot> listByDao(String daoId) {
        daoRegistry.get(daoId);
        long now = TimeUtil.getCurrentUnixTime(clock);
        List<ProposalSnapshot> out = new ArrayList<>();
        for (Proposal p : store.listProposalsByDao(daoId)) {
            out.add(new ProposalSnapshot(p, now));
        }
        return out;
    }

    /**
     * Mutable copy for the vote and finalization paths.
     *
     * @throws GovernanceException {@code PROPOSAL_NOT_FOUND} if no such proposal
     */
    Proposal load(String proposalId) {
        Proposal proposal = proposalId == null ? null : store.getProposal(proposalId);
        if (proposal == null) {
            throw new GovernanceException(GovernanceError.PROPOSAL_NOT_FOUND, "proposal " + proposalId + " not found");
        }
        return proposal;
    }
}
