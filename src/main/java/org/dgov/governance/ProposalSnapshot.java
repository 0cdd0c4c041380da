package org.dgov.governance;

import java.util.Map;

/**
 * Read-only view of a proposal at the moment it was read.
 */
public class ProposalSnapshot {
    private final String id;
    private final String daoId;
    private final String description;
    private final long startTime;
    private final long endTime;
    private final long quorum;
    private final long totalWeight;
    private final Map<String, Long> votes;
    private final ProposalState state;
    private final Outcome outcome;

    public ProposalSnapshot(Proposal proposal, long now) {
        this.id = proposal.getId();
        this.daoId = proposal.getDaoId();
        this.description = proposal.getDescription();
        this.startTime = proposal.getStartTime();
        this.endTime = proposal.getEndTime();
        this.quorum = proposal.getQuorum();
        this.totalWeight = proposal.getTotalWeight();
        this.votes = Map.copyOf(proposal.getVotes());
        this.state = proposal.stateAt(now);
        this.outcome = proposal.getOutcome();
    }

    public String getId() {
        return id;
    }

    public String getDaoId() {
        return daoId;
    }

    public String getDescription() {
        return description;
    }

    public long getStartTime() {
        return startTime;
    }

    public long getEndTime() {
        return endTime;
    }

    public long getQuorum() {
        return quorum;
    }

    public long getTotalWeight() {
        return totalWeight;
    }

    public Map<String, Long> getVotes() {
        return votes;
    }

    public long weightOf(String voter) {
        return votes.getOrDefault(voter, 0L);
    }

    public ProposalState getState() {
        return state;
    }

    /**
     * @return the recorded outcome, or {@code null} before finalization
     */
    public Outcome getOutcome() {
        return outcome;
    }

    @Override
    public String toString() {
        return "ProposalSnapshot{" +
                "id='" + id + '\'' +
                ", state=" + state +
                ", totalWeight=" + totalWeight +
                ", quorum=" + quorum +
                ", outcome=" + outcome +
                '}';
    }
}
