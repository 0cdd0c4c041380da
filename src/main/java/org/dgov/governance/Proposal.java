package org.dgov.governance;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Stored state of one proposal. The per-voter tally is owned by the proposal
 * and {@code totalWeight} always equals the sum of its values.
 * <p>
 * Instances handed out by a store are copies; mutating one never touches
 * committed state.
 */
public class Proposal {
    private final String id;
    private final String daoId;
    private final String description;
    private final long startTime;
    private final long endTime;
    private final long quorum;
    private final Map<String, Long> votes;
    private long totalWeight;
    private boolean finalized;
    private Outcome outcome;
    private long finalizedAt;

    public Proposal(String id, String daoId, String description, long startTime, long endTime, long quorum) {
        this(id, daoId, description, startTime, endTime, quorum, new LinkedHashMap<>(), 0L, false, null, 0L);
    }

    public Proposal(String id, String daoId, String description, long startTime, long endTime, long quorum,
                    Map<String, Long> votes, long totalWeight, boolean finalized, Outcome outcome, long finalizedAt) {
        this.id = id;
        this.daoId = daoId;
        this.description = description;
        this.startTime = startTime;
        this.endTime = endTime;
        this.quorum = quorum;
        this.votes = new LinkedHashMap<>(votes);
        this.totalWeight = totalWeight;
        this.finalized = finalized;
        this.outcome = outcome;
        this.finalizedAt = finalizedAt;
    }

    /**
     * Adds weight to a voter's running total.
     *
     * @throws ArithmeticException if either total would overflow
     */
    public void addVote(String voter, long weight) {
        long newTotal = Math.addExact(totalWeight, weight);
        long newVoterWeight = Math.addExact(votes.getOrDefault(voter, 0L), weight);
        votes.put(voter, newVoterWeight);
        totalWeight = newTotal;
    }

    public void finalizeWith(Outcome outcome, long finalizedAt) {
        this.finalized = true;
        this.outcome = outcome;
        this.finalizedAt = finalizedAt;
    }

    public ProposalState stateAt(long now) {
        return ProposalState.of(now, startTime, endTime, finalized);
    }

    public long weightOf(String voter) {
        return votes.getOrDefault(voter, 0L);
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

    public Map<String, Long> getVotes() {
        return Collections.unmodifiableMap(votes);
    }

    public long getTotalWeight() {
        return totalWeight;
    }

    public boolean isFinalized() {
        return finalized;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public long getFinalizedAt() {
        return finalizedAt;
    }

    public Proposal copy() {
        return new Proposal(id, daoId, description, startTime, endTime, quorum,
                votes, totalWeight, finalized, outcome, finalizedAt);
    }

    @Override
    public String toString() {
        return "Proposal{" +
                "id='" + id + '\'' +
                ", daoId='" + daoId + '\'' +
                ", startTime=" + startTime +
                ", endTime=" + endTime +
                ", quorum=" + quorum +
                ", totalWeight=" + totalWeight +
                ", finalized=" + finalized +
                ", outcome=" + outcome +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Proposal that = (Proposal) o;
        return startTime == that.startTime &&
                endTime == that.endTime &&
                quorum == that.quorum &&
                totalWeight == that.totalWeight &&
                finalized == that.finalized &&
                finalizedAt == that.finalizedAt &&
                Objects.equals(id, that.id) &&
                Objects.equals(daoId, that.daoId) &&
                Objects.equals(description, that.description) &&
                Objects.equals(votes, that.votes) &&
                outcome == that.outcome;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, daoId, description, startTime, endTime, quorum, votes, totalWeight,
                finalized, outcome, finalizedAt);
    }
}
