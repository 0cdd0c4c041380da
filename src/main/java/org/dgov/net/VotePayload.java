package org.dgov.net;

import java.util.Objects;

public class VotePayload implements CrossChainPayload {
    private String proposalId;
    private Long weight;
    private String voter;

    public VotePayload(String proposalId, long weight, String voter) {
        this.proposalId = proposalId;
        this.weight = weight;
        this.voter = voter;
    }

    @Override
    public String getProposalId() {
        return proposalId;
    }

    public long getWeight() {
        return weight;
    }

    public String getVoter() {
        return voter;
    }

    @Override
    public String missingField() {
        if (proposalId == null) return "proposalId";
        if (weight == null) return "weight";
        if (voter == null) return "voter";
        return null;
    }

    @Override
    public String toString() {
        return "VotePayload{" +
                "proposalId='" + proposalId + '\'' +
                ", weight=" + weight +
                ", voter='" + voter + '\'' +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VotePayload that = (VotePayload) o;
        return Objects.equals(proposalId, that.proposalId) &&
                Objects.equals(weight, that.weight) &&
                Objects.equals(voter, that.voter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(proposalId, weight, voter);
    }
}
