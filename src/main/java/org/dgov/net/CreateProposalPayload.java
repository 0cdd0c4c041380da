package org.dgov.net;

import java.util.Objects;

public class CreateProposalPayload implements CrossChainPayload {
    private String daoId;
    private String proposalId;
    private String description;
    private Long start;
    private Long end;
    private Long quorum;

    public CreateProposalPayload(String daoId, String proposalId, String description, long start, long end, long quorum) {
        this.daoId = daoId;
        this.proposalId = proposalId;
        this.description = description;
        this.start = start;
        this.end = end;
        this.quorum = quorum;
    }

    public String getDaoId() {
        return daoId;
    }

    @Override
    public String getProposalId() {
        return proposalId;
    }

    public String getDescription() {
        return description;
    }

    public long getStart() {
        return start;
    }

    public long getEnd() {
        return end;
    }

    public long getQuorum() {
        return quorum;
    }

    @Override
    public String missingField() {
        if (daoId == null) return "daoId";
        if (proposalId == null) return "proposalId";
        if (start == null) return "start";
        if (end == null) return "end";
        if (quorum == null) return "quorum";
        return null;
    }

    @Override
    public String toString() {
        return "CreateProposalPayload{" +
                "daoId='" + daoId + '\'' +
                ", proposalId='" + proposalId + '\'' +
                ", start=" + start +
                ", end=" + end +
                ", quorum=" + quorum +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CreateProposalPayload that = (CreateProposalPayload) o;
        return Objects.equals(daoId, that.daoId) &&
                Objects.equals(proposalId, that.proposalId) &&
                Objects.equals(description, that.description) &&
                Objects.equals(start, that.start) &&
                Objects.equals(end, that.end) &&
                Objects.equals(quorum, that.quorum);
    }

    @Override
    public int hashCode() {
        return Objects.hash(daoId, proposalId, description, start, end, quorum);
    }
}
