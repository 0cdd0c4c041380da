package org.dgov.net;

import java.util.Objects;

public class FinalizePayload implements CrossChainPayload {
    private String proposalId;

    public FinalizePayload(String proposalId) {
        this.proposalId = proposalId;
    }

    @Override
    public String getProposalId() {
        return proposalId;
    }

    @Override
    public String missingField() {
        return proposalId == null ? "proposalId" : null;
    }

    @Override
    public String toString() {
        return "FinalizePayload{proposalId='" + proposalId + "'}";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(proposalId, ((FinalizePayload) o).proposalId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(proposalId);
    }
}
