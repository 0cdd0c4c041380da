package org.dgov.web.services.proposal;

public class CreateProposalRequest {
    public String caller;
    public String daoId;
    public String proposalId;
    public String description;
    public long start;
    public long end;
    public long quorum;
}
