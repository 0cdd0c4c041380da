package org.dgov.web.services.proposal;

public class VoteRequest {
    public String caller;
    public String proposalId;
    public long weight;
}
