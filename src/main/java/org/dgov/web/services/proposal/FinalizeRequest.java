package org.dgov.web.services.proposal;

public class FinalizeRequest {
    public String caller;
    public String proposalId;
}
