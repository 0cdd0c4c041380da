package org.dgov.web.services.crosschain;

/**
 * Body shared by the three outbound routes; each reads only the fields its
 * message kind carries.
 */
public class CrossChainRequest {
    public String caller;
    public String destinationChain;
    public String daoId;
    public String proposalId;
    public String description;
    public long start;
    public long end;
    public long quorum;
    public long weight;
}
