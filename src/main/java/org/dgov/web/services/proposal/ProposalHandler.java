package org.dgov.web.services.proposal;

import org.dgov.chain.GovernanceChain;
import org.dgov.governance.ProposalSnapshot;
import org.dgov.web.services.Json;
import spark.Request;
import spark.Response;

import java.util.Map;

public class ProposalHandler {

    private final GovernanceChain chain;

    public ProposalHandler(GovernanceChain chain) {
        this.chain = chain;
    }

    public Object create(Request req, Response res) {
        CreateProposalRequest body = Json.body(req, CreateProposalRequest.class);
        ProposalSnapshot snapshot = chain.createProposal(
                body.caller,
                body.daoId,
                body.proposalId,
                body.description,
                body.start,
                body.end,
                body.quorum
        );
        res.status(201);
        return snapshot;
    }

    public Object get(Request req, Response res) {
        return chain.getProposal(req.params(":id"));
    }

    public Object listByDao(Request req, Response res) {
        return Map.of("proposals", chain.listProposals(req.params(":id")));
    }

    // ================================
    // Cast Vote
    // ================================
    public Object vote(Request req, Response res) {
        VoteRequest body = Json.body(req, VoteRequest.class);
        chain.vote(body.caller, body.proposalId, body.weight);
        ProposalSnapshot snapshot = chain.getProposal(body.proposalId);
        return Map.of(
                "status", "ok",
                "voterWeight", snapshot.weightOf(body.caller),
                "totalWeight", snapshot.getTotalWeight()
        );
    }

    public Object finalizeProposal(Request req, Response res) {
        FinalizeRequest body = Json.body(req, FinalizeRequest.class);
        return chain.finalizeProposal(body.caller, body.proposalId);
    }
}
