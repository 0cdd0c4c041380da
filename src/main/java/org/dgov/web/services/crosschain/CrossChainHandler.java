package org.dgov.web.services.crosschain;

import org.dgov.chain.GovernanceChain;
import org.dgov.web.services.Json;
import spark.Request;
import spark.Response;

import java.util.Map;

/**
 * Outbound cross-chain requests. A 202 only means the transport accepted the
 * message; the remote chain applies or rejects it on its own.
 */
public class CrossChainHandler {

    private final GovernanceChain chain;

    public CrossChainHandler(GovernanceChain chain) {
        this.chain = chain;
    }

    public Object sendCreateProposal(Request req, Response res) {
        CrossChainRequest body = Json.body(req, CrossChainRequest.class);
        String messageId = chain.sendCreateProposal(body.caller, body.destinationChain, body.daoId,
                body.proposalId, body.description, body.start, body.end, body.quorum);
        return accepted(res, body, messageId);
    }

    public Object sendVote(Request req, Response res) {
        CrossChainRequest body = Json.body(req, CrossChainRequest.class);
        String messageId = chain.sendVote(body.caller, body.destinationChain, body.proposalId, body.weight);
        return accepted(res, body, messageId);
    }

    public Object sendFinalize(Request req, Response res) {
        CrossChainRequest body = Json.body(req, CrossChainRequest.class);
        String messageId = chain.sendFinalize(body.caller, body.destinationChain, body.proposalId);
        return accepted(res, body, messageId);
    }

    private Map<String, Object> accepted(Response res, CrossChainRequest body, String messageId) {
        res.status(202);
        return Map.of("status", "dispatched", "destinationChain", body.destinationChain, "messageId", messageId);
    }
}
