package org.dgov.web.services.admin;

import org.dgov.chain.GovernanceChain;
import org.dgov.events.GovernanceEvent;
import org.dgov.web.services.Json;
import spark.Request;
import spark.Response;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class AdminHandler {

    private static final int DEFAULT_EVENT_LIMIT = 100;

    private final GovernanceChain chain;

    public AdminHandler(GovernanceChain chain) {
        this.chain = chain;
    }

    public Object setCreationFee(Request req, Response res) {
        AdminRequest body = Json.body(req, AdminRequest.class);
        chain.setCreationFee(body.caller, body.fee);
        return ok("creationFee", chain.getCreationFee().toString());
    }

    public Object setWhitelisted(Request req, Response res) {
        AdminRequest body = Json.body(req, AdminRequest.class);
        chain.setWhitelisted(body.caller, body.address, body.whitelisted);
        return ok("whitelisted", body.whitelisted);
    }

    public Object withdraw(Request req, Response res) {
        AdminRequest body = Json.body(req, AdminRequest.class);
        BigInteger amount = chain.withdrawFees(body.caller);
        return ok("withdrawn", amount.toString());
    }

    public Object trustChain(Request req, Response res) {
        AdminRequest body = Json.body(req, AdminRequest.class);
        chain.trustChain(body.caller, body.chainId, body.publicKey);
        return ok("chainId", body.chainId);
    }

    public Object status(Request req, Response res) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("chainId", chain.getChainId());
        out.put("address", chain.getWallet().getAddress());
        out.put("publicKey", chain.getWallet().getEncodedPublicKey());
        out.put("administrator", chain.getAdministrator());
        out.put("creationFee", chain.getCreationFee().toString());
        out.put("collectedFees", chain.getCollectedFees().toString());
        return out;
    }

    public Object events(Request req, Response res) {
        String proposalId = req.queryParams("proposalId");
        List<GovernanceEvent> events = (proposalId == null || proposalId.isBlank())
                ? chain.recentEvents(Json.intParam(req, "limit", DEFAULT_EVENT_LIMIT))
                : chain.proposalEvents(proposalId.trim());
        return Map.of("events", events);
    }

    private Map<String, Object> ok(String key, Object value) {
        return Map.of("status", "ok", key, value);
    }
}
