package org.dgov.web.services.dao;

import org.dgov.chain.GovernanceChain;
import org.dgov.governance.Dao;
import org.dgov.web.services.Json;
import spark.Request;
import spark.Response;

import java.math.BigInteger;
import java.util.Map;

public class DaoHandler {

    private final GovernanceChain chain;

    public DaoHandler(GovernanceChain chain) {
        this.chain = chain;
    }

    // ================================
    // Register DAO
    // ================================
    public Object register(Request req, Response res) {
        CreateDaoRequest body = Json.body(req, CreateDaoRequest.class);
        Dao dao = chain.registerDao(
                body.caller,
                body.id,
                body.name,
                body.description,
                body.metadataRef,
                body.tokenRef,
                body.minimumTokens == null ? BigInteger.ZERO : body.minimumTokens,
                body.payment == null ? BigInteger.ZERO : body.payment
        );
        res.status(201);
        return dao;
    }

    public Object get(Request req, Response res) {
        return chain.getDao(req.params(":id"));
    }

    public Object setMinimumTokens(Request req, Response res) {
        MinimumTokensRequest body = Json.body(req, MinimumTokensRequest.class);
        chain.setMinimumTokens(body.caller, body.daoId, body.minimumTokens);
        return Map.of("status", "ok", "minimumTokens", body.minimumTokens.toString());
    }
}
