package org.dgov.web;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.dgov.chain.GovernanceChain;
import org.dgov.governance.GovernanceError;
import org.dgov.governance.GovernanceException;
import org.dgov.web.services.admin.AdminHandler;
import org.dgov.web.services.crosschain.CrossChainHandler;
import org.dgov.web.services.dao.DaoHandler;
import org.dgov.web.services.proposal.ProposalHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

import static spark.Spark.after;
import static spark.Spark.awaitInitialization;
import static spark.Spark.awaitStop;
import static spark.Spark.exception;
import static spark.Spark.get;
import static spark.Spark.ipAddress;
import static spark.Spark.notFound;
import static spark.Spark.port;
import static spark.Spark.post;
import static spark.Spark.stop;

/**
 * Operator HTTP API for one chain.
 *
 * <p>Routes map one-to-one onto {@link GovernanceChain} operations. The acting
 * address travels in the request body as {@code caller}; the API is meant to
 * be bound to a trusted interface.
 */
public final class WebServer {

    private static final Logger log = LoggerFactory.getLogger(WebServer.class);
    private static final Gson GSON = new Gson();

    private final GovernanceChain chain;
    private final String host;
    private final int port;

    public WebServer(GovernanceChain chain, String host, int port) {
        this.chain = chain;
        this.host = host;
        this.port = port;
    }

    public void start() {
        port(port);
        ipAddress(host);

        registerGlobalExceptionHandlers();
        registerRoutes();
        after((request, response) -> response.type("application/json"));

        awaitInitialization();
        log.info("[WebServer] Listening on http://" + host + ":" + port);
    }

    public void shutdown() {
        stop();
        awaitStop();
    }

    /**
     * HTTP status reported for a rejected operation.
     */
    public static int statusFor(GovernanceError error) {
        if (error == GovernanceError.NOT_FOUND
                || error == GovernanceError.PROPOSAL_NOT_FOUND
                || error == GovernanceError.UNKNOWN_DAO) {
            return 404;
        }
        switch (error.category()) {
            case AUTHORIZATION:
                return 403;
            case VALIDATION:
                return 400;
            case STATE:
                return 409;
            case ELIGIBILITY:
                return 403;
            case RESOURCE:
                return 402;
            case TRANSPORT:
                return 502;
            default:
                return 500;
        }
    }

    private void registerGlobalExceptionHandlers() {
        exception(GovernanceException.class, (error, request, response) -> {
            response.status(statusFor(error.getError()));
            response.type("application/json");
            response.body(GSON.toJson(Map.of(
                    "error", error.getError().name(),
                    "message", error.getMessage())));
        });

        exception(JsonParseException.class, (error, request, response) -> {
            response.status(400);
            response.type("application/json");
            response.body(GSON.toJson(Map.of("error", "Invalid JSON")));
        });

        exception(IllegalArgumentException.class, (error, request, response) -> {
            response.status(400);
            response.type("application/json");
            response.body(GSON.toJson(Map.of("error", String.valueOf(error.getMessage()))));
        });

        exception(Exception.class, (error, request, response) -> {
            log.error("[WebServer] " + request.requestMethod() + " " + request.pathInfo() + " failed", error);
            response.status(500);
            response.type("application/json");
            response.body(GSON.toJson(Map.of("error", "Internal server error")));
        });

        notFound((request, response) -> {
            response.type("application/json");
            return GSON.toJson(Map.of("error", "No route for " + request.pathInfo()));
        });
    }

    private void registerRoutes() {
        DaoHandler daoHandler = new DaoHandler(chain);
        post("/daos", daoHandler::register, GSON::toJson);
        get("/daos/:id", daoHandler::get, GSON::toJson);
        post("/daos/minimum-tokens", daoHandler::setMinimumTokens, GSON::toJson);

        ProposalHandler proposalHandler = new ProposalHandler(chain);
        post("/proposals", proposalHandler::create, GSON::toJson);
        get("/proposals/:id", proposalHandler::get, GSON::toJson);
        get("/daos/:id/proposals", proposalHandler::listByDao, GSON::toJson);
        post("/proposals/vote", proposalHandler::vote, GSON::toJson);
        post("/proposals/finalize", proposalHandler::finalizeProposal, GSON::toJson);

        CrossChainHandler crossChainHandler = new CrossChainHandler(chain);
        post("/crosschain/proposals", crossChainHandler::sendCreateProposal, GSON::toJson);
        post("/crosschain/votes", crossChainHandler::sendVote, GSON::toJson);
        post("/crosschain/finalize", crossChainHandler::sendFinalize, GSON::toJson);

        AdminHandler adminHandler = new AdminHandler(chain);
        post("/admin/creation-fee", adminHandler::setCreationFee, GSON::toJson);
        post("/admin/whitelist", adminHandler::setWhitelisted, GSON::toJson);
        post("/admin/withdraw", adminHandler::withdraw, GSON::toJson);
        post("/admin/trusted-chains", adminHandler::trustChain, GSON::toJson);
        get("/admin/status", adminHandler::status, GSON::toJson);
        get("/events", adminHandler::events, GSON::toJson);
    }
}
