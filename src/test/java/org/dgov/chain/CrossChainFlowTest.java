package org.dgov.chain;

import org.dgov.db.InMemoryGovernanceStore;
import org.dgov.events.EventType;
import org.dgov.events.GovernanceEvent;
import org.dgov.external.DefaultMembershipOracle;
import org.dgov.external.InMemoryTokenLedger;
import org.dgov.governance.GovernanceError;
import org.dgov.governance.GovernanceException;
import org.dgov.governance.Outcome;
import org.dgov.governance.ProposalSnapshot;
import org.dgov.governance.ProposalState;
import org.dgov.support.Fixtures;
import org.dgov.support.LoopbackNetwork;
import org.dgov.support.MutableClock;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.dgov.support.Fixtures.ADMIN;
import static org.dgov.support.Fixtures.TOKEN;
import static org.dgov.support.Fixtures.address;
import static org.dgov.support.Fixtures.id;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CrossChainFlowTest {

    private static final String CONTROLLER = address(0xc1);
    private static final String V1 = address(0x51);
    private static final String V2 = address(0x52);
    private static final String D1 = id(1);
    private static final String P1 = id(10);

    private MutableClock clock;
    private LoopbackNetwork network;
    private GovernanceChain chainA;
    private GovernanceChain chainB;
    private InMemoryTokenLedger ledgerB;

    @BeforeAll
    static void installProvider() {
        Fixtures.installProvider();
    }

    @BeforeEach
    void setUp() {
        clock = new MutableClock(50);
        network = new LoopbackNetwork();
        chainA = newChain("chain-a", new InMemoryTokenLedger());
        ledgerB = new InMemoryTokenLedger();
        chainB = newChain("chain-b", ledgerB);

        chainA.trustChain(ADMIN, "chain-b", chainB.getWallet().getEncodedPublicKey());
        chainB.trustChain(ADMIN, "chain-a", chainA.getWallet().getEncodedPublicKey());

        chainB.registerDao(CONTROLLER, D1, "D1", null, null, TOKEN, BigInteger.valueOf(100), BigInteger.ZERO);
        chainB.setWhitelisted(ADMIN, V1, true);
        chainB.setWhitelisted(ADMIN, V2, true);
        ledgerB.setBalance(TOKEN, V1, BigInteger.valueOf(150));
        ledgerB.setBalance(TOKEN, V2, BigInteger.valueOf(500));
    }

    private GovernanceChain newChain(String chainId, InMemoryTokenLedger ledger) {
        InMemoryGovernanceStore store = new InMemoryGovernanceStore();
        return new GovernanceChain(chainId, ADMIN, store, new DefaultMembershipOracle(store, ledger),
                network.endpoint(chainId), Fixtures.newWallet(), clock);
    }

    @Test
    void proposalVotedAndFinalizedFromAnotherChain() {
        chainA.sendCreateProposal(CONTROLLER, "chain-b", D1, P1, "remote", 100, 200, 120);
        network.deliverAll();
        assertEquals(ProposalState.PENDING, chainB.getProposalState(P1));

        clock.setTime(150);
        chainA.sendVote(V1, "chain-b", P1, 50);
        chainA.sendVote(V2, "chain-b", P1, 70);
        chainB.vote(V1, P1, 5);
        network.deliverAll();

        ProposalSnapshot tallied = chainB.getProposal(P1);
        assertEquals(125L, tallied.getTotalWeight());
        assertEquals(55L, tallied.weightOf(V1));
        assertEquals(70L, tallied.weightOf(V2));

        clock.setTime(201);
        chainA.sendFinalize(CONTROLLER, "chain-b", P1);
        network.deliverAll();

        ProposalSnapshot finalized = chainB.getProposal(P1);
        assertEquals(ProposalState.FINALIZED, finalized.getState());
        assertEquals(Outcome.PASSED, finalized.getOutcome());
    }

    @Test
    void redeliveredVoteIsCountedOnce() {
        chainB.createProposal(CONTROLLER, D1, P1, "local", 100, 200, 1000);
        clock.setTime(150);
        chainA.sendVote(V1, "chain-b", P1, 50);

        List<LoopbackNetwork.Delivery> sent = network.deliverAll();
        assertEquals(1, sent.size());
        network.deliver(sent.get(0));
        network.deliver(sent.get(0));

        assertEquals(50L, chainB.getProposal(P1).getTotalWeight());
        assertEquals(1L, chainB.proposalEvents(P1).stream()
                .filter(e -> e.getType() == EventType.VOTE_ACCEPTED)
                .count());
    }

    @Test
    void lateRemoteVoteIsRejectedOnDestination() {
        chainB.createProposal(CONTROLLER, D1, P1, "local", 100, 200, 1000);
        clock.setTime(150);
        chainA.sendVote(V1, "chain-b", P1, 50);

        clock.setTime(260);
        network.deliverAll();

        assertEquals(0L, chainB.getProposal(P1).getTotalWeight());
        GovernanceEvent last = lastEvent(chainB);
        assertEquals(EventType.CROSS_CHAIN_MESSAGE_REJECTED, last.getType());
        assertEquals("VOTING_NOT_ACTIVE", last.attribute("error"));
    }

    @Test
    void messagesFromUntrustedChainAreDropped() {
        GovernanceChain chainC = newChain("chain-c", new InMemoryTokenLedger());
        int before = chainB.recentEvents(Integer.MAX_VALUE).size();
        chainC.sendCreateProposal(CONTROLLER, "chain-b", D1, P1, "intruder", 100, 200, 1);
        network.deliverAll();

        assertEquals(GovernanceError.NOT_FOUND, assertThrows(GovernanceException.class, () ->
                chainB.getProposal(P1)).getError());
        assertEquals(before, chainB.recentEvents(Integer.MAX_VALUE).size());
    }

    @Test
    void failedDispatchDoesNotConsumeSequence() {
        chainB.createProposal(CONTROLLER, D1, P1, "local", 100, 200, 1000);
        clock.setTime(150);

        network.setDown(true);
        assertEquals(GovernanceError.DISPATCH_FAILED, assertThrows(GovernanceException.class, () ->
                chainA.sendVote(V1, "chain-b", P1, 50)).getError());
        assertTrue(network.inFlight().isEmpty());

        network.setDown(false);
        String messageId = chainA.sendVote(V1, "chain-b", P1, 50);
        GovernanceEvent dispatched = lastEvent(chainA);
        assertEquals(EventType.CROSS_CHAIN_VOTE_DISPATCHED, dispatched.getType());
        assertEquals("0", dispatched.attribute("sequence"));
        assertEquals(messageId, dispatched.attribute("messageId"));

        network.deliverAll();
        assertEquals(50L, chainB.getProposal(P1).getTotalWeight());
    }

    private static GovernanceEvent lastEvent(GovernanceChain chain) {
        List<GovernanceEvent> events = chain.recentEvents(1);
        return events.get(events.size() - 1);
    }
}
