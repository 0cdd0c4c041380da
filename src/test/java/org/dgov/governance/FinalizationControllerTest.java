package org.dgov.governance;

import org.dgov.events.EventType;
import org.dgov.events.GovernanceEvent;
import org.dgov.support.GovernanceHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dgov.support.Fixtures.address;
import static org.dgov.support.Fixtures.id;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FinalizationControllerTest {

    private static final String CONTROLLER = address(0xc1);
    private static final String DAO = id(1);
    private static final String PROPOSAL = id(10);
    private static final String VOTER = address(0x51);

    private GovernanceHarness gov;

    @BeforeEach
    void setUp() {
        gov = new GovernanceHarness(50L);
        gov.registerDao(CONTROLLER, DAO, 100);
        gov.createProposal(CONTROLLER, DAO, PROPOSAL, 100, 200, 100);
        gov.enroll(VOTER, 500);
    }

    @Test
    void cannotFinalizeWhileVotingIsOpen() {
        gov.clock.setTime(200);

        assertEquals(GovernanceError.VOTING_STILL_ACTIVE, assertThrows(GovernanceException.class, () ->
                gov.finalization.finalize(PROPOSAL, CONTROLLER)).getError());
        assertEquals(ProposalState.ACTIVE, gov.proposals.state(PROPOSAL));
    }

    @Test
    void reachingQuorumPasses() {
        gov.clock.setTime(150);
        gov.votes.applyVote(PROPOSAL, VOTER, 100, VoteSource.local());
        gov.clock.setTime(201);

        ProposalSnapshot result = gov.finalization.finalize(PROPOSAL, CONTROLLER);

        assertEquals(ProposalState.FINALIZED, result.getState());
        assertEquals(Outcome.PASSED, result.getOutcome());
        assertEquals(Outcome.PASSED, gov.proposals.get(PROPOSAL).getOutcome());
    }

    @Test
    void missingQuorumIsRejectedOutcome() {
        gov.clock.setTime(150);
        gov.votes.applyVote(PROPOSAL, VOTER, 99, VoteSource.local());
        gov.clock.setTime(300);

        ProposalSnapshot result = gov.finalization.finalize(PROPOSAL, CONTROLLER);

        assertEquals(Outcome.REJECTED, result.getOutcome());
        assertEquals(99L, result.getTotalWeight());
    }

    @Test
    void secondFinalizeFailsAndChangesNothing() {
        gov.clock.setTime(250);
        gov.finalization.finalize(PROPOSAL, CONTROLLER);
        ProposalSnapshot before = gov.proposals.get(PROPOSAL);
        List<GovernanceEvent> eventsBefore = gov.eventLog.recent(Integer.MAX_VALUE);

        gov.clock.setTime(400);
        assertEquals(GovernanceError.ALREADY_FINALIZED, assertThrows(GovernanceException.class, () ->
                gov.finalization.finalize(PROPOSAL, CONTROLLER)).getError());
        assertEquals(GovernanceError.ALREADY_FINALIZED, assertThrows(GovernanceException.class, () ->
                gov.finalization.finalizeFromRemote(PROPOSAL, "chain-b")).getError());

        ProposalSnapshot after = gov.proposals.get(PROPOSAL);
        assertEquals(before.getOutcome(), after.getOutcome());
        assertEquals(before.getTotalWeight(), after.getTotalWeight());
        assertEquals(before.getVotes(), after.getVotes());
        assertEquals(eventsBefore, gov.eventLog.recent(Integer.MAX_VALUE));
    }

    @Test
    void onlyControllerFinalizesLocally() {
        gov.clock.setTime(250);

        assertEquals(GovernanceError.UNAUTHORIZED, assertThrows(GovernanceException.class, () ->
                gov.finalization.finalize(PROPOSAL, VOTER)).getError());
        assertEquals(ProposalState.ENDED, gov.proposals.state(PROPOSAL));
    }

    @Test
    void remoteFinalizeSkipsControllerCheck() {
        gov.clock.setTime(250);

        ProposalSnapshot result = gov.finalization.finalizeFromRemote(PROPOSAL, "chain-b");

        assertEquals(ProposalState.FINALIZED, result.getState());
        GovernanceEvent event = gov.eventLog.forProposal(PROPOSAL).stream()
                .filter(e -> e.getType() == EventType.PROPOSAL_FINALIZED)
                .findFirst()
                .orElseThrow();
        assertEquals("chain-b", event.attribute("source"));
        assertEquals("REJECTED", event.attribute("outcome"));
    }

    @Test
    void unknownProposalIsReported() {
        assertEquals(GovernanceError.PROPOSAL_NOT_FOUND, assertThrows(GovernanceException.class, () ->
                gov.finalization.finalize(id(99), CONTROLLER)).getError());
    }
}
