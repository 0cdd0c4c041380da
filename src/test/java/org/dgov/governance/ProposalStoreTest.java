package org.dgov.governance;

import org.dgov.events.EventType;
import org.dgov.support.GovernanceHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dgov.support.Fixtures.address;
import static org.dgov.support.Fixtures.id;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProposalStoreTest {

    private static final String CONTROLLER = address(0xc1);
    private static final String DAO = id(1);

    private GovernanceHarness gov;

    @BeforeEach
    void setUp() {
        gov = new GovernanceHarness(50L);
        gov.registerDao(CONTROLLER, DAO, 100);
    }

    @Test
    void createStoresEmptyTallyAndBackReference() {
        ProposalSnapshot created = gov.proposals.create(CONTROLLER, DAO, id(10), "raise the fee", 100, 200, 1000);

        assertEquals(DAO, created.getDaoId());
        assertEquals(0L, created.getTotalWeight());
        assertTrue(created.getVotes().isEmpty());
        assertEquals(ProposalState.PENDING, created.getState());
        assertNull(created.getOutcome());

        ProposalSnapshot read = gov.proposals.get(id(10));
        assertEquals("raise the fee", read.getDescription());
        assertEquals(100L, read.getStartTime());
        assertEquals(200L, read.getEndTime());
        assertEquals(1000L, read.getQuorum());
        assertEquals(1, gov.count(EventType.PROPOSAL_CREATED));
    }

    @Test
    void duplicateIdIsRejectedWhateverTheOtherArguments() {
        gov.createProposal(CONTROLLER, DAO, id(10), 100, 200, 1000);

        GovernanceException e = assertThrows(GovernanceException.class, () ->
                gov.proposals.create(CONTROLLER, DAO, id(10), "different", 300, 400, 5));

        assertEquals(GovernanceError.DUPLICATE_PROPOSAL, e.getError());
        assertEquals(1000L, gov.proposals.get(id(10)).getQuorum());
        assertEquals(1, gov.count(EventType.PROPOSAL_CREATED));
    }

    @Test
    void proposalIdsAreUniqueAcrossDaos() {
        gov.registerDao(CONTROLLER, id(2), 0);
        gov.createProposal(CONTROLLER, DAO, id(10), 100, 200, 0);

        assertEquals(GovernanceError.DUPLICATE_PROPOSAL, assertThrows(GovernanceException.class, () ->
                gov.createProposal(CONTROLLER, id(2), id(10), 100, 200, 0)).getError());
    }

    @Test
    void onlyTheDaoControllerCreates() {
        assertEquals(GovernanceError.UNAUTHORIZED, assertThrows(GovernanceException.class, () ->
                gov.createProposal(address(0xc2), DAO, id(10), 100, 200, 0)).getError());
        assertEquals(GovernanceError.NOT_FOUND, assertThrows(GovernanceException.class, () ->
                gov.proposals.get(id(10))).getError());
    }

    @Test
    void unknownDaoIsReported() {
        assertEquals(GovernanceError.UNKNOWN_DAO, assertThrows(GovernanceException.class, () ->
                gov.createProposal(CONTROLLER, id(99), id(10), 100, 200, 0)).getError());
    }

    @Test
    void malformedWindowOrQuorumIsInvalidArgument() {
        assertEquals(GovernanceError.INVALID_ARGUMENT, assertThrows(GovernanceException.class, () ->
                gov.createProposal(CONTROLLER, DAO, id(10), 0, 200, 0)).getError());
        assertEquals(GovernanceError.INVALID_ARGUMENT, assertThrows(GovernanceException.class, () ->
                gov.createProposal(CONTROLLER, DAO, id(10), 200, 200, 0)).getError());
        assertEquals(GovernanceError.INVALID_ARGUMENT, assertThrows(GovernanceException.class, () ->
                gov.createProposal(CONTROLLER, DAO, id(10), 300, 200, 0)).getError());
        assertEquals(GovernanceError.INVALID_ARGUMENT, assertThrows(GovernanceException.class, () ->
                gov.createProposal(CONTROLLER, DAO, id(10), 100, 200, -1)).getError());
        assertEquals(GovernanceError.NOT_FOUND, assertThrows(GovernanceException.class, () ->
                gov.proposals.get(id(10))).getError());
    }

    @Test
    void stateFollowsTheClock() {
        gov.createProposal(CONTROLLER, DAO, id(10), 100, 200, 0);

        assertEquals(ProposalState.PENDING, gov.proposals.state(id(10)));
        gov.clock.setTime(100);
        assertEquals(ProposalState.ACTIVE, gov.proposals.state(id(10)));
        gov.clock.setTime(200);
        assertEquals(ProposalState.ACTIVE, gov.proposals.state(id(10)));
        gov.clock.setTime(201);
        assertEquals(ProposalState.ENDED, gov.proposals.state(id(10)));
    }

    @Test
    void listByDaoUsesStoredOwner() {
        gov.registerDao(CONTROLLER, id(2), 0);
        gov.createProposal(CONTROLLER, DAO, id(11), 300, 400, 0);
        gov.createProposal(CONTROLLER, id(2), id(12), 100, 200, 0);
        gov.createProposal(CONTROLLER, DAO, id(13), 100, 200, 0);

        List<ProposalSnapshot> listed = gov.proposals.listByDao(DAO);

        assertEquals(2, listed.size());
        assertEquals(id(13), listed.get(0).getId());
        assertEquals(id(11), listed.get(1).getId());
        assertEquals(GovernanceError.UNKNOWN_DAO, assertThrows(GovernanceException.class, () ->
                gov.proposals.listByDao(id(77))).getError());
    }
}
