package org.dgov.governance;

import org.dgov.events.EventType;
import org.dgov.support.Fixtures;
import org.dgov.support.GovernanceHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.dgov.support.Fixtures.address;
import static org.dgov.support.Fixtures.id;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DaoRegistryTest {

    private static final String CONTROLLER = address(0xc1);
    private static final String OTHER = address(0xc2);

    private GovernanceHarness gov;

    @BeforeEach
    void setUp() {
        gov = new GovernanceHarness(1_000L);
    }

    @Test
    void registerStoresRecordWithCallerAsController() {
        Dao dao = gov.daoRegistry.register(CONTROLLER, id(1), "Treasury", "funds things", "ipfs://meta",
                Fixtures.TOKEN, BigInteger.valueOf(100), BigInteger.ZERO);

        assertEquals(CONTROLLER, dao.getController());
        assertEquals(dao, gov.daoRegistry.get(id(1)));
        assertEquals(BigInteger.valueOf(100), gov.daoRegistry.get(id(1)).getMinimumTokens());
        assertEquals(1_000L, dao.getCreatedAt());
        assertEquals(1, gov.count(EventType.DAO_CREATED));
    }

    @Test
    void duplicateIdIsRejectedAndOriginalKept() {
        gov.registerDao(CONTROLLER, id(1), 100);

        GovernanceException e = assertThrows(GovernanceException.class, () ->
                gov.daoRegistry.register(OTHER, id(1), "Copy", null, null, Fixtures.TOKEN,
                        BigInteger.ONE, BigInteger.ZERO));

        assertEquals(GovernanceError.DUPLICATE_ID, e.getError());
        assertEquals(CONTROLLER, gov.daoRegistry.get(id(1)).getController());
        assertEquals(1, gov.count(EventType.DAO_CREATED));
    }

    @Test
    void paymentBelowCreationFeeIsRejected() {
        gov.daoRegistry.setCreationFee(Fixtures.ADMIN, BigInteger.valueOf(50));

        GovernanceException e = assertThrows(GovernanceException.class, () ->
                gov.daoRegistry.register(CONTROLLER, id(1), "Poor", null, null, Fixtures.TOKEN,
                        BigInteger.ZERO, BigInteger.valueOf(49)));

        assertEquals(GovernanceError.INSUFFICIENT_FEE, e.getError());
        assertEquals(BigInteger.ZERO, gov.feeLedger.collected());
        assertThrows(GovernanceException.class, () -> gov.daoRegistry.get(id(1)));
    }

    @Test
    void acceptedPaymentIsRetainedInFull() {
        gov.daoRegistry.setCreationFee(Fixtures.ADMIN, BigInteger.valueOf(50));

        gov.daoRegistry.register(CONTROLLER, id(1), "A", null, null, Fixtures.TOKEN, BigInteger.ZERO, BigInteger.valueOf(50));
        gov.daoRegistry.register(CONTROLLER, id(2), "B", null, null, Fixtures.TOKEN, BigInteger.ZERO, BigInteger.valueOf(80));

        assertEquals(BigInteger.valueOf(130), gov.feeLedger.collected());
    }

    @Test
    void malformedInputIsInvalidArgument() {
        assertEquals(GovernanceError.INVALID_ARGUMENT, assertThrows(GovernanceException.class, () ->
                gov.daoRegistry.register(CONTROLLER, "not-an-id", "A", null, null, Fixtures.TOKEN,
                        BigInteger.ZERO, BigInteger.ZERO)).getError());
        assertEquals(GovernanceError.INVALID_ARGUMENT, assertThrows(GovernanceException.class, () ->
                gov.daoRegistry.register(address(0), id(3), "A", null, null, Fixtures.TOKEN,
                        BigInteger.ZERO, BigInteger.ZERO)).getError());
        assertEquals(GovernanceError.INVALID_ARGUMENT, assertThrows(GovernanceException.class, () ->
                gov.daoRegistry.register(CONTROLLER, id(3), "A", null, null, Fixtures.TOKEN,
                        BigInteger.valueOf(-1), BigInteger.ZERO)).getError());
    }

    @Test
    void onlyControllerChangesMinimumTokens() {
        gov.registerDao(CONTROLLER, id(1), 100);

        GovernanceException e = assertThrows(GovernanceException.class, () ->
                gov.daoRegistry.setMinimumTokens(OTHER, id(1), BigInteger.ONE));
        assertEquals(GovernanceError.UNAUTHORIZED, e.getError());
        assertEquals(BigInteger.valueOf(100), gov.daoRegistry.get(id(1)).getMinimumTokens());

        gov.daoRegistry.setMinimumTokens(CONTROLLER, id(1), BigInteger.valueOf(250));
        assertEquals(BigInteger.valueOf(250), gov.daoRegistry.get(id(1)).getMinimumTokens());
        assertTrue(gov.eventTypes().contains(EventType.DAO_UPDATED));
    }

    @Test
    void unknownDaoIsReported() {
        assertEquals(GovernanceError.UNKNOWN_DAO, assertThrows(GovernanceException.class, () ->
                gov.daoRegistry.setMinimumTokens(CONTROLLER, id(9), BigInteger.ONE)).getError());
        assertEquals(GovernanceError.UNKNOWN_DAO, assertThrows(GovernanceException.class, () ->
                gov.daoRegistry.get(id(9))).getError());
    }

    @Test
    void onlyAdministratorSetsCreationFee() {
        GovernanceException e = assertThrows(GovernanceException.class, () ->
                gov.daoRegistry.setCreationFee(CONTROLLER, BigInteger.TEN));

        assertEquals(GovernanceError.UNAUTHORIZED, e.getError());
        assertEquals(BigInteger.ZERO, gov.daoRegistry.creationFee());

        gov.daoRegistry.setCreationFee(Fixtures.ADMIN, BigInteger.TEN);
        assertEquals(BigInteger.TEN, gov.daoRegistry.creationFee());
        assertEquals(1, gov.count(EventType.CREATION_FEE_CHANGED));
    }
}
