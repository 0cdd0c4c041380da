package org.dgov.external;

import org.dgov.db.InMemoryGovernanceStore;
import org.dgov.events.EventType;
import org.dgov.events.GovernanceEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryTokenLedgerTest {

    private static final String HOLDER = "0000000000000000000000000000000000000051";

    @TempDir
    Path tempDir;

    @Test
    void loadsBalancesFromJson() throws Exception {
        Path file = tempDir.resolve("ledger.json");
        Files.writeString(file, "{\"gov-token\": {\"" + HOLDER + "\": \"100000000000000000000000\"}}",
                StandardCharsets.UTF_8);

        InMemoryTokenLedger ledger = InMemoryTokenLedger.load(file);

        assertEquals(new BigInteger("100000000000000000000000"), ledger.balanceOf("gov-token", HOLDER));
        assertEquals(BigInteger.ZERO, ledger.balanceOf("other-token", HOLDER));
    }

    @Test
    void negativeBalancesAreRefused() {
        InMemoryTokenLedger ledger = new InMemoryTokenLedger();

        assertThrows(IllegalArgumentException.class, () ->
                ledger.setBalance("gov-token", HOLDER, BigInteger.valueOf(-1)));
    }

    @Test
    void oracleCombinesWhitelistAndLedger() {
        InMemoryGovernanceStore store = new InMemoryGovernanceStore();
        InMemoryTokenLedger ledger = new InMemoryTokenLedger();
        ledger.setBalance("gov-token", HOLDER, BigInteger.TEN);
        DefaultMembershipOracle oracle = new DefaultMembershipOracle(store, ledger);

        assertFalse(oracle.isWhitelisted(HOLDER));
        store.setWhitelisted(HOLDER, true, GovernanceEvent.of(EventType.WHITELIST_UPDATED, 0L));
        assertTrue(oracle.isWhitelisted(HOLDER));
        assertEquals(BigInteger.TEN, oracle.balanceOf("gov-token", HOLDER));
    }
}
