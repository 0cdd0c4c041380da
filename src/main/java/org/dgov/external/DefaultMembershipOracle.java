package org.dgov.external;

import org.dgov.db.GovernanceStore;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Whitelist answers from the chain's own store, balances from an external ledger.
 */
public class DefaultMembershipOracle implements MembershipOracle {

    private final GovernanceStore store;
    private final TokenLedger ledger;

    public DefaultMembershipOracle(GovernanceStore store, TokenLedger ledger) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
    }

    @Override
    public boolean isWhitelisted(String address) {
        return address != null && store.isWhitelisted(address);
    }

    @Override
    public BigInteger balanceOf(String token, String address) {
        BigInteger balance = ledger.balanceOf(token, address);
        return balance == null ? BigInteger.ZERO : balance;
    }
}
