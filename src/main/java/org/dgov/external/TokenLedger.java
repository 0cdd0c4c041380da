package org.dgov.external;

import java.math.BigInteger;

/**
 * Read access to an external token ledger.
 */
public interface TokenLedger {
    BigInteger balanceOf(String token, String address);
}
