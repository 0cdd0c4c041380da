package org.dgov.external;

import java.math.BigInteger;

/**
 * Eligibility answers the governance core consumes but does not own.
 */
public interface MembershipOracle {

    boolean isWhitelisted(String address);

    /**
     * Balance of {@code token} held by {@code address}; zero when unknown.
     */
    BigInteger balanceOf(String token, String address);
}
