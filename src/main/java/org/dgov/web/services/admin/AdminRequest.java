package org.dgov.web.services.admin;

import java.math.BigInteger;

public class AdminRequest {
    public String caller;

    // creation fee
    public BigInteger fee;

    // whitelist
    public String address;
    public boolean whitelisted;

    // trusted chains
    public String chainId;
    public String publicKey;
}
