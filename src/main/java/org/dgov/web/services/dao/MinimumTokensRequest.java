package org.dgov.web.services.dao;

import java.math.BigInteger;

public class MinimumTokensRequest {
    public String caller;
    public String daoId;
    public BigInteger minimumTokens;
}
