package org.dgov.web.services.dao;

import java.math.BigInteger;

public class CreateDaoRequest {
    public String caller;
    public String id;
    public String name;
    public String description;
    public String metadataRef;
    public String tokenRef;
    public BigInteger minimumTokens;
    public BigInteger payment;
}
