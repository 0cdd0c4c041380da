package org.dgov.governance;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A registered organization. Records are append-only; only the minimum token
 * threshold changes after registration.
 */
public class Dao {
    private final String id;
    private final String controller;
    private final String name;
    private final String description;
    private final String metadataRef;
    private final String tokenRef;
    private BigInteger minimumTokens;
    private final long createdAt;

    public Dao(String id, String controller, String name, String description,
               String metadataRef, String tokenRef, BigInteger minimumTokens, long createdAt) {
        this.id = id;
        this.controller = controller;
        this.name = name;
        this.description = description;
        this.metadataRef = metadataRef;
        this.tokenRef = tokenRef;
        this.minimumTokens = minimumTokens;
        this.createdAt = createdAt;
    }

    public String getId() {
        return id;
    }

    public String getController() {
        return controller;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getMetadataRef() {
        return metadataRef;
    }

    public String getTokenRef() {
        return tokenRef;
    }

    public BigInteger getMinimumTokens() {
        return minimumTokens;
    }

    public void setMinimumTokens(BigInteger minimumTokens) {
        this.minimumTokens = minimumTokens;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public boolean isControlledBy(String address) {
        return controller.equals(address);
    }

    public Dao copy() {
        return new Dao(id, controller, name, description, metadataRef, tokenRef, minimumTokens, createdAt);
    }

    @Override
    public String toString() {
        return "Dao{" +
                "id='" + id + '\'' +
                ", controller='" + controller + '\'' +
                ", name='" + name + '\'' +
                ", tokenRef='" + tokenRef + '\'' +
                ", minimumTokens=" + minimumTokens +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Dao dao = (Dao) o;
        return createdAt == dao.createdAt &&
                Objects.equals(id, dao.id) &&
                Objects.equals(controller, dao.controller) &&
                Objects.equals(name, dao.name) &&
                Objects.equals(description, dao.description) &&
                Objects.equals(metadataRef, dao.metadataRef) &&
                Objects.equals(tokenRef, dao.tokenRef) &&
                Objects.equals(minimumTokens, dao.minimumTokens);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, controller, name, description, metadataRef, tokenRef, minimumTokens, createdAt);
    }
}
