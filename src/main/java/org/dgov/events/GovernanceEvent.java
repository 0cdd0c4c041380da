package org.dgov.events;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One entry of the audit trail. Attributes hold the event-specific fields as
 * strings so the record serializes to a flat JSON object.
 */
public class GovernanceEvent {
    private final EventType type;
    private final long timestamp;
    private final String daoId;
    private final String proposalId;
    private final String actor;
    private final Map<String, String> attributes;

    public GovernanceEvent(EventType type, long timestamp, String daoId, String proposalId,
                           String actor, Map<String, String> attributes) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.timestamp = timestamp;
        this.daoId = daoId;
        this.proposalId = proposalId;
        this.actor = actor;
        this.attributes = attributes == null ? new LinkedHashMap<>() : new LinkedHashMap<>(attributes);
    }

    public static GovernanceEvent of(EventType type, long timestamp) {
        return new GovernanceEvent(type, timestamp, null, null, null, null);
    }

    public GovernanceEvent withDao(String daoId) {
        return new GovernanceEvent(type, timestamp, daoId, proposalId, actor, attributes);
    }

    public GovernanceEvent withProposal(String proposalId) {
        return new GovernanceEvent(type, timestamp, daoId, proposalId, actor, attributes);
    }

    public GovernanceEvent withActor(String actor) {
        return new GovernanceEvent(type, timestamp, daoId, proposalId, actor, attributes);
    }

    public GovernanceEvent with(String key, Object value) {
        Map<String, String> copy = new LinkedHashMap<>(attributes);
        copy.put(key, String.valueOf(value));
        return new GovernanceEvent(type, timestamp, daoId, proposalId, actor, copy);
    }

    public EventType getType() {
        return type;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public String getDaoId() {
        return daoId;
    }

    public String getProposalId() {
        return proposalId;
    }

    public String getActor() {
        return actor;
    }

    public Map<String, String> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public String attribute(String key) {
        return attributes.get(key);
    }

    @Override
    public String toString() {
        return "GovernanceEvent{" +
                "type=" + type +
                ", timestamp=" + timestamp +
                ", daoId='" + daoId + '\'' +
                ", proposalId='" + proposalId + '\'' +
                ", actor='" + actor + '\'' +
                ", attributes=" + attributes +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GovernanceEvent that = (GovernanceEvent) o;
        return timestamp == that.timestamp &&
                type == that.type &&
                Objects.equals(daoId, that.daoId) &&
                Objects.equals(proposalId, that.proposalId) &&
                Objects.equals(actor, that.actor) &&
                Objects.equals(attributes, that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, timestamp, daoId, proposalId, actor, attributes);
    }
}
