package org.dgov.events;

public interface EventListener {
    void onEvent(GovernanceEvent event);
}
