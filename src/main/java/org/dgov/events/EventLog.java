package org.dgov.events;

import org.dgov.db.GovernanceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Durable audit trail. Events that describe a state change are written by the
 * store in the same commit as the change; this class then hands them to
 * in-process listeners. Events with no state change of their own go through
 * {@link #publish}.
 */
public class EventLog {

    private static final Logger log = LoggerFactory.getLogger(EventLog.class);

    private final GovernanceStore store;
    private final List<EventListener> listeners = new CopyOnWriteArrayList<>();

    public EventLog(GovernanceStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    public void addListener(EventListener listener) {
        listeners.add(listener);
    }

    /**
     * Appends an event that accompanies no state change, then notifies listeners.
     */
    public void publish(GovernanceEvent event) {
        store.appendEvent(event);
        notifyCommitted(event);
    }

    /**
     * Notifies listeners of an event the store has already committed.
     */
    public void notifyCommitted(GovernanceEvent event) {
        log.info("[EventLog] " + event.getType() + " dao=" + event.getDaoId() + " proposal=" + event.getProposalId());
        for (EventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("[EventLog] Listener " + listener.getClass().getSimpleName() + " failed: " + e.getMessage());
            }
        }
    }

    /**
     * Most recent events, newest last.
     */
    public List<GovernanceEvent> recent(int limit) {
        return store.listEvents(null, limit);
    }

    public List<GovernanceEvent> forProposal(String proposalId) {
        return store.listEvents(proposalId, Integer.MAX_VALUE);
    }
}
