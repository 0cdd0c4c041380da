package org.dgov.governance;

import org.dgov.constants.ConfigKey;
import org.dgov.db.GovernanceStore;
import org.dgov.events.EventLog;
import org.dgov.events.EventType;
import org.dgov.events.GovernanceEvent;
import org.dgov.util.TimeUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * The administrator capability and the whitelist it manages. The
 * administrator identity is an address stored in the node config; every
 * gated operation is a plain comparison against it.
 */
public class AccessControl {

    private static final Logger log = LoggerFactory.getLogger(AccessControl.class);

    private final GovernanceStore store;
    private final EventLog eventLog;
    private final Clock clock;

    public AccessControl(GovernanceStore store, EventLog eventLog, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Sets the administrator on a fresh store. An existing administrator is kept.
     *
     * @return the administrator in effect afterwards
     */
    public String initialize(String administrator) {
        String current = administrator();
        if (current != null) {
            if (!current.equals(administrator)) {
                log.warn("[AccessControl] Administrator already set to " + current + "; ignoring " + administrator);
            }
            return current;
        }
        Identifiers.requireAddress(administrator, "administrator");
        store.putConfig(ConfigKey.ADMINISTRATOR.key(), administrator);
        log.info("[AccessControl] Administrator initialized: " + administrator);
        return administrator;
    }

    /**
     * @return the administrator address, or {@code null} before initialization
     */
    public String administrator() {
        return store.getConfig(ConfigKey.ADMINISTRATOR.key());
    }

    public boolean isAdministrator(String caller) {
        String admin = administrator();
        return admin != null && admin.equals(caller);
    }

    public void requireAdministrator(String caller) {
        if (!isAdministrator(caller)) {
            throw new GovernanceException(GovernanceError.UNAUTHORIZED, caller + " is not the administrator");
        }
    }

    public void setWhitelisted(String caller, String address, boolean whitelisted) {
        requireAdministrator(caller);
        Identifiers.requireAddress(address, "address");
        GovernanceEvent event = GovernanceEvent.of(EventType.WHITELIST_UPDATED, TimeUtil.getCurrentUnixTime(clock))
                .withActor(caller)
                .with("address", address)
                .with("whitelisted", whitelisted);
        store.setWhitelisted(address, whitelisted, event);
        eventLog.notifyCommitted(event);
    }
}
