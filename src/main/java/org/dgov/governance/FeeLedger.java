package org.dgov.governance;

import org.dgov.db.GovernanceStore;
import org.dgov.events.EventLog;
import org.dgov.events.EventType;
import org.dgov.events.GovernanceEvent;
import org.dgov.util.TimeUtil;

import java.math.BigInteger;
import java.time.Clock;
import java.util.Objects;

/**
 * Payments retained by the registry. Fees are credited by the store in the
 * same commit as the registration that paid them; only the administrator
 * can drain them.
 */
public class FeeLedger {

    private final GovernanceStore store;
    private final AccessControl accessControl;
    private final EventLog eventLog;
    private final Clock clock;

    public FeeLedger(GovernanceStore store, AccessControl accessControl, EventLog eventLog, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.accessControl = Objects.requireNonNull(accessControl, "accessControl must not be null");
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public BigInteger collected() {
        return store.getCollectedFees();
    }

    /**
     * @return the amount paid out to the administrator
     */
    public BigInteger withdraw(String caller) {
        accessControl.requireAdministrator(caller);
        GovernanceEvent withdrawn = GovernanceEvent.of(EventType.FEES_WITHDRAWN, TimeUtil.getCurrentUnixTime(clock))
                .withActor(caller);
        BigInteger amount = store.withdrawCollectedFees(collected -> withdrawn.with("amount", collected));
        eventLog.notifyCommitted(withdrawn.with("amount", amount));
        return amount;
    }
}
