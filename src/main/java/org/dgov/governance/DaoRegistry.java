package org.dgov.governance;

import org.dgov.constants.ConfigKey;
import org.dgov.db.GovernanceStore;
import org.dgov.events.EventLog;
import org.dgov.events.EventType;
import org.dgov.events.GovernanceEvent;
import org.dgov.util.TimeUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Clock;
import java.util.Objects;

/**
 * Append-only registry of DAOs.
 * <p>
 * Responsibilities:
 * - One record per identifier; the registering caller becomes the controller.
 * - Registration requires a payment of at least the current creation fee,
 *   which the registry keeps.
 * - Only a DAO's controller may change its minimum token threshold.
 * - Only the administrator may change the creation fee.
 */
public class DaoRegistry {

    private static final Logger log = LoggerFactory.getLogger(DaoRegistry.class);

    private final GovernanceStore store;
    private final AccessControl accessControl;
    private final EventLog eventLog;
    private final Clock clock;

    public DaoRegistry(GovernanceStore store, AccessControl accessControl, EventLog eventLog, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.accessControl = Objects.requireNonNull(accessControl, "accessControl must not be null");
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Registers a new DAO controlled by {@code caller}.
     *
     * @param payment amount attached to the call; retained in full when accepted
     * @return the stored record
     * @throws GovernanceException {@code DUPLICATE_ID}, {@code INSUFFICIENT_FEE}
     *                             or {@code INVALID_ARGUMENT}
     */
    public Dao register(String caller, String id, String name, String description,
                       String metadataRef, String tokenRef, BigInteger minimumTokens, BigInteger payment) {
        Identifiers.requireAddress(caller, "caller");
        Identifiers.requireId(id, "dao id");
        requireText(name, "name");
        requireText(tokenRef, "token reference");
        requireNonNegative(minimumTokens, "minimum tokens");
        requireNonNegative(payment, "payment");

        if (store.getDao(id) != null) {
            throw new GovernanceException(GovernanceError.DUPLICATE_ID, "DAO " + id + " already registered");
        }
        BigInteger fee = creationFee();
        if (payment.compareTo(fee) < 0) {
            throw new GovernanceException(GovernanceError.INSUFFICIENT_FEE,
                    "payment " + payment + " is below the creation fee " + fee);
        }

        long now = TimeUtil.getCurrentUnixTime(clock);
        Dao dao = new Dao(id, caller, name.trim(), description, metadataRef, tokenRef.trim(), minimumTokens, now);
        GovernanceEvent event = GovernanceEvent.of(EventType.DAO_CREATED, now)
                .withDao(id)
                .withActor(caller)
                .with("name", dao.getName())
                .with("tokenRef", dao.getTokenRef())
                .with("minimumTokens", minimumTokens)
                .with("fee", payment);
        if (!store.insertDao(dao, payment, event)) {
            throw new GovernanceException(GovernanceError.DUPLICATE_ID, "DAO " + id + " already registered");
        }
        log.info("[DaoRegistry] Registered DAO " + id + " controlled by " + caller);
        eventLog.notifyCommitted(event);
        return dao;
    }

    /**
     * @throws GovernanceException {@code UNKNOWN_DAO} or {@code UNAUTHORIZED}
     *                             unless {@code caller} controls the DAO
     */
    public void setMinimumTokens(String caller, String id, BigInteger newMinimum) {
        requireNonNegative(newMinimum, "minimum tokens");
        Dao dao = get(id);
        if (!dao.isControlledBy(caller)) {
            throw new GovernanceException(GovernanceError.UNAUTHORIZED, caller + " does not control DAO " + id);
        }
        GovernanceEvent event = GovernanceEvent.of(EventType.DAO_UPDATED, TimeUtil.getCurrentUnixTime(clock))
                .withDao(id)
                .withActor(caller)
                .with("previousMinimumTokens", dao.getMinimumTokens())
                .with("minimumTokens", newMinimum);
        if (!store.updateMinimumTokens(id, newMinimum, event)) {
            throw new GovernanceException(GovernanceError.UNKNOWN_DAO, "DAO " + id + " is not registered");
        }
        eventLog.notifyCommitted(event);
    }

    public void setCreationFee(String caller, BigInteger newFee) {
        accessControl.requireAdministrator(caller);
        requireNonNegative(newFee, "creation fee");
        BigInteger previous = creationFee();
        GovernanceEvent event = GovernanceEvent.of(EventType.CREATION_FEE_CHANGED, TimeUtil.getCurrentUnixTime(clock))
                .withActor(caller)
                .with("previousFee", previous)
                .with("fee", newFee);
        store.putConfig(ConfigKey.CREATION_FEE.key(), newFee.toString(), event);
        eventLog.notifyCommitted(event);
    }

    public BigInteger creationFee() {
        String value = store.getConfig(ConfigKey.CREATION_FEE.key());
        return value == null ? BigInteger.ZERO : new BigInteger(value);
    }

    /**
     * @throws GovernanceException {@code UNKNOWN_DAO} if the id is not registered
     */
    public Dao get(String id) {
        Dao dao = id == null ? null : store.getDao(id);
        if (dao == null) {
            throw new GovernanceException(GovernanceError.UNKNOWN_DAO, "DAO " + id + " is not registered");
        }
        return dao;
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new GovernanceException(GovernanceError.INVALID_ARGUMENT, field + " must not be blank");
        }
    }

    private static void requireNonNegative(BigInteger value, String field) {
        if (value == null || value.signum() < 0) {
            throw new GovernanceException(GovernanceError.INVALID_ARGUMENT, field + " must be zero or more");
        }
    }
}
