package org.dgov.support;

import org.dgov.db.GovernanceStore;
import org.dgov.db.InMemoryGovernanceStore;
import org.dgov.events.EventLog;
import org.dgov.events.EventType;
import org.dgov.events.GovernanceEvent;
import org.dgov.external.DefaultMembershipOracle;
import org.dgov.external.InMemoryTokenLedger;
import org.dgov.governance.AccessControl;
import org.dgov.governance.Dao;
import org.dgov.governance.DaoRegistry;
import org.dgov.governance.FeeLedger;
import org.dgov.governance.FinalizationController;
import org.dgov.governance.ProposalSnapshot;
import org.dgov.governance.ProposalStore;
import org.dgov.governance.VoteAggregator;

import java.math.BigInteger;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The governance components of one chain wired over an in-memory store,
 * with an administrator already set.
 */
public class GovernanceHarness {

    public final MutableClock clock;
    public final GovernanceStore store;
    public final InMemoryTokenLedger ledger = new InMemoryTokenLedger();
    public final EventLog eventLog;
    public final AccessControl accessControl;
    public final FeeLedger feeLedger;
    public final DaoRegistry daoRegistry;
    public final ProposalStore proposals;
    public final VoteAggregator votes;
    public final FinalizationController finalization;

    public GovernanceHarness(long startTime) {
        this(new InMemoryGovernanceStore(), startTime);
    }

    public GovernanceHarness(GovernanceStore store, long startTime) {
        this.clock = new MutableClock(startTime);
        this.store = store;
        this.eventLog = new EventLog(store);
        this.accessControl = new AccessControl(store, eventLog, clock);
        this.feeLedger = new FeeLedger(store, accessControl, eventLog, clock);
        this.daoRegistry = new DaoRegistry(store, accessControl, eventLog, clock);
        this.proposals = new ProposalStore(store, daoRegistry, eventLog, clock);
        this.votes = new VoteAggregator(store, proposals, daoRegistry,
                new DefaultMembershipOracle(store, ledger), eventLog, clock);
        this.finalization = new FinalizationController(store, proposals, daoRegistry, eventLog, clock);
        accessControl.initialize(Fixtures.ADMIN);
    }

    public Dao registerDao(String controller, String daoId, long minimumTokens) {
        return daoRegistry.register(controller, daoId, "dao-" + daoId.substring(58), "test dao", null,
                Fixtures.TOKEN, BigInteger.valueOf(minimumTokens), BigInteger.ZERO);
    }

    public ProposalSnapshot createProposal(String controller, String daoId, String proposalId,
                                           long start, long end, long quorum) {
        return proposals.create(controller, daoId, proposalId, "proposal " + proposalId.substring(58),
                start, end, quorum);
    }

    /**
     * Whitelists {@code voter} and gives it {@code balance} of the test token.
     */
    public void enroll(String voter, long balance) {
        accessControl.setWhitelisted(Fixtures.ADMIN, voter, true);
        ledger.setBalance(Fixtures.TOKEN, voter, BigInteger.valueOf(balance));
    }

    public List<EventType> eventTypes() {
        return store.listEvents(null, Integer.MAX_VALUE).stream()
                .map(GovernanceEvent::getType)
                .collect(Collectors.toList());
    }

    public long count(EventType type) {
        return eventTypes().stream().filter(type::equals).count();
    }
}
