package org.dgov.chain;

import org.dgov.db.GovernanceStore;
import org.dgov.events.EventListener;
import org.dgov.events.EventLog;
import org.dgov.events.GovernanceEvent;
import org.dgov.external.MembershipOracle;
import org.dgov.governance.AccessControl;
import org.dgov.governance.Dao;
import org.dgov.governance.DaoRegistry;
import org.dgov.governance.FeeLedger;
import org.dgov.governance.FinalizationController;
import org.dgov.governance.ProposalSnapshot;
import org.dgov.governance.ProposalState;
import org.dgov.governance.ProposalStore;
import org.dgov.governance.VoteAggregator;
import org.dgov.governance.VoteSource;
import org.dgov.net.CrossChainDispatcher;
import org.dgov.net.CrossChainSender;
import org.dgov.net.EnvelopeCodec;
import org.dgov.net.MessageHandler;
import org.dgov.net.MessageTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * One chain's governance instance.
 * <p>
 * Owns the registry, proposals, vote aggregation, finalization and the
 * cross-chain endpoints, all over a single store. Every mutation, local or
 * delivered by the transport, runs under the write lock, so operations on
 * this chain are applied one at a time. Queries share the read lock.
 */
public class GovernanceChain implements MessageHandler {

    private static final Logger log = LoggerFactory.getLogger(GovernanceChain.class);

    private final String chainId;
    private final Wallet wallet;
    private final GovernanceStore store;
    private final EventLog eventLog;
    private final AccessControl accessControl;
    private final FeeLedger feeLedger;
    private final DaoRegistry daoRegistry;
    private final ProposalStore proposals;
    private final VoteAggregator votes;
    private final FinalizationController finalization;
    private final CrossChainSender sender;
    private final CrossChainDispatcher dispatcher;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);

    public GovernanceChain(String chainId, String administrator, GovernanceStore store, MembershipOracle oracle,
                           MessageTransport transport, Wallet wallet, Clock clock) {
        this.chainId = Objects.requireNonNull(chainId, "chainId must not be null");
        this.wallet = Objects.requireNonNull(wallet, "wallet must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        Objects.requireNonNull(oracle, "oracle must not be null");
        Objects.requireNonNull(transport, "transport must not be null");
        Objects.requireNonNull(clock, "clock must not be null");

        this.eventLog = new EventLog(store);
        this.accessControl = new AccessControl(store, eventLog, clock);
        this.feeLedger = new FeeLedger(store, accessControl, eventLog, clock);
        this.daoRegistry = new DaoRegistry(store, accessControl, eventLog, clock);
        this.proposals = new ProposalStore(store, daoRegistry, eventLog, clock);
        this.votes = new VoteAggregator(store, proposals, daoRegistry, oracle, eventLog, clock);
        this.finalization = new FinalizationController(store, proposals, daoRegistry, eventLog, clock);

        EnvelopeCodec codec = new EnvelopeCodec(chainId, wallet);
        this.sender = new CrossChainSender(codec, transport, store, eventLog, clock);
        this.dispatcher = new CrossChainDispatcher(codec, store, accessControl, proposals, votes, finalization,
                eventLog, clock);

        accessControl.initialize(administrator);
        transport.registerHandler(this);
        log.info("[GovernanceChain] Chain " + chainId + " ready, signing as " + wallet.getAddress());
    }

    // ---------------------------------------------------------------------
    //                         DAO REGISTRY
    // ---------------------------------------------------------------------

    public Dao registerDao(String caller, String id, String name, String description, String metadataRef,
                           String tokenRef, BigInteger minimumTokens, BigInteger payment) {
        return write(() -> daoRegistry.register(caller, id, name, description, metadataRef, tokenRef,
                minimumTokens, payment));
    }

    public Dao getDao(String id) {
        return read(() -> daoRegistry.get(id));
    }

    public void setMinimumTokens(String caller, String daoId, BigInteger minimumTokens) {
        write(() -> {
            daoRegistry.setMinimumTokens(caller, daoId, minimumTokens);
            return null;
        });
    }

    public void setCreationFee(String caller, BigInteger fee) {
        write(() -> {
            daoRegistry.setCreationFee(caller, fee);
            return null;
        });
    }

    public BigInteger getCreationFee() {
        return read(daoRegistry::creationFee);
    }

    // ---------------------------------------------------------------------
    //                         PROPOSALS & VOTING
    // ---------------------------------------------------------------------

    public ProposalSnapshot createProposal(String caller, String daoId, String proposalId, String description,
                                           long start, long end, long quorum) {
        return write(() -> proposals.create(caller, daoId, proposalId, description, start, end, quorum));
    }

    public ProposalSnapshot getProposal(String proposalId) {
        return read(() -> proposals.get(proposalId));
    }

    public ProposalState getProposalState(String proposalId) {
        return read(() -> proposals.state(proposalId));
    }

    public List<ProposalSnapshot> listProposals(String daoId) {
        return read(() -> proposals.listByDao(daoId));
    }

    public boolean vote(String voter, String proposalId, long weight) {
        return write(() -> votes.applyVote(proposalId, voter, weight, VoteSource.local()));
    }

    public ProposalSnapshot finalizeProposal(String caller, String proposalId) {
        return write(() -> finalization.finalize(proposalId, caller));
    }

    // ---------------------------------------------------------------------
    //                         CROSS-CHAIN
    // ---------------------------------------------------------------------

    public String sendCreateProposal(String caller, String destinationChain, String daoId, String proposalId,
                                     String description, long start, long end, long quorum) {
        return write(() -> sender.sendCreateProposal(caller, destinationChain, daoId, proposalId, description,
                start, end, quorum));
    }

    public String sendVote(String caller, String destinationChain, String proposalId, long weight) {
        return write(() -> sender.sendVote(caller, destinationChain, proposalId, weight));
    }

    public String sendFinalize(String caller, String destinationChain, String proposalId) {
        return write(() -> sender.sendFinalize(caller, destinationChain, proposalId));
    }

    public void trustChain(String caller, String remoteChainId, String publicKey) {
        write(() -> {
            dispatcher.trustChain(caller, remoteChainId, publicKey);
            return null;
        });
    }

    /**
     * Transport callback. Never throws; rejections end up in the event log.
     */
    @Override
    public void onMessage(byte[] payload) {
        write(() -> {
            dispatcher.onMessage(payload);
            return null;
        });
    }

    // ---------------------------------------------------------------------
    //                         ADMINISTRATION
    // ---------------------------------------------------------------------

    public void setWhitelisted(String caller, String address, boolean whitelisted) {
        write(() -> {
            accessControl.setWhitelisted(caller, address, whitelisted);
            return null;
        });
    }

    public BigInteger withdrawFees(String caller) {
        return write(() -> feeLedger.withdraw(caller));
    }

    public BigInteger getCollectedFees() {
        return read(feeLedger::collected);
    }

    public String getAdministrator() {
        return read(accessControl::administrator);
    }

    // ---------------------------------------------------------------------
    //                         EVENTS
    // ---------------------------------------------------------------------

    public List<GovernanceEvent> recentEvents(int limit) {
        return read(() -> eventLog.recent(limit));
    }

    public List<GovernanceEvent> proposalEvents(String proposalId) {
        return read(() -> eventLog.forProposal(proposalId));
    }

    public void addEventListener(EventListener listener) {
        eventLog.addListener(listener);
    }

    public String getChainId() {
        return chainId;
    }

    public Wallet getWallet() {
        return wallet;
    }

    public GovernanceStore getStore() {
        return store;
    }

    private <T> T write(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }
}
