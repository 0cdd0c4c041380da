package org.dgov.db;

import org.dgov.constants.ConfigKey;
import org.dgov.events.GovernanceEvent;
import org.dgov.governance.Dao;
import org.dgov.governance.Outcome;
import org.dgov.governance.Proposal;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Simple in-memory implementation of {@link GovernanceStore}. Every method is
 * synchronized, which makes each mutation atomic with respect to readers.
 * Mutations append their event before touching state, so a failed append
 * leaves the store as it was.
 */
public class InMemoryGovernanceStore implements GovernanceStore {

    private final Map<String, String> config = new HashMap<>();
    private final Map<String, Dao> daos = new HashMap<>();
    private final Map<String, Proposal> proposals = new HashMap<>();
    private final Map<String, Set<String>> appliedMessages = new HashMap<>();
    private final Set<String> whitelist = new HashSet<>();
    private final Map<String, String> trustedChains = new HashMap<>();
    private final List<GovernanceEvent> events = new ArrayList<>();

    @Override
    public synchronized String getConfig(String key) {
        return config.get(key);
    }

    @Override
    public synchronized void putConfig(String key, String value) {
        config.put(key, value);
    }

    @Override
    public synchronized void putConfig(String key, String value, GovernanceEvent event) {
        appendEvent(event);
        config.put(key, value);
    }

    @Override
    public synchronized boolean insertDao(Dao dao, BigInteger feePaid, GovernanceEvent event) {
        if (daos.containsKey(dao.getId())) {
            return false;
        }
        appendEvent(event);
        daos.put(dao.getId(), dao.copy());
        config.put(ConfigKey.COLLECTED_FEES.key(), getCollectedFees().add(feePaid).toString());
        return true;
    }

    @Override
    public synchronized Dao getDao(String daoId) {
        Dao dao = daos.get(daoId);
        return dao == null ? null : dao.copy();
    }

    @Override
    public synchronized boolean updateMinimumTokens(String daoId, BigInteger minimumTokens, GovernanceEvent event) {
        Dao dao = daos.get(daoId);
        if (dao == null) {
            return false;
        }
        appendEvent(event);
        dao.setMinimumTokens(minimumTokens);
        return true;
    }

    @Override
    public synchronized BigInteger getCollectedFees() {
        String value = config.get(ConfigKey.COLLECTED_FEES.key());
        return value == null ? BigInteger.ZERO : new BigInteger(value);
    }

    @Override
    public synchronized BigInteger withdrawCollectedFees(Function<BigInteger, GovernanceEvent> eventFor) {
        BigInteger collected = getCollectedFees();
        appendEvent(eventFor.apply(collected));
        config.put(ConfigKey.COLLECTED_FEES.key(), BigInteger.ZERO.toString());
        return collected;
    }

    @Override
    public synchronized boolean insertProposal(Proposal proposal, GovernanceEvent event) {
        if (proposals.containsKey(proposal.getId())) {
            return false;
        }
        appendEvent(event);
        proposals.put(proposal.getId(), proposal.copy());
        return true;
    }

    @Override
    public synchronized Proposal getProposal(String proposalId) {
        Proposal proposal = proposals.get(proposalId);
        return proposal == null ? null : proposal.copy();
    }

    @Override
    public synchronized List<Proposal> listProposalsByDao(String daoId) {
        List<Proposal> out = new ArrayList<>();
        for (Proposal p : proposals.values()) {
            if (p.getDaoId().equals(daoId)) {
                out.add(p.copy());
            }
        }
        out.sort((a, b) -> Long.compare(a.getStartTime(), b.getStartTime()));
        return out;
    }

    @Override
    public synchronized boolean isMessageApplied(String proposalId, String dedupKey) {
        return appliedMessages.getOrDefault(proposalId, Set.of()).contains(dedupKey);
    }

    @Override
    public synchronized boolean recordVote(String proposalId, String voter, long weight, String dedupKey,
                                           GovernanceEvent event) {
        Proposal proposal = proposals.get(proposalId);
        if (proposal == null) {
            return false;
        }
        if (dedupKey != null && isMessageApplied(proposalId, dedupKey)) {
            return false;
        }
        // Apply to a copy first so an overflow leaves the stored proposal untouched.
        Proposal updated = proposal.copy();
        updated.addVote(voter, weight);
        appendEvent(event);
        proposals.put(proposalId, updated);
        if (dedupKey != null) {
            appliedMessages.computeIfAbsent(proposalId, k -> new HashSet<>()).add(dedupKey);
        }
        return true;
    }

    @Override
    public synchronized boolean markFinalized(String proposalId, Outcome outcome, long finalizedAt,
                                              GovernanceEvent event) {
        Proposal proposal = proposals.get(proposalId);
        if (proposal == null || proposal.isFinalized()) {
            return false;
        }
        appendEvent(event);
        proposal.finalizeWith(outcome, finalizedAt);
        return true;
    }

    @Override
    public synchronized boolean isWhitelisted(String address) {
        return whitelist.contains(address);
    }

    @Override
    public synchronized void setWhitelisted(String address, boolean whitelisted, GovernanceEvent event) {
        appendEvent(event);
        if (whitelisted) {
            whitelist.add(address);
        } else {
            whitelist.remove(address);
        }
    }

    @Override
    public synchronized String getTrustedChainKey(String chainId) {
        return trustedChains.get(chainId);
    }

    @Override
    public synchronized void putTrustedChain(String chainId, String publicKey, GovernanceEvent event) {
        appendEvent(event);
        trustedChains.put(chainId, publicKey);
    }

    @Override
    public synchronized void appendEvent(GovernanceEvent event) {
        events.add(Objects.requireNonNull(event, "event must not be null"));
    }

    @Override
    public synchronized List<GovernanceEvent> listEvents(String proposalId, int limit) {
        List<GovernanceEvent> matching = new ArrayList<>();
        for (GovernanceEvent e : events) {
            if (proposalId == null || proposalId.equals(e.getProposalId())) {
                matching.add(e);
            }
        }
        int from = Math.max(0, matching.size() - Math.max(0, limit));
        return new ArrayList<>(matching.subList(from, matching.size()));
    }

    @Override
    public void close() {
        // nothing to release
    }
}
