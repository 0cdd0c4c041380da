package org.dgov.db;

import org.dgov.events.GovernanceEvent;
import org.dgov.governance.Dao;
import org.dgov.governance.Outcome;
import org.dgov.governance.Proposal;

import java.math.BigInteger;
import java.util.List;
import java.util.function.Function;

/**
 * Pluggable persistence for one chain's governance state: DAO records and
 * proposals keyed by id, the whitelist, trusted remote chains, node config
 * and the event trail.
 * <p>
 * Every mutating method is atomic: it either applies completely or leaves the
 * store untouched. Governance mutations take the event that describes them
 * and append it in the same commit, so the event trail never disagrees with
 * the state. A mutation that returns false writes neither. Returned entities
 * are detached copies.
 */
public interface GovernanceStore extends AutoCloseable {

    String getConfig(String key);

    void putConfig(String key, String value);

    void putConfig(String key, String value, GovernanceEvent event);

    /**
     * Inserts a DAO record and credits {@code feePaid} to the collected fees
     * in the same commit.
     *
     * @return false if the id is already registered (nothing changes)
     */
    boolean insertDao(Dao dao, BigInteger feePaid, GovernanceEvent event);

    /**
     * @return the record, or {@code null} if unknown
     */
    Dao getDao(String daoId);

    boolean updateMinimumTokens(String daoId, BigInteger minimumTokens, GovernanceEvent event);

    BigInteger getCollectedFees();

    /**
     * Resets collected fees to zero.
     *
     * @param eventFor builds the event recorded with the withdrawal from the amount withdrawn
     * @return the amount that was collected
     */
    BigInteger withdrawCollectedFees(Function<BigInteger, GovernanceEvent> eventFor);

    /**
     * @return false if a proposal with this id already exists
     */
    boolean insertProposal(Proposal proposal, GovernanceEvent event);

    /**
     * @return the proposal including its tally, or {@code null} if unknown
     */
    Proposal getProposal(String proposalId);

    List<Proposal> listProposalsByDao(String daoId);

    boolean isMessageApplied(String proposalId, String dedupKey);

    /**
     * Adds {@code weight} to the voter's tally and to the proposal total. When
     * {@code dedupKey} is non-null it is recorded against the proposal in the
     * same commit.
     *
     * @return false if the dedup key was already recorded (nothing changes)
     */
    boolean recordVote(String proposalId, String voter, long weight, String dedupKey, GovernanceEvent event);

    /**
     * @return false if the proposal is unknown or already finalized
     */
    boolean markFinalized(String proposalId, Outcome outcome, long finalizedAt, GovernanceEvent event);

    boolean isWhitelisted(String address);

    void setWhitelisted(String address, boolean whitelisted, GovernanceEvent event);

    /**
     * @return Base64 public key trusted for the chain, or {@code null}
     */
    String getTrustedChainKey(String chainId);

    void putTrustedChain(String chainId, String publicKey, GovernanceEvent event);

    /**
     * Appends an event that accompanies no state change.
     */
    void appendEvent(GovernanceEvent event);

    /**
     * Events in insertion order, keeping the last {@code limit}.
     *
     * @param proposalId restricts to one proposal; {@code null} for all
     */
    List<GovernanceEvent> listEvents(String proposalId, int limit);

    @Override
    void close();
}
