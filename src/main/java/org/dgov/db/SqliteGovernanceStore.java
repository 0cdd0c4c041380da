package org.dgov.db;

import com.google.gson.reflect.TypeToken;
import org.dgov.constants.ConfigKey;
import org.dgov.events.EventType;
import org.dgov.events.GovernanceEvent;
import org.dgov.governance.Dao;
import org.dgov.governance.Outcome;
import org.dgov.governance.Proposal;
import org.dgov.util.ConversionUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Type;
import java.math.BigInteger;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * SQLite-backed {@link GovernanceStore}.
 * <p>
 * Readers run concurrently, writers are exclusive, and every mutation runs in
 * one explicit transaction, together with the event it carries, so a failure
 * rolls the whole call back. Uses WAL
 * mode and a busy timeout.
 */
public class SqliteGovernanceStore implements GovernanceStore {

    private static final Logger log = LoggerFactory.getLogger(SqliteGovernanceStore.class);
    private static final Type ATTRIBUTES_TYPE = new TypeToken<LinkedHashMap<String, String>>() {}.getType();

    private final String dbUrl;
    private final ReentrantReadWriteLock rwLock = new ReentrantReadWriteLock(true);

    public SqliteGovernanceStore(String dbFileName) {
        this.dbUrl = "jdbc:sqlite:" + dbFileName;
        withWrite(() -> {
            initializeDatabase();
            return null;
        });
    }

    // -------------------------------------------------------------------------
    // Locking and connection plumbing
    // -------------------------------------------------------------------------

    private <T> T withRead(SQLCallable<T> body) {
        rwLock.readLock().lock();
        try {
            return body.call();
        } catch (Exception e) {
            throw wrap(e);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    private <T> T withWrite(SQLCallable<T> body) {
        rwLock.writeLock().lock();
        try {
            return body.call();
        } catch (Exception e) {
            throw wrap(e);
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    /**
     * Runs {@code body} inside one transaction; commits on success, rolls back
     * on any exception.
     */
    private <T> T inTransaction(SQLFunction<T> body) {
        return withWrite(() -> {
            try (Connection conn = connect()) {
                conn.setAutoCommit(false);
                try {
                    T result = body.apply(conn);
                    conn.commit();
                    return result;
                } catch (Exception e) {
                    conn.rollback();
                    throw e;
                }
            }
        });
    }

    private RuntimeException wrap(Exception e) {
        if (e instanceof RuntimeException) {
            return (RuntimeException) e;
        }
        log.error("[SqliteGovernanceStore] " + e.getMessage());
        return new StoreException("SQLite operation failed: " + e.getMessage(), e);
    }

    private Connection connect() throws SQLException {
        Connection conn = DriverManager.getConnection(dbUrl);
        try (Statement s = conn.createStatement()) {
            s.execute("PRAGMA journal_mode=WAL;");
            s.execute("PRAGMA synchronous=NORMAL;");
            s.execute("PRAGMA foreign_keys=ON;");
            s.execute("PRAGMA busy_timeout=5000;");
        }
        return conn;
    }

    private void initializeDatabase() throws SQLException {
        String configStoreSql = """
                CREATE TABLE IF NOT EXISTS config_store (
                    key TEXT PRIMARY KEY,
                    value TEXT
                );""";

        String daosSql = """
                CREATE TABLE IF NOT EXISTS daos (
                    id TEXT PRIMARY KEY,
                    controller TEXT NOT NULL,
                    name TEXT NOT NULL,
                    description TEXT,
                    metadata_ref TEXT,
                    token_ref TEXT NOT NULL,
                    minimum_tokens TEXT NOT NULL,
                    created_at INTEGER NOT NULL
                );""";

        String proposalsSql = """
                CREATE TABLE IF NOT EXISTS proposals (
                    id TEXT PRIMARY KEY,
                    dao_id TEXT NOT NULL REFERENCES daos(id),
                    description TEXT,
                    start_time INTEGER NOT NULL,
                    end_time INTEGER NOT NULL,
                    quorum INTEGER NOT NULL,
                    total_weight INTEGER NOT NULL DEFAULT 0,
                    finalized INTEGER NOT NULL DEFAULT 0,
                    outcome TEXT,
                    finalized_at INTEGER NOT NULL DEFAULT 0
                );""";

        String proposalDaoIndex = "CREATE INDEX IF NOT EXISTS idx_proposals_dao ON proposals (dao_id);";

        String votesSql = """
                CREATE TABLE IF NOT EXISTS proposal_votes (
                    proposal_id TEXT NOT NULL REFERENCES proposals(id),
                    voter TEXT NOT NULL,
                    weight INTEGER NOT NULL,
                    PRIMARY KEY (proposal_id, voter)
                );""";

        String appliedSql = """
                CREATE TABLE IF NOT EXISTS applied_messages (
                    proposal_id TEXT NOT NULL REFERENCES proposals(id),
                    dedup_key TEXT NOT NULL,
                    PRIMARY KEY (proposal_id, dedup_key)
                );""";

        String whitelistSql = """
                CREATE TABLE IF NOT EXISTS whitelist (
                    address TEXT PRIMARY KEY
                );""";

        String trustedChainsSql = """
                CREATE TABLE IF NOT EXISTS trusted_chains (
                    chain_id TEXT PRIMARY KEY,
                    public_key TEXT NOT NULL
                );""";

        String eventsSql = """
                CREATE TABLE IF NOT EXISTS events (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    type TEXT NOT NULL,
                    timestamp INTEGER NOT NULL,
                    dao_id TEXT,
                    proposal_id TEXT,
                    actor TEXT,
                    attributes TEXT
                );""";

        String eventProposalIndex = "CREATE INDEX IF NOT EXISTS idx_events_proposal ON events (proposal_id);";

        try (Connection conn = connect(); Statement stmt = conn.createStatement()) {
            stmt.execute(configStoreSql);
            stmt.execute(daosSql);
            stmt.execute(proposalsSql);
            stmt.execute(proposalDaoIndex);
            stmt.execute(votesSql);
            stmt.execute(appliedSql);
            stmt.execute(whitelistSql);
            stmt.execute(trustedChainsSql);
            stmt.execute(eventsSql);
            stmt.execute(eventProposalIndex);
            log.info("[SqliteGovernanceStore] Database and tables initialized at " + dbUrl);
        }
    }

    // -------------------------------------------------------------------------
    // Config
    // -------------------------------------------------------------------------

    @Override
    public String getConfig(String key) {
        return withRead(() -> {
            try (Connection conn = connect()) {
                return readConfig(conn, key);
            }
        });
    }

    @Override
    public void putConfig(String key, String value) {
        inTransaction(conn -> {
            writeConfig(conn, key, value);
            return null;
        });
    }

    @Override
    public void putConfig(String key, String value, GovernanceEvent event) {
        inTransaction(conn -> {
            writeConfig(conn, key, value);
            insertEvent(conn, event);
            return null;
        });
    }

    private static String readConfig(Connection conn, String key) throws SQLException {
        try (PreparedStatement pstmt = conn.prepareStatement("SELECT value FROM config_store WHERE key = ?")) {
            pstmt.setString(1, key);
            try (ResultSet rs = pstmt.executeQuery()) {
                return rs.next() ? rs.getString("value") : null;
            }
        }
    }

    private static void writeConfig(Connection conn, String key, String value) throws SQLException {
        try (PreparedStatement pstmt = conn.prepareStatement(
                "INSERT OR REPLACE INTO config_store (key, value) VALUES (?, ?)")) {
            pstmt.setString(1, key);
            pstmt.setString(2, value);
            pstmt.executeUpdate();
        }
    }

    private static BigInteger readFees(Connection conn) throws SQLException {
        String value = readConfig(conn, ConfigKey.COLLECTED_FEES.key());
        return value == null ? BigInteger.ZERO : new BigInteger(value);
    }

    // -------------------------------------------------------------------------
    // DAOs and fees
    // -------------------------------------------------------------------------

    @Override
    public boolean insertDao(Dao dao, BigInteger feePaid, GovernanceEvent event) {
        return inTransaction(conn -> {
            String sql = """
                    INSERT OR IGNORE INTO daos
                        (id, controller, name, description, metadata_ref, token_ref, minimum_tokens, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?)""";
            try (PreparedStatement pstmt = conn.prepareStatement(sql)) {
                pstmt.setString(1, dao.getId());
                pstmt.setString(2, dao.getController());
                pstmt.setString(3, dao.getName());
                pstmt.setString(4, dao.getDescription());
                pstmt.setString(5, dao.getMetadataRef());
                pstmt.setString(6, dao.getTokenRef());
                pstmt.setString(7, dao.getMinimumTokens().toString());
                pstmt.setLong(8, dao.getCreatedAt());
                if (pstmt.executeUpdate() == 0) {
                    return false;
                }
            }
            writeConfig(conn, ConfigKey.COLLECTED_FEES.key(), readFees(conn).add(feePaid).toString());
            insertEvent(conn, event);
            return true;
        });
    }

    @Override
    public Dao getDao(String daoId) {
        return withRead(() -> {
            try (Connection conn = connect();
                 PreparedStatement pstmt = conn.prepareStatement("SELECT * FROM daos WHERE id = ?")) {
                pstmt.setString(1, daoId);
                try (ResultSet rs = pstmt.executeQuery()) {
                    if (!rs.next()) {
                        return null;
                    }
                    return new Dao(
                            rs.getString("id"),
                            rs.getString("controller"),
                            rs.getString("name"),
                            rs.getString("description"),
                            rs.getString("metadata_ref"),
                            rs.getString("token_ref"),
                            new BigInteger(rs.getString("minimum_tokens")),
                            rs.getLong("created_at"));
                }
            }
        });
    }

    @Override
    public boolean updateMinimumTokens(String daoId, BigInteger minimumTokens, GovernanceEvent event) {
        return inTransaction(conn -> {
            try (PreparedStatement pstmt = conn.prepareStatement("UPDATE daos SET minimum_tokens = ? WHERE id = ?")) {
                pstmt.setString(1, minimumTokens.toString());
                pstmt.setString(2, daoId);
                if (pstmt.executeUpdate() == 0) {
                    return false;
                }
            }
            insertEvent(conn, event);
            return true;
        });
    }

    @Override
    public BigInteger getCollectedFees() {
        return withRead(() -> {
            try (Connection conn = connect()) {
                return readFees(conn);
            }
        });
    }

    @Override
    public BigInteger withdrawCollectedFees(Function<BigInteger, GovernanceEvent> eventFor) {
        return inTransaction(conn -> {
            BigInteger collected = readFees(conn);
            writeConfig(conn, ConfigKey.COLLECTED_FEES.key(), BigInteger.ZERO.toString());
            insertEvent(conn, eventFor.apply(collected));
            return collected;
        });
    }

    // -------------------------------------------------------------------------
    // Proposals
    // -------------------------------------------------------------------------

    @Override
    public boolean insertProposal(Proposal proposal, GovernanceEvent event) {
        return inTransaction(conn -> {
            String sql = """
                    INSERT OR IGNORE INTO proposals
                        (id, dao_id, description, start_time, end_time, quorum)
                    VALUES (?, ?, ?, ?, ?, ?)""";
            try (PreparedStatement pstmt = conn.prepareStatement(sql)) {
                pstmt.setString(1, proposal.getId());
                pstmt.setString(2, proposal.getDaoId());
                pstmt.setString(3, proposal.getDescription());
                pstmt.setLong(4, proposal.getStartTime());
                pstmt.setLong(5, proposal.getEndTime());
                pstmt.setLong(6, proposal.getQuorum());
                if (pstmt.executeUpdate() == 0) {
                    return false;
                }
            }
            insertEvent(conn, event);
            return true;
        });
    }

    @Override
    public Proposal getProposal(String proposalId) {
        return withRead(() -> {
            try (Connection conn = connect();
                 PreparedStatement pstmt = conn.prepareStatement("SELECT * FROM proposals WHERE id = ?")) {
                pstmt.setString(1, proposalId);
                try (ResultSet rs = pstmt.executeQuery()) {
                    return rs.next() ? readProposal(conn, rs) : null;
                }
            }
        });
    }

    @Override
    public List<Proposal> listProposalsByDao(String daoId) {
        return withRead(() -> {
            List<Proposal> out = new ArrayList<>();
            try (Connection conn = connect();
                 PreparedStatement pstmt = conn.prepareStatement(
                         "SELECT * FROM proposals WHERE dao_id = ? ORDER BY start_time, id")) {
                pstmt.setString(1, daoId);
                try (ResultSet rs = pstmt.executeQuery()) {
                    while (rs.next()) {
                        out.add(readProposal(conn, rs));
                    }
                }
            }
            return out;
        });
    }

    private Proposal readProposal(Connection conn, ResultSet rs) throws SQLException {
        String id = rs.getString("id");
        Map<String, Long> votes = new LinkedHashMap<>();
        try (PreparedStatement pstmt = conn.prepareStatement(
                "SELECT voter, weight FROM proposal_votes WHERE proposal_id = ? ORDER BY rowid")) {
            pstmt.setString(1, id);
            try (ResultSet vrs = pstmt.executeQuery()) {
                while (vrs.next()) {
                    votes.put(vrs.getString("voter"), vrs.getLong("weight"));
                }
            }
        }
        String outcome = rs.getString("outcome");
        return new Proposal(
                id,
                rs.getString("dao_id"),
                rs.getString("description"),
                rs.getLong("start_time"),
                rs.getLong("end_time"),
                rs.getLong("quorum"),
                votes,
                rs.getLong("total_weight"),
                rs.getInt("finalized") == 1,
                outcome == null ? null : Outcome.valueOf(outcome),
                rs.getLong("finalized_at"));
    }

    @Override
    public boolean isMessageApplied(String proposalId, String dedupKey) {
        return withRead(() -> {
            try (Connection conn = connect()) {
                return isApplied(conn, proposalId, dedupKey);
            }
        });
    }

    private static boolean isApplied(Connection conn, String proposalId, String dedupKey) throws SQLException {
        try (PreparedStatement pstmt = conn.prepareStatement(
                "SELECT 1 FROM applied_messages WHERE proposal_id = ? AND dedup_key = ?")) {
            pstmt.setString(1, proposalId);
            pstmt.setString(2, dedupKey);
            try (ResultSet rs = pstmt.executeQuery()) {
                return rs.next();
            }
        }
    }

    @Override
    public boolean recordVote(String proposalId, String voter, long weight, String dedupKey,
                              GovernanceEvent event) {
        return inTransaction(conn -> {
            if (dedupKey != null && isApplied(conn, proposalId, dedupKey)) {
                return false;
            }
            try (PreparedStatement pstmt = conn.prepareStatement(
                    "UPDATE proposals SET total_weight = total_weight + ? WHERE id = ?")) {
                pstmt.setLong(1, weight);
                pstmt.setString(2, proposalId);
                if (pstmt.executeUpdate() == 0) {
                    return false;
                }
            }
            String upsert = """
                    INSERT INTO proposal_votes (proposal_id, voter, weight) VALUES (?, ?, ?)
                    ON CONFLICT (proposal_id, voter) DO UPDATE SET weight = weight + excluded.weight""";
            try (PreparedStatement pstmt = conn.prepareStatement(upsert)) {
                pstmt.setString(1, proposalId);
                pstmt.setString(2, voter);
                pstmt.setLong(3, weight);
                pstmt.executeUpdate();
            }
            if (dedupKey != null) {
                try (PreparedStatement pstmt = conn.prepareStatement(
                        "INSERT INTO applied_messages (proposal_id, dedup_key) VALUES (?, ?)")) {
                    pstmt.setString(1, proposalId);
                    pstmt.setString(2, dedupKey);
                    pstmt.executeUpdate();
                }
            }
            insertEvent(conn, event);
            return true;
        });
    }

    @Override
    public boolean markFinalized(String proposalId, Outcome outcome, long finalizedAt, GovernanceEvent event) {
        return inTransaction(conn -> {
            try (PreparedStatement pstmt = conn.prepareStatement(
                    "UPDATE proposals SET finalized = 1, outcome = ?, finalized_at = ? WHERE id = ? AND finalized = 0")) {
                pstmt.setString(1, outcome.name());
                pstmt.setLong(2, finalizedAt);
                pstmt.setString(3, proposalId);
                if (pstmt.executeUpdate() == 0) {
                    return false;
                }
            }
            insertEvent(conn, event);
            return true;
        });
    }

    // -------------------------------------------------------------------------
    // Whitelist and trusted chains
    // -------------------------------------------------------------------------

    @Override
    public boolean isWhitelisted(String address) {
        return withRead(() -> {
            try (Connection conn = connect();
                 PreparedStatement pstmt = conn.prepareStatement("SELECT 1 FROM whitelist WHERE address = ?")) {
                pstmt.setString(1, address);
                try (ResultSet rs = pstmt.executeQuery()) {
                    return rs.next();
                }
            }
        });
    }

    @Override
    public void setWhitelisted(String address, boolean whitelisted, GovernanceEvent event) {
        inTransaction(conn -> {
            String sql = whitelisted
                    ? "INSERT OR IGNORE INTO whitelist (address) VALUES (?)"
                    : "DELETE FROM whitelist WHERE address = ?";
            try (PreparedStatement pstmt = conn.prepareStatement(sql)) {
                pstmt.setString(1, address);
                pstmt.executeUpdate();
            }
            insertEvent(conn, event);
            return null;
        });
    }

    @Override
    public String getTrustedChainKey(String chainId) {
        return withRead(() -> {
            try (Connection conn = connect();
                 PreparedStatement pstmt = conn.prepareStatement(
                         "SELECT public_key FROM trusted_chains WHERE chain_id = ?")) {
                pstmt.setString(1, chainId);
                try (ResultSet rs = pstmt.executeQuery()) {
                    return rs.next() ? rs.getString("public_key") : null;
                }
            }
        });
    }

    @Override
    public void putTrustedChain(String chainId, String publicKey, GovernanceEvent event) {
        inTransaction(conn -> {
            try (PreparedStatement pstmt = conn.prepareStatement(
                    "INSERT OR REPLACE INTO trusted_chains (chain_id, public_key) VALUES (?, ?)")) {
                pstmt.setString(1, chainId);
                pstmt.setString(2, publicKey);
                pstmt.executeUpdate();
            }
            insertEvent(conn, event);
            return null;
        });
    }

    // -------------------------------------------------------------------------
    // Events
    // -------------------------------------------------------------------------

    @Override
    public void appendEvent(GovernanceEvent event) {
        inTransaction(conn -> {
            insertEvent(conn, event);
            return null;
        });
    }

    private static void insertEvent(Connection conn, GovernanceEvent event) throws SQLException {
        Objects.requireNonNull(event, "event must not be null");
        String sql = "INSERT INTO events (type, timestamp, dao_id, proposal_id, actor, attributes) VALUES (?,?,?,?,?,?)";
        try (PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setString(1, event.getType().name());
            pstmt.setLong(2, event.getTimestamp());
            pstmt.setString(3, event.getDaoId());
            pstmt.setString(4, event.getProposalId());
            pstmt.setString(5, event.getActor());
            pstmt.setString(6, ConversionUtil.toJson(event.getAttributes()));
            pstmt.executeUpdate();
        }
    }

    @Override
    public List<GovernanceEvent> listEvents(String proposalId, int limit) {
        return withRead(() -> {
            String inner = proposalId == null
                    ? "SELECT * FROM events ORDER BY id DESC LIMIT ?"
                    : "SELECT * FROM events WHERE proposal_id = ? ORDER BY id DESC LIMIT ?";
            String sql = "SELECT * FROM (" + inner + ") ORDER BY id ASC";
            List<GovernanceEvent> out = new ArrayList<>();
            try (Connection conn = connect(); PreparedStatement pstmt = conn.prepareStatement(sql)) {
                int idx = 1;
                if (proposalId != null) {
                    pstmt.setString(idx++, proposalId);
                }
                pstmt.setInt(idx, Math.max(0, limit));
                try (ResultSet rs = pstmt.executeQuery()) {
                    while (rs.next()) {
                        Map<String, String> attributes = ConversionUtil.fromJson(rs.getString("attributes"), ATTRIBUTES_TYPE);
                        out.add(new GovernanceEvent(
                                EventType.valueOf(rs.getString("type")),
                                rs.getLong("timestamp"),
                                rs.getString("dao_id"),
                                rs.getString("proposal_id"),
                                rs.getString("actor"),
                                attributes));
                    }
                }
            }
            return out;
        });
    }

    @Override
    public void close() {
        // Connections are opened per call; nothing is held between calls.
    }

    @FunctionalInterface
    private interface SQLCallable<T> {
        T call() throws Exception;
    }

    @FunctionalInterface
    private interface SQLFunction<T> {
        T apply(Connection conn) throws Exception;
    }
}
