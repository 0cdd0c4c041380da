package org.dgov.node;

import org.dgov.constants.FileNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

/**
 * Static node configuration read at startup.
 * <p>
 * Values come from {@code node.properties} on the classpath, or from a file
 * given on the command line, and any key can be overridden with a JVM system
 * property of the same name ({@code -Dchain.id=chain-b}).
 */
public class NodeSettings {

    private static final Logger log = LoggerFactory.getLogger(NodeSettings.class);

    public static final String CHAIN_ID = "chain.id";
    public static final String DB_FILE = "db.file";
    public static final String TRANSPORT_PORT = "transport.port";
    public static final String WEB_HOST = "web.host";
    public static final String WEB_PORT = "web.port";
    public static final String ADMINISTRATOR = "administrator";
    public static final String CREATION_FEE = "creation.fee";
    public static final String PEERS = "peers";
    public static final String LEDGER_FILE = "ledger.file";

    private final Properties properties;

    public NodeSettings(Properties properties) {
        this.properties = new Properties();
        this.properties.putAll(properties);
        for (String name : System.getProperties().stringPropertyNames()) {
            if (this.properties.containsKey(name) || isKnownKey(name)) {
                this.properties.setProperty(name, System.getProperty(name));
            }
        }
    }

    /**
     * Loads from {@code file} when given, otherwise from the bundled defaults.
     */
    public static NodeSettings load(Path file) throws IOException {
        Properties props = new Properties();
        if (file != null) {
            try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                props.load(reader);
            }
            log.info("[NodeSettings] Loaded " + file.toAbsolutePath());
        } else {
            try (InputStream in = NodeSettings.class.getClassLoader().getResourceAsStream(FileNames.NODE_PROPERTIES)) {
                if (in != null) {
                    props.load(in);
                } else {
                    log.warn("[NodeSettings] " + FileNames.NODE_PROPERTIES + " not found on classpath, using defaults");
                }
            }
        }
        return new NodeSettings(props);
    }

    public String getChainId() {
        return require(CHAIN_ID);
    }

    public String getDbFile() {
        return properties.getProperty(DB_FILE, FileNames.GOVERNANCE_DB);
    }

    public int getTransportPort() {
        return getInt(TRANSPORT_PORT, 7070);
    }

    public String getWebHost() {
        return properties.getProperty(WEB_HOST, "127.0.0.1");
    }

    public int getWebPort() {
        return getInt(WEB_PORT, 8080);
    }

    public String getAdministrator() {
        return require(ADMINISTRATOR);
    }

    /**
     * @return the creation fee to apply on a fresh store, or {@code null} if unset
     */
    public BigInteger getCreationFee() {
        String value = trimmed(CREATION_FEE);
        if (value == null) {
            return null;
        }
        try {
            return new BigInteger(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(CREATION_FEE + " is not a number: " + value, e);
        }
    }

    public Path getLedgerFile() {
        String value = trimmed(LEDGER_FILE);
        return value == null ? null : Path.of(value);
    }

    /**
     * Remote chains from {@code peers}, a comma separated list of
     * {@code chainId@host:port@base64PublicKey}.
     */
    public List<PeerChain> getPeers() {
        String value = trimmed(PEERS);
        if (value == null) {
            return Collections.emptyList();
        }
        List<PeerChain> peers = new ArrayList<>();
        for (String entry : value.split(",")) {
            if (!entry.isBlank()) {
                peers.add(PeerChain.parse(entry.trim()));
            }
        }
        return peers;
    }

    public String get(String key) {
        return properties.getProperty(key);
    }

    private String require(String key) {
        String value = trimmed(key);
        if (value == null) {
            throw new IllegalArgumentException("Missing required setting: " + key);
        }
        return value;
    }

    private int getInt(String key, int defaultValue) {
        String value = trimmed(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: " + value, e);
        }
    }

    private String trimmed(String key) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    private static boolean isKnownKey(String name) {
        switch (name) {
            case CHAIN_ID:
            case DB_FILE:
            case TRANSPORT_PORT:
            case WEB_HOST:
            case WEB_PORT:
            case ADMINISTRATOR:
            case CREATION_FEE:
            case PEERS:
            case LEDGER_FILE:
                return true;
            default:
                return false;
        }
    }
}
