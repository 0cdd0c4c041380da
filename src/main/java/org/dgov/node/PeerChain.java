package org.dgov.node;

import java.util.Objects;

/**
 * A remote chain this node exchanges messages with: where to reach it and
 * which key its messages must be signed with.
 */
public class PeerChain {
    private final String chainId;
    private final String host;
    private final int port;
    private final String publicKey;

    public PeerChain(String chainId, String host, int port, String publicKey) {
        this.chainId = chainId;
        this.host = host;
        this.port = port;
        this.publicKey = publicKey;
    }

    /**
     * Parses {@code chainId@host:port@base64PublicKey}.
     */
    public static PeerChain parse(String entry) {
        String[] parts = entry.split("@");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Peer must be chainId@host:port@publicKey: " + entry);
        }
        String address = parts[1];
        int colon = address.lastIndexOf(':');
        if (colon <= 0 || colon == address.length() - 1) {
            throw new IllegalArgumentException("Peer address must be host:port: " + address);
        }
        int port;
        try {
            port = Integer.parseInt(address.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid peer port in " + address, e);
        }
        if (parts[0].isBlank() || parts[2].isBlank()) {
            throw new IllegalArgumentException("Peer chain id and key must not be blank: " + entry);
        }
        return new PeerChain(parts[0].trim(), address.substring(0, colon), port, parts[2].trim());
    }

    public String getChainId() {
        return chainId;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getPublicKey() {
        return publicKey;
    }

    @Override
    public String toString() {
        return "PeerChain{" +
                "chainId='" + chainId + '\'' +
                ", host='" + host + '\'' +
                ", port=" + port +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        PeerChain that = (PeerChain) o;
        return port == that.port && Objects.equals(chainId, that.chainId) && Objects.equals(host, that.host)
                && Objects.equals(publicKey, that.publicKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(chainId, host, port, publicKey);
    }
}
