package org.dgov.constants;

/**
 * Keys of the node-owned values kept in the store's {@code config_store} table.
 */
public enum ConfigKey {

    ADMINISTRATOR,
    CREATION_FEE,
    COLLECTED_FEES,

    // Chain identity
    PUBLIC_KEY,
    PRIVATE_KEY,

    // Cross-chain, suffixed with the destination chain id
    OUTBOUND_SEQUENCE;

    public String key() {
        return this.name();
    }

    /**
     * Key scoped to one qualifier, e.g. {@code OUTBOUND_SEQUENCE:chain-b}.
     */
    public String key(String qualifier) {
        return this.name() + ":" + qualifier;
    }

    @Override
    public String toString() {
        return name();
    }
}
