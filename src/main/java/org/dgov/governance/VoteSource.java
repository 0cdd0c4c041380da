package org.dgov.governance;

import java.util.Objects;

/**
 * Where a vote came from. Local votes carry no dedup key; remote votes carry
 * the source chain and the key under which the message is deduplicated.
 */
public final class VoteSource {

    private static final VoteSource LOCAL = new VoteSource(null, null);

    private final String chainId;
    private final String dedupKey;

    private VoteSource(String chainId, String dedupKey) {
        this.chainId = chainId;
        this.dedupKey = dedupKey;
    }

    public static VoteSource local() {
        return LOCAL;
    }

    public static VoteSource remote(String chainId, String dedupKey) {
        if (chainId == null || chainId.isBlank()) {
            throw new GovernanceException(GovernanceError.INVALID_ARGUMENT, "remote vote needs a source chain");
        }
        if (dedupKey == null || dedupKey.isBlank()) {
            throw new GovernanceException(GovernanceError.INVALID_ARGUMENT, "remote vote needs a dedup key");
        }
        return new VoteSource(chainId, dedupKey);
    }

    public boolean isRemote() {
        return chainId != null;
    }

    public String getChainId() {
        return chainId;
    }

    public String getDedupKey() {
        return dedupKey;
    }

    @Override
    public String toString() {
        return isRemote() ? "remote(" + chainId + ")" : "local";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VoteSource that = (VoteSource) o;
        return Objects.equals(chainId, that.chainId) && Objects.equals(dedupKey, that.dedupKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(chainId, dedupKey);
    }
}
