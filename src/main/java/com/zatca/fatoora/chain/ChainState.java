package com.zatca.fatoora.chain;

import com.zatca.fatoora.crypto.InvoiceHashService;
import com.zatca.fatoora.model.ChainPosition;

import java.util.Objects;

/**
 * Last link of an organization's invoice chain.
 *
 * <p>{@code version} increases by one with every recorded invoice and is
 * the optimistic-locking token for {@link ChainStateRepository#compareAndSet}.
 */
public final class ChainState {

    private final String organizationId;
    private final long lastIcv;
    private final String lastHash;
    private final long version;

    public ChainState(String organizationId, long lastIcv, String lastHash, long version) {
        this.organizationId = Objects.requireNonNull(organizationId, "organizationId");
        this.lastIcv = lastIcv;
        this.lastHash = Objects.requireNonNull(lastHash, "lastHash");
        this.version = version;
    }

    /**
     * State of an organization that has not issued any invoice yet.
     */
    public static ChainState initial(String organizationId) {
        return new ChainState(organizationId, 0, InvoiceHashService.INITIAL_HASH, 0);
    }

    /**
     * Position the next invoice takes.
     */
    public ChainPosition nextPosition() {
        return new ChainPosition(lastIcv + 1, lastHash);
    }

    /**
     * State after appending an invoice with the given hash.
     */
    public ChainState advance(String invoiceHash) {
        return new ChainState(organizationId, lastIcv + 1, invoiceHash, version + 1);
    }

    public String getOrganizationId() { return organizationId; }
    public long getLastIcv() { return lastIcv; }
    public String getLastHash() { return lastHash; }
    public long getVersion() { return version; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ChainState that = (ChainState) o;
        return lastIcv == that.lastIcv
            && version == that.version
            && organizationId.equals(that.organizationId)
            && lastHash.equals(that.lastHash);
    }

    @Override
    public int hashCode() {
        return Objects.hash(organizationId, lastIcv, lastHash, version);
    }

    @Override
    public String toString() {
        return "ChainState{organizationId='" + organizationId + "', lastIcv=" + lastIcv
            + ", lastHash='" + lastHash + "', version=" + version + '}';
    }
}
