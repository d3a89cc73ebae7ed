package com.zatca.fatoora.chain;

import java.util.Optional;

/**
 * Storage for per-organization chain state.
 *
 * <p>Implementations backed by a database should map
 * {@link #compareAndSet} onto a conditional update on the version column,
 * so that several engine instances can share one chain.
 */
public interface ChainStateRepository {

    /**
     * @return the stored state, or empty if the organization has no invoices yet
     */
    Optional<ChainState> find(String organizationId);

    /**
     * Store {@code next} only if the stored version still equals
     * {@code expectedVersion}. An absent state counts as version 0.
     *
     * @return true if the state was written
     */
    boolean compareAndSet(String organizationId, long expectedVersion, ChainState next);
}
