package com.zatca.fatoora.chain;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local repository. Suitable for a single engine instance and tests.
 */
public class InMemoryChainStateRepository implements ChainStateRepository {

    private final ConcurrentMap<String, ChainState> states = new ConcurrentHashMap<>();

    @Override
    public Optional<ChainState> find(String organizationId) {
        return Optional.ofNullable(states.get(organizationId));
    }

    @Override
    public boolean compareAndSet(String organizationId, long expectedVersion, ChainState next) {
        boolean[] written = {false};
        states.compute(organizationId, (id, current) -> {
            long currentVersion = current != null ? current.getVersion() : 0;
            if (currentVersion != expectedVersion) {
                return current;
            }
            written[0] = true;
            return next;
        });
        return written[0];
    }
}
