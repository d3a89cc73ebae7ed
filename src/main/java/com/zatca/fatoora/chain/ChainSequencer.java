package com.zatca.fatoora.chain;

import com.zatca.fatoora.crypto.InvoiceHashService;
import com.zatca.fatoora.exception.ChainIntegrityException;
import com.zatca.fatoora.model.ChainPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Hands out invoice chain positions, one organization at a time.
 *
 * <p>Reading the last hash, rendering the invoice, hashing it and recording
 * the new state run as one unit under a per-organization lock. The
 * repository's compare-and-set catches writers outside this process.
 * Organizations never wait on each other.
 *
 * <pre>{@code
 * ChainEntry entry = sequencer.append("org-1",
 *     position -> xmlBuilder.build(invoice.withChainPosition(position)));
 * }</pre>
 */
public class ChainSequencer {

    private static final Logger logger = LoggerFactory.getLogger(ChainSequencer.class);

    private final ChainStateRepository repository;
    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ChainSequencer() {
        this(new InMemoryChainStateRepository());
    }

    public ChainSequencer(ChainStateRepository repository) {
        this.repository = repository;
    }

    /**
     * Append one invoice to the organization's chain.
     *
     * <p>If {@code renderer} throws, the chain is left as it was and the
     * exception propagates.
     *
     * @param organizationId chain owner
     * @param renderer renders the invoice XML for the position it is given
     * @return the recorded entry
     * @throws ChainIntegrityException if the stored state moved during the append
     */
    public ChainEntry append(String organizationId, Function<ChainPosition, String> renderer) {
        ReentrantLock lock = locks.computeIfAbsent(organizationId, id -> new ReentrantLock());
        lock.lock();
        try {
            ChainState current = currentState(organizationId);
            ChainPosition position = current.nextPosition();

            String xml = renderer.apply(position);
            if (xml == null) {
                throw new IllegalStateException("Renderer returned no XML for " + position);
            }
            String invoiceHash = InvoiceHashService.hash(xml);

            ChainState next = current.advance(invoiceHash);
            if (!repository.compareAndSet(organizationId, current.getVersion(), next)) {
                throw new ChainIntegrityException(
                    "Chain for organization " + organizationId + " moved past version " + current.getVersion(),
                    ChainIntegrityException.VERSION_CONFLICT,
                    organizationId
                );
            }

            logger.debug("Organization {} chain advanced to ICV {}", organizationId, next.getLastIcv());
            return new ChainEntry(organizationId, position.getInvoiceCounterValue(),
                position.getPreviousInvoiceHash(), invoiceHash, xml);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Position the next append would take. Informational only; another
     * caller may take it first.
     */
    public ChainPosition peekNextPosition(String organizationId) {
        return currentState(organizationId).nextPosition();
    }

    public ChainState currentState(String organizationId) {
        return repository.find(organizationId).orElseGet(() -> ChainState.initial(organizationId));
    }
}
