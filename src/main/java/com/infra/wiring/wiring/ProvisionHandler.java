package com.infra.wiring.wiring;

import com.infra.wiring.node.ResourceNode;
import com.lmax.disruptor.EventHandler;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Disruptor EventHandler that consumes ProvisionEvents and hands each node to
 * the engine's scheduler.
 *
 * Events arrive in provisioning order on a single consumer thread. Scheduling
 * only chains the node behind its upstream resources; it never waits for them,
 * so one slow resource does not hold up unrelated subgraphs.
 *
 * An exception while scheduling is reported against the node itself and never
 * rethrown, to keep the consumer thread alive for the rest of the batch.
 */
public final class ProvisionHandler implements EventHandler<ProvisionEvent> {
    private static final Logger log = LogManager.getLogger(ProvisionHandler.class);

    private final Scheduler scheduler;

    public ProvisionHandler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void onEvent(ProvisionEvent event, long sequence, boolean endOfBatch) {
        ResourceNode node = event.node();
        if (node == null) {
            log.error("Received empty provision event at sequence {}", sequence);
            return;
        }
        try {
            scheduler.schedule(node);
        } catch (RuntimeException e) {
            log.error("Error scheduling {} (batch {}, index {}): {}",
                    node.identity(), event.batch(), event.topoIndex(), e.getMessage(), e);
            scheduler.reject(node, e);
        } finally {
            event.clear();
        }
    }

    /**
     * Scheduling side of a provisioning engine.
     */
    public interface Scheduler {
        /** Chains provisioning of {@code node} behind its dependencies. */
        void schedule(ResourceNode node);

        /** Fails {@code node} because it could not be scheduled. */
        void reject(ResourceNode node, Throwable error);
    }
}
