package com.infra.wiring.wiring;

import com.infra.wiring.node.ResourceNode;

/**
 * A mutable holder for a provisioning request, used within the LMAX Disruptor
 * RingBuffer.
 *
 * Instances are pre-allocated when the ring buffer is built and reused; the
 * consumer clears the event once the request has been handed to the scheduler
 * so the ring buffer never pins a released node.
 */
public final class ProvisionEvent {
    private ResourceNode node;
    private long batch;
    private int topoIndex = -1;

    /**
     * Configures the event.
     *
     * @param node      Node to provision.
     * @param batch     Batch the node belongs to.
     * @param topoIndex Position of the node in the batch's provisioning order.
     */
    public void set(ResourceNode node, long batch, int topoIndex) {
        this.node = node;
        this.batch = batch;
        this.topoIndex = topoIndex;
    }

    public ResourceNode node() {
        return node;
    }

    public long batch() {
        return batch;
    }

    public int topoIndex() {
        return topoIndex;
    }

    public void clear() {
        node = null;
        batch = 0;
        topoIndex = -1;
    }
}
