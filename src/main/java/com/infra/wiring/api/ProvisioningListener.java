package com.infra.wiring.api;

import java.util.Map;

/**
 * Observability hook for a provisioning engine.
 *
 * Callbacks may arrive on any thread, including the thread that settled an
 * upstream resource. Implementations must be thread safe and cheap.
 */
public interface ProvisioningListener {

    /**
     * Called when a batch of registered nodes is handed to the scheduler.
     *
     * @param batch     Incrementing batch number.
     * @param nodeCount Number of nodes in the batch.
     */
    void onBatchStart(long batch, int nodeCount);

    /**
     * Called when a node's upstream resources and arguments are resolved and
     * creation begins.
     */
    void onProvisionStart(String identity);

    /**
     * Called after a node has been created and its outputs settled.
     *
     * @param identity      Node identity.
     * @param outputs       Output attributes reported for the node.
     * @param durationNanos Time from start to settlement.
     */
    void onProvisioned(String identity, Map<String, String> outputs, long durationNanos);

    /**
     * Called when a node fails, either on its own or because an upstream
     * resource failed.
     */
    void onProvisionError(String identity, Throwable error);

    /** Called when a node is released before its outputs settled. */
    void onCancelled(String identity);
}
