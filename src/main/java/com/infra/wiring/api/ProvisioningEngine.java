package com.infra.wiring.api;

import com.infra.wiring.node.ResourceNode;

/**
 * Boundary to the component that actually creates remote resources.
 *
 * <p>
 * The wiring layer hands over fully declared nodes: identity, parent, draft
 * arguments (possibly holding Deferreds) and the complete dependency set. The
 * engine is expected to:
 * <ol>
 * <li>Provision a node only after every node in its dependency set.</li>
 * <li>Settle the node's {@link ResourceNode#outputs() outputs} exactly once,
 * failing them when provisioning fails.</li>
 * <li>Leave retries, if any, to itself; nothing above this boundary retries.</li>
 * </ol>
 */
public interface ProvisioningEngine {

    /**
     * Accepts a declared node for provisioning.
     *
     * @throws IllegalArgumentException if a node with the same identity is
     *                                  already registered.
     */
    void register(ResourceNode node);

    /**
     * Releases a node as part of its owner's teardown. Outputs that are still
     * pending must settle as cancelled.
     */
    void release(ResourceNode node);
}
