package com.infra.wiring.resource;

import com.infra.wiring.node.ResourceNode;

import java.util.Objects;
import java.util.Set;

/**
 * Typed view over a declared {@link ResourceNode}.
 */
public abstract class ResourceHandle {
    private final ResourceNode node;

    protected ResourceHandle(ResourceNode node) {
        this.node = Objects.requireNonNull(node, "node");
    }

    public ResourceNode node() {
        return node;
    }

    public String identity() {
        return node.identity();
    }

    public Set<String> dependsOn() {
        return node.dependsOn();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + node.identity() + "]";
    }
}
