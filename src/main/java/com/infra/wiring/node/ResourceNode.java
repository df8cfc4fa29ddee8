package com.infra.wiring.node;

import com.infra.wiring.api.ResourceParent;
import com.infra.wiring.value.Deferred;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A declared remote resource.
 *
 * Nodes are immutable: identity, kind, merged draft arguments and the
 * dependency set are fixed when the node is declared. The only thing that
 * changes afterwards is the settlement of its {@link ResourceOutputs}, which
 * belongs to the provisioning engine.
 *
 * The dependency set always covers every Deferred reachable from
 * {@link #args()}; it may additionally hold explicit, non-data dependencies.
 */
public final class ResourceNode {
    private final String identity;
    private final ResourceKind kind;
    private final ResourceParent parent;
    private final ResourceArgs args;
    private final Set<String> dependsOn;
    private final ResourceOutputs outputs;

    public ResourceNode(String identity, ResourceKind kind, ResourceParent parent, ResourceArgs args,
            Set<String> explicitDependencies) {
        this.identity = Objects.requireNonNull(identity, "identity");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.parent = parent;
        this.args = Objects.requireNonNull(args, "args");

        Set<String> deps = new LinkedHashSet<>(args.dependencies());
        if (explicitDependencies != null)
            deps.addAll(explicitDependencies);
        if (deps.contains(identity))
            throw new IllegalArgumentException("Resource '" + identity + "' cannot depend on itself");
        this.dependsOn = Collections.unmodifiableSet(deps);
        this.outputs = new ResourceOutputs(identity, kind.outputs());
    }

    public String identity() {
        return identity;
    }

    public ResourceKind kind() {
        return kind;
    }

    /** Non-owning back reference to the declaring parent. */
    public ResourceParent parent() {
        return parent;
    }

    /** Draft arguments after transform composition. */
    public ResourceArgs args() {
        return args;
    }

    /** Identities of every resource this one must be provisioned after. */
    public Set<String> dependsOn() {
        return dependsOn;
    }

    public ResourceOutputs outputs() {
        return outputs;
    }

    /** Shorthand for {@code outputs().get(field)}. */
    public Deferred<String> output(String field) {
        return outputs.get(field);
    }

    /** Parent path plus identity, e.g. {@code dev/Orders/OrdersRule}. */
    public String path() {
        return parent == null ? identity : parent.path() + "/" + identity;
    }

    @Override
    public String toString() {
        return "ResourceNode[" + identity + " (" + kind + "), dependsOn=" + dependsOn + "]";
    }
}
