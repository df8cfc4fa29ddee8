package com.infra.wiring.dsl;

import com.infra.wiring.api.ResourceParent;
import com.infra.wiring.engine.TopologicalOrder;
import com.infra.wiring.fn.TransformHook;
import com.infra.wiring.fn.Transforms;
import com.infra.wiring.node.ResourceArgs;
import com.infra.wiring.node.ResourceKind;
import com.infra.wiring.node.ResourceNode;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Component Builder -- the declaration API used inside composite components.
 *
 * This class records the resources of one composite and the dependency edges
 * between them.
 *
 * Usage Pattern:
 * 1. Create a builder for the owning component: ComponentBuilder.create(owner)
 * 2. Declare resources in dependency order: b.declare("fnHandler", FUNCTION, args, hook)
 * 3. Reference earlier outputs in later args: fn.output("arn")
 * 4. Build: List&lt;ResourceNode&gt; children = b.build();
 *
 * Declaration never blocks and never talks to the provisioning engine. The
 * declared nodes are handed over only after {@link #build()}, by the owning
 * scope, so a component that throws half way through leaves nothing behind.
 */
public final class ComponentBuilder {
    private static final Logger log = LogManager.getLogger(ComponentBuilder.class);

    private final ResourceParent owner;

    private final List<ResourceNode> nodes = new ArrayList<>();
    private final Map<String, ResourceNode> nodesByIdentity = new HashMap<>();

    // Flag to prevent modification after building
    private boolean built;

    private ComponentBuilder(ResourceParent owner) {
        this.owner = owner;
    }

    /**
     * Creates a builder whose nodes will report {@code owner} as their parent.
     */
    public static ComponentBuilder create(ResourceParent owner) {
        return new ComponentBuilder(Objects.requireNonNull(owner, "owner"));
    }

    public ResourceParent owner() {
        return owner;
    }

    /**
     * Declares a resource with no transform and no explicit dependencies.
     */
    public ResourceNode declare(String identity, ResourceKind kind, ResourceArgs defaults) {
        return declare(identity, kind, defaults, null);
    }

    /**
     * Declares a resource.
     *
     * <p>
     * The draft is {@code defaults} customized by {@code hook}, with the kind's
     * owned fields re-asserted. The node depends on every resource referenced by
     * a Deferred inside the final draft, plus {@code dependsOn}.
     *
     * @param identity  Unique identity of the resource.
     * @param kind      Resource kind.
     * @param defaults  The component's draft arguments.
     * @param hook      Optional caller customization; null for none.
     * @param dependsOn Explicit, non-data dependencies.
     * @return The declared node.
     */
    public ResourceNode declare(String identity, ResourceKind kind, ResourceArgs defaults,
            TransformHook hook, ResourceNode... dependsOn) {
        checkNotBuilt();
        if (identity == null || identity.isBlank())
            throw new IllegalArgumentException("Resource identity must not be blank");
        if (nodesByIdentity.containsKey(identity))
            throw new IllegalArgumentException("Duplicate resource identity: " + identity);

        ResourceArgs draft = Transforms.apply(hook, defaults, kind.ownedFields());

        Set<String> explicit = new LinkedHashSet<>();
        for (ResourceNode dep : dependsOn)
            explicit.add(dep.identity());

        var node = new ResourceNode(identity, kind, owner, draft, explicit);
        nodes.add(node);
        nodesByIdentity.put(identity, node);
        log.debug("Declared {} ({}) dependsOn={}", node.path(), kind, node.dependsOn());
        return node;
    }

    /**
     * Finishes declaration.
     *
     * @return The declared nodes in declaration order.
     * @throws IllegalStateException if the builder was already built or the
     *                               declared dependencies form a cycle.
     */
    public List<ResourceNode> build() {
        checkNotBuilt();
        built = true;
        // validates acyclicity of the internal edges
        TopologicalOrder.of(nodes);
        return List.copyOf(nodes);
    }

    /**
     * Retrieve a node by identity during the declaration phase.
     */
    public ResourceNode getNode(String identity) {
        return nodesByIdentity.get(identity);
    }

    public int size() {
        return nodes.size();
    }

    private void checkNotBuilt() {
        if (built)
            throw new IllegalStateException("Component already built");
    }
}
