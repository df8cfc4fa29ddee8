package com.infra.wiring.component;

import com.infra.wiring.api.ProvisioningEngine;
import com.infra.wiring.api.ResourceParent;
import com.infra.wiring.dsl.ComponentBuilder;
import com.infra.wiring.engine.TopologicalOrder;
import com.infra.wiring.node.ResourceNode;
import com.infra.wiring.value.Deferred;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Base class of composite components: a named group of resources declared
 * together and owned exclusively by the component.
 *
 * <p>
 * Subclasses declare their resources in the constructor:
 * <ol>
 * <li>Validate required input (throw {@link ComponentValidationException}).</li>
 * <li>Declare children through {@link #builder()}, in dependency order.</li>
 * <li>Call {@link #publish(ComponentBuilder, Map)} with the curated outputs.</li>
 * </ol>
 * Only {@code publish} has side effects: it hands every child to the scope in
 * one step.
 */
@Log4j2
public abstract class CompositeComponent implements ResourceParent {
    private final String type;
    private final String name;
    private final Scope scope;

    private List<ResourceNode> children = List.of();
    private Map<String, Deferred<?>> outputs = Map.of();
    private TopologicalOrder topology = TopologicalOrder.builder().build();
    private boolean published;
    private boolean destroyed;

    protected CompositeComponent(String type, String name, Scope scope) {
        this.type = Objects.requireNonNull(type, "type");
        if (name == null || name.isBlank())
            throw new ComponentValidationException(type, "name", "is required");
        this.name = name;
        this.scope = Objects.requireNonNull(scope, "scope");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public ResourceParent parent() {
        return scope;
    }

    public Scope scope() {
        return scope;
    }

    /** A fresh builder whose nodes report this component as their parent. */
    protected ComponentBuilder builder() {
        return ComponentBuilder.create(this);
    }

    /**
     * Hands the declared children to the scope and records the public outputs.
     *
     * @param b       Builder holding every child of this component.
     * @param outputs Curated output surface; iteration order is kept.
     */
    protected final void publish(ComponentBuilder b, Map<String, Deferred<?>> outputs) {
        if (published)
            throw new IllegalStateException("Component '" + name + "' already published");
        if (b.owner() != this)
            throw new IllegalArgumentException("Builder of '" + b.owner().name() + "' cannot publish '" + name + "'");

        List<ResourceNode> nodes = b.build();
        scope.adopt(this, nodes);

        this.children = nodes;
        this.topology = TopologicalOrder.of(nodes);
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        this.published = true;
        log.info("Declared {} '{}' with {} resources", type, path(), nodes.size());
    }

    /** Children in declaration order. */
    public List<ResourceNode> children() {
        return children;
    }

    /** Children in provisioning order. */
    public TopologicalOrder topology() {
        return topology;
    }

    /** The curated public outputs. The key set is fixed per component type. */
    public Map<String, Deferred<?>> outputs() {
        return outputs;
    }

    /**
     * @throws IllegalArgumentException if the component publishes no such output.
     */
    public Deferred<?> output(String key) {
        Deferred<?> d = outputs.get(key);
        if (d == null)
            throw new IllegalArgumentException("Component '" + name + "' has no output '" + key + "'");
        return d;
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    /**
     * Releases the children in reverse declaration order. Pending outputs are
     * cancelled.
     */
    void teardown(ProvisioningEngine engine) {
        if (destroyed)
            return;
        destroyed = true;
        for (int i = children.size() - 1; i >= 0; i--) {
            ResourceNode node = children.get(i);
            engine.release(node);
            node.outputs().cancel();
        }
        log.debug("Tore down '{}'", path());
    }
}
