package com.infra.wiring.component;

import com.infra.wiring.api.ProvisioningEngine;
import com.infra.wiring.api.ResourceParent;
import com.infra.wiring.fn.ComponentFactory;
import com.infra.wiring.node.ResourceNode;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * The outermost owner of composite components, e.g. one stack of one stage.
 *
 * <p>
 * The scope enforces exclusive ownership: a resource identity can be claimed
 * by only one component. Components are adopted atomically, so either all of a
 * component's resources reach the provisioning engine or none do.
 *
 * <p>
 * Closing the scope tears every component down in reverse declaration order.
 * Outputs that have not settled by then end up cancelled.
 */
@Log4j2
public final class Scope implements ResourceParent, AutoCloseable {
    public static final String TYPE = "wiring:scope:Scope";

    private final String name;
    private final ProvisioningEngine engine;

    private final List<CompositeComponent> components = new ArrayList<>();
    private final Map<String, CompositeComponent> componentsByName = new HashMap<>();
    private final Map<String, ResourceNode> resources = new LinkedHashMap<>();
    private final Map<String, CompositeComponent> owners = new HashMap<>();
    private boolean closed;

    private Scope(String name, ProvisioningEngine engine) {
        this.name = name;
        this.engine = engine;
    }

    public static Scope create(String name, ProvisioningEngine engine) {
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("Scope name must not be blank");
        return new Scope(name, Objects.requireNonNull(engine, "engine"));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public ResourceParent parent() {
        return null;
    }

    public ProvisioningEngine engine() {
        return engine;
    }

    /**
     * Declares a composite through its factory.
     *
     * @throws IllegalStateException if the scope is closed.
     */
    public <A, C extends CompositeComponent> C declare(ComponentFactory<A, C> factory, String name, A args) {
        checkOpen();
        return factory.create(name, args, this);
    }

    /**
     * Takes ownership of a component's resources and registers them with the
     * engine in declaration order. The scope records the component only after
     * the engine accepted every node; if the engine rejects one, the nodes
     * registered before it are released again.
     */
    synchronized void adopt(CompositeComponent component, List<ResourceNode> nodes) {
        checkOpen();
        if (component.scope() != this)
            throw new IllegalArgumentException("Component '" + component.name() + "' belongs to another scope");
        if (componentsByName.containsKey(component.name()))
            throw new IllegalArgumentException("Duplicate component name: " + component.name());
        for (ResourceNode node : nodes) {
            CompositeComponent owner = owners.get(node.identity());
            if (owner != null)
                throw new IllegalArgumentException("Resource '" + node.identity() + "' is already owned by '"
                        + owner.path() + "'");
            if (node.parent() != component)
                throw new IllegalArgumentException("Resource '" + node.identity() + "' was not declared by '"
                        + component.name() + "'");
        }

        List<ResourceNode> registered = new ArrayList<>(nodes.size());
        try {
            for (ResourceNode node : nodes) {
                engine.register(node);
                registered.add(node);
            }
        } catch (RuntimeException e) {
            // roll back so the engine holds nothing of a rejected component
            for (int i = registered.size() - 1; i >= 0; i--)
                engine.release(registered.get(i));
            log.warn("Engine rejected '{}', released {} resources: {}", component.path(), registered.size(),
                    e.getMessage());
            throw e;
        }

        components.add(component);
        componentsByName.put(component.name(), component);
        for (ResourceNode node : nodes) {
            resources.put(node.identity(), node);
            owners.put(node.identity(), component);
        }
    }

    public synchronized List<CompositeComponent> components() {
        return List.copyOf(components);
    }

    public synchronized CompositeComponent component(String name) {
        return componentsByName.get(name);
    }

    /** All adopted resources, keyed by identity, in adoption order. */
    public synchronized Map<String, ResourceNode> resources() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(resources));
    }

    /**
     * @return The resource, or null if no component owns that identity.
     */
    public synchronized ResourceNode resource(String identity) {
        return resources.get(identity);
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /** Tears down every component, last declared first. Idempotent. */
    @Override
    public synchronized void close() {
        if (closed)
            return;
        closed = true;
        for (int i = components.size() - 1; i >= 0; i--)
            components.get(i).teardown(engine);
        log.info("Scope '{}' closed, {} components torn down", name, components.size());
    }

    private void checkOpen() {
        if (closed)
            throw new IllegalStateException("Scope '" + name + "' is closed");
    }
}
