package com.infra.wiring.util;

import com.infra.wiring.component.CompositeComponent;
import com.infra.wiring.engine.TopologicalOrder;
import com.infra.wiring.node.ResourceNode;
import com.infra.wiring.value.Deferred;

/**
 * Diagnostic utility for inspecting the resources of a composite.
 *
 * <p>
 * Generates human-readable representations of the declared dependency graph
 * and the current settlement of each resource's outputs.
 *
 * <p>
 * <b>Usage:</b> debugging sessions, error reports and documentation.
 */
public final class CompositeExplain {
    private final CompositeComponent component;
    private final TopologicalOrder topology;

    public CompositeExplain(CompositeComponent component) {
        this.component = component;
        this.topology = component.topology();
    }

    /**
     * Dumps the declared state of a single resource.
     */
    public String explainNode(String identity) {
        int idx = topology.topoIndex(identity);
        ResourceNode node = topology.node(idx);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Resource: ").append(identity).append('\n')
                .append("  Kind: ").append(node.kind()).append(" (").append(node.kind().type()).append(")\n")
                .append("  Parent: ").append(node.parent() == null ? "-" : node.parent().path()).append('\n')
                .append("  Order: ").append(idx).append('\n')
                .append("  Depends on: ").append(node.dependsOn()).append('\n')
                .append("  Outputs: ").append(node.outputs().state()).append('\n');
        for (String field : node.outputs().fieldNames()) {
            Deferred<String> out = node.output(field);
            sb.append("    ").append(field).append(" = ").append(out.now().orElse("<" + out.state() + ">"))
                    .append('\n');
        }
        int cc = topology.childCount(idx);
        sb.append("  Dependents (").append(cc).append("): ");
        for (int i = 0; i < cc; i++) {
            sb.append(topology.node(topology.child(idx, i)).identity());
            if (i < cc - 1)
                sb.append(", ");
        }
        return sb.append('\n').toString();
    }

    /**
     * Dumps the provisioning order in arrow text format.
     */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(512);
        sb.append(component.type()).append(" '").append(component.name()).append("' (")
                .append(topology.nodeCount()).append(" resources):\n");
        for (int i = 0; i < topology.nodeCount(); i++) {
            ResourceNode node = topology.node(i);
            sb.append("  [").append(i).append("] ").append(node.identity()).append(" (").append(node.kind()).append(')');
            if (topology.isRoot(i))
                sb.append(" (ROOT)");
            int cc = topology.childCount(i);
            if (cc > 0) {
                sb.append(" -> ");
                for (int j = 0; j < cc; j++) {
                    sb.append(topology.node(topology.child(i, j)).identity());
                    if (j < cc - 1)
                        sb.append(", ");
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS graph diagram, edges pointing from a resource to
     * the resources that depend on it.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("graph TD;\n");
        for (int i = 0; i < topology.nodeCount(); i++) {
            ResourceNode node = topology.node(i);
            sb.append("  ").append(sanitize(node.identity()))
                    .append("[\"").append(node.identity()).append("<br/>").append(node.kind()).append("\"];\n");
        }
        for (int i = 0; i < topology.nodeCount(); i++) {
            String from = sanitize(topology.node(i).identity());
            for (int j = 0; j < topology.childCount(i); j++)
                sb.append("  ").append(from).append(" --> ")
                        .append(sanitize(topology.node(topology.child(i, j)).identity())).append(";\n");
        }
        return sb.toString();
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
