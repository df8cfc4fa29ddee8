package com.infra.wiring.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.infra.wiring.component.CompositeComponent;
import com.infra.wiring.component.Scope;
import com.infra.wiring.node.ResourceArgs;
import com.infra.wiring.node.ResourceNode;
import com.infra.wiring.value.Deferred;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON export of everything declared in a {@link Scope}.
 *
 * <p>
 * Resolved Deferreds are written as their value; unresolved ones as
 * {@code {"state": ..., "dependsOn": [...]}}. The export is read-only
 * introspection: it reflects the merged drafts handed to the engine.
 */
public final class DeclarationSnapshot {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private DeclarationSnapshot() {
        // Utility class
    }

    /** Pretty-printed JSON of the scope. */
    public static String toJson(Scope scope) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(capture(scope));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize scope '" + scope.name() + "'", e);
        }
    }

    /** The snapshot as a Jackson tree. */
    public static JsonNode toTree(Scope scope) {
        return MAPPER.valueToTree(capture(scope));
    }

    static Map<String, Object> capture(Scope scope) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("scope", scope.name());
        root.put("closed", scope.isClosed());
        List<Object> components = new ArrayList<>();
        for (CompositeComponent c : scope.components())
            components.add(component(c));
        root.put("components", components);
        return root;
    }

    private static Map<String, Object> component(CompositeComponent c) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("name", c.name());
        out.put("type", c.type());
        out.put("path", c.path());
        Map<String, Object> outputs = new LinkedHashMap<>();
        c.outputs().forEach((k, v) -> outputs.put(k, render(v)));
        out.put("outputs", outputs);
        List<Object> resources = new ArrayList<>();
        for (ResourceNode node : c.children())
            resources.add(resource(node));
        out.put("resources", resources);
        return out;
    }

    private static Map<String, Object> resource(ResourceNode node) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("identity", node.identity());
        out.put("kind", node.kind().name());
        out.put("type", node.kind().type());
        out.put("dependsOn", List.copyOf(node.dependsOn()));
        out.put("args", render(node.args()));
        Map<String, Object> outputs = new LinkedHashMap<>();
        for (String field : node.outputs().fieldNames())
            outputs.put(field, render(node.output(field)));
        out.put("outputs", outputs);
        return out;
    }

    private static Object render(Object value) {
        if (value instanceof Deferred<?> d) {
            if (d.isKnown())
                return render(d.now().orElse(null));
            Map<String, Object> pending = new LinkedHashMap<>();
            pending.put("state", d.state().name());
            pending.put("dependsOn", List.copyOf(d.dependencies()));
            return pending;
        }
        if (value instanceof ResourceArgs args) {
            Map<String, Object> out = new LinkedHashMap<>();
            args.asMap().forEach((k, v) -> out.put(k, render(v)));
            return out;
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list)
                out.add(render(item));
            return out;
        }
        return value;
    }
}
