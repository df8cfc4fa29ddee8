package com.infra.wiring.node;

import java.util.List;
import java.util.Set;

/**
 * The low-level resource kinds a composite can declare.
 *
 * Each kind lists the fields a composite owns (linkage fields that transform
 * hooks may never change) and the output attributes the provisioning engine
 * publishes once the resource exists.
 */
public enum ResourceKind {
    FUNCTION("aws:lambda/function:Function", "lambda", "function",
            Set.of("handler"), List.of("arn", "name")),
    TOPIC_RULE("aws:iot/topicRule:TopicRule", "iot", "topicRule",
            Set.of("lambdas"), List.of("arn", "name")),
    PERMISSION("aws:lambda/permission:Permission", "lambda", "permission",
            Set.of("action", "function", "principal", "sourceArn"), List.of("id"));

    private final String type;
    private final String service;
    private final String configKey;
    private final Set<String> ownedFields;
    private final List<String> outputs;

    ResourceKind(String type, String service, String configKey, Set<String> ownedFields, List<String> outputs) {
        this.type = type;
        this.service = service;
        this.configKey = configKey;
        this.ownedFields = ownedFields;
        this.outputs = outputs;
    }

    /** Provider type token, e.g. {@code aws:lambda/function:Function}. */
    public String type() {
        return type;
    }

    /** Service segment used when building ARNs. */
    public String service() {
        return service;
    }

    /** Key naming this kind in transform configuration, e.g. {@code topicRule}. */
    public String configKey() {
        return configKey;
    }

    public Set<String> ownedFields() {
        return ownedFields;
    }

    public List<String> outputs() {
        return outputs;
    }

    /**
     * Resolves a kind from its configuration key or enum name, ignoring case.
     *
     * @throws IllegalArgumentException for unknown names.
     */
    public static ResourceKind fromString(String name) {
        for (ResourceKind kind : values()) {
            if (kind.configKey.equalsIgnoreCase(name) || kind.name().equalsIgnoreCase(name))
                return kind;
        }
        throw new IllegalArgumentException("Unknown resource kind: " + name);
    }
}
