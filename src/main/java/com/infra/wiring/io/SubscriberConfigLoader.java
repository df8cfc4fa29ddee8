package com.infra.wiring.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.infra.wiring.component.RealtimeLambdaSubscriber;
import com.infra.wiring.component.Scope;
import com.infra.wiring.component.SubscriberArgs;
import com.infra.wiring.fn.TransformHook;
import com.infra.wiring.node.ResourceKind;
import com.infra.wiring.resource.FunctionArgs;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reads subscriber configuration from JSON and turns it into
 * {@link SubscriberArgs}.
 *
 * <p>
 * Transform entries are plain override objects keyed by resource kind
 * ({@code function}, {@code topicRule}, {@code permission}); each becomes a
 * {@link TransformHook#merging(Map)} hook. Required fields are not checked
 * here: a missing {@code subscriber} surfaces when the component is declared.
 */
public final class SubscriberConfigLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SubscriberConfigLoader() {
        // Utility class
    }

    /** Parses a JSON file into a SubscriberDefinition. */
    public static SubscriberDefinition parseFile(Path path) throws IOException {
        return MAPPER.readValue(Files.readString(path), SubscriberDefinition.class);
    }

    /** Parses a classpath resource into a SubscriberDefinition. */
    public static SubscriberDefinition parseResource(String resource) throws IOException {
        try (InputStream in = SubscriberConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IOException("Resource not found: " + resource);
            return MAPPER.readValue(in, SubscriberDefinition.class);
        }
    }

    /**
     * Parses a JSON string into a SubscriberDefinition.
     *
     * @throws IllegalArgumentException if the document is not valid JSON.
     */
    public static SubscriberDefinition parse(String json) {
        try {
            return MAPPER.readValue(json, SubscriberDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid subscriber configuration: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Converts a definition to component arguments.
     *
     * @throws IllegalArgumentException for unknown transform kinds or a
     *                                  subscriber that is neither a string nor
     *                                  an object.
     */
    public static SubscriberArgs toArgs(SubscriberDefinition def) {
        SubscriberArgs args = SubscriberArgs.create()
                .iot(def.getIot())
                .filter(def.getFilter());

        Object subscriber = def.getSubscriber();
        if (subscriber instanceof String handler) {
            args.subscriber(handler);
        } else if (subscriber instanceof Map<?, ?>) {
            args.subscriber(toFunctionArgs(MAPPER.convertValue(subscriber, SubscriberDefinition.FunctionDef.class)));
        } else if (subscriber != null) {
            throw new IllegalArgumentException("Field 'subscriber' must be a handler string or an object, got "
                    + subscriber.getClass().getSimpleName());
        }

        if (def.getTransform() != null) {
            for (var e : def.getTransform().entrySet())
                args.transform(ResourceKind.fromString(e.getKey()), TransformHook.merging(e.getValue()));
        }
        return args;
    }

    /** Parses and declares a subscriber in {@code scope}. */
    public static RealtimeLambdaSubscriber declare(Scope scope, SubscriberDefinition def) {
        return scope.declare(RealtimeLambdaSubscriber::new, def.getName(), toArgs(def));
    }

    private static FunctionArgs toFunctionArgs(SubscriberDefinition.FunctionDef fd) {
        return FunctionArgs.builder()
                .handler(fd.getHandler())
                .description(fd.getDescription())
                .runtime(fd.getRuntime())
                .memory(fd.getMemory())
                .timeout(fd.getTimeout())
                .environment(fd.getEnvironment())
                .transform(fd.getTransform() == null ? null : TransformHook.merging(fd.getTransform()))
                .build();
    }
}
