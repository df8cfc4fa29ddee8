package com.infra.wiring.resource;

import com.infra.wiring.fn.TransformHook;
import com.infra.wiring.node.ResourceArgs;

import java.util.Map;

import lombok.Builder;
import lombok.Getter;

/**
 * Definition of a compute function.
 *
 * Unset fields fall back to the defaults below when the function is declared.
 * {@code transform} customizes the function's own draft and runs before any
 * transform supplied by an enclosing component.
 */
@Getter
@Builder(toBuilder = true)
public final class FunctionArgs {
    public static final String DEFAULT_RUNTIME = "nodejs20.x";
    public static final int DEFAULT_MEMORY_MB = 1024;
    public static final int DEFAULT_TIMEOUT_SECONDS = 20;

    private final String handler;
    private final String description;
    private final String runtime;
    private final Integer memory;
    private final Integer timeout;
    private final Map<String, String> environment;
    private final TransformHook transform;

    /** A definition holding only a handler, e.g. {@code src/sub.handler}. */
    public static FunctionArgs of(String handler) {
        return builder().handler(handler).build();
    }

    /** The provider draft of this definition, defaults applied. */
    public ResourceArgs toResourceArgs() {
        ResourceArgs.Builder b = ResourceArgs.builder()
                .put("handler", handler)
                .put("runtime", runtime != null ? runtime : DEFAULT_RUNTIME)
                .put("memorySize", memory != null ? memory : DEFAULT_MEMORY_MB)
                .put("timeout", timeout != null ? timeout : DEFAULT_TIMEOUT_SECONDS)
                .put("description", description);
        if (environment != null && !environment.isEmpty())
            b.put("environment", Map.of("variables", environment));
        return b.build();
    }
}
