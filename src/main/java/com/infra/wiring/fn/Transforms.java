package com.infra.wiring.fn;

import com.infra.wiring.node.ResourceArgs;

import java.util.Objects;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * Two-phase composition of a {@link TransformHook} with component defaults.
 *
 * <ol>
 * <li>The hook runs on the full defaults.</li>
 * <li>Every owned field is then taken from the defaults again. An owned field
 * that the defaults do not carry is removed.</li>
 * </ol>
 * A hook that tries to change an owned field is corrected silently; the
 * correction is only logged at DEBUG.
 */
@Log4j2
public final class Transforms {
    private Transforms() {
        // Utility class
    }

    /**
     * Applies {@code hook} to {@code defaults}, then re-asserts
     * {@code ownedFields}.
     *
     * @return {@code defaults} itself when there is no hook.
     */
    public static ResourceArgs apply(TransformHook hook, ResourceArgs defaults, Set<String> ownedFields) {
        Objects.requireNonNull(defaults, "defaults");
        if (hook == null)
            return defaults;

        ResourceArgs candidate = hook.apply(defaults);
        if (candidate == null)
            return defaults;

        ResourceArgs.Builder merged = candidate.toBuilder();
        for (String field : ownedFields) {
            Object owned = defaults.get(field);
            if (!Objects.equals(owned, candidate.get(field)))
                log.debug("Transform override of owned field '{}' discarded", field);
            merged.put(field, owned);
        }
        return merged.build();
    }
}
