package com.infra.wiring.fn;

import com.infra.wiring.node.ResourceArgs;

import java.util.Map;
import java.util.Objects;

/**
 * Caller-supplied customization of a resource's draft arguments.
 *
 * <p>
 * The hook sees the component's defaults and returns the arguments it wants.
 * Returning null keeps the draft unchanged. Fields owned by the component are
 * re-asserted after the hook runs (see {@link Transforms}), so a hook can only
 * add or override customizable fields.
 *
 * <p>
 * Examples:
 * <ul>
 * <li>{@code draft -> draft.with("enabled", false)}</li>
 * <li>{@code TransformHook.merging(Map.of("description", "audit"))}</li>
 * </ul>
 */
@FunctionalInterface
public interface TransformHook {
    /**
     * Applies the customization.
     *
     * @param draft The component's draft arguments.
     * @return The customized arguments, or null for "unchanged".
     */
    ResourceArgs apply(ResourceArgs draft);

    /** Runs this hook, then {@code next} on its result. */
    default TransformHook andThen(TransformHook next) {
        if (next == null)
            return this;
        return draft -> {
            ResourceArgs first = apply(draft);
            return next.apply(first == null ? draft : first);
        };
    }

    static TransformHook identity() {
        return draft -> draft;
    }

    /**
     * A hook that shallow-merges {@code overrides} into the draft, the way a
     * plain-object transform is applied.
     */
    static TransformHook merging(Map<String, ?> overrides) {
        ResourceArgs patch = ResourceArgs.of(Objects.requireNonNull(overrides, "overrides"));
        return draft -> draft.merge(patch);
    }

    /** Composes two possibly absent hooks; returns null if both are absent. */
    static TransformHook compose(TransformHook first, TransformHook second) {
        if (first == null)
            return second;
        return first.andThen(second);
    }
}
