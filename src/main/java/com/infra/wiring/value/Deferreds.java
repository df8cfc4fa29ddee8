package com.infra.wiring.value;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Combinators over {@link Deferred}.
 *
 * Every combinator is non-blocking and merges the dependency sets of its
 * inputs; no dependency identity is ever dropped.
 */
public final class Deferreds {
    /** Placeholder token used by {@link #interpolate(String, Object...)}. */
    public static final String PLACEHOLDER = "{}";

    private Deferreds() {
        // Utility class
    }

    /** Lifts a plain value into a Deferred with no dependencies. */
    public static <T> Deferred<T> lift(T value) {
        return Deferred.known(value);
    }

    /** Returns {@code value} as is, dependency set included. */
    public static <T> Deferred<T> lift(Deferred<T> value) {
        return value;
    }

    /** Lifts a value whose static type is unknown, passing Deferreds through. */
    @SuppressWarnings("unchecked")
    private static Deferred<Object> liftAny(Object value) {
        if (value instanceof Deferred<?> d)
            return (Deferred<Object>) d;
        return Deferred.known(value);
    }

    /**
     * Joins several values, keeping their order. The result depends on the
     * union of every input's dependencies and fails with the cause of the first
     * input that fails.
     *
     * @param values Plain values or Deferreds.
     */
    public static Deferred<List<Object>> all(Collection<?> values) {
        List<Deferred<Object>> parts = new ArrayList<>(values.size());
        for (Object v : values)
            parts.add(liftAny(v));

        Set<String> deps = new LinkedHashSet<>();
        CompletableFuture<?>[] futures = new CompletableFuture<?>[parts.size()];
        for (int i = 0; i < parts.size(); i++) {
            deps.addAll(parts.get(i).dependencies());
            futures[i] = parts.get(i).future();
        }

        CompletableFuture<List<Object>> joined = CompletableFuture.allOf(futures).thenApply(v -> {
            // every input is complete here, join() cannot block
            List<Object> out = new ArrayList<>(parts.size());
            for (Deferred<Object> p : parts)
                out.add(p.future().join());
            return out;
        });
        // fail fast: a failed or cancelled input settles the result even while
        // siblings are still pending
        for (CompletableFuture<?> f : futures)
            f.whenComplete((v, error) -> {
                if (error != null)
                    joined.completeExceptionally(error);
            });
        return Deferred.of(joined, deps);
    }

    /**
     * Builds a string from a template with {@code {}} placeholders, one per part.
     *
     * <p>
     * Example: {@code interpolate("SELECT * FROM '{}'", filter)}.
     *
     * @param template Template text.
     * @param parts    Plain values or Deferreds, substituted in order.
     * @return A Deferred string depending on every part.
     * @throws IllegalArgumentException if the number of placeholders differs from
     *                                  the number of parts.
     */
    public static Deferred<String> interpolate(String template, Object... parts) {
        List<String> segments = split(template);
        if (segments.size() - 1 != parts.length)
            throw new IllegalArgumentException("Template '" + template + "' has " + (segments.size() - 1)
                    + " placeholders but " + parts.length + " parts were given");

        return all(List.of(parts)).map(values -> {
            StringBuilder sb = new StringBuilder(template.length() + 32);
            for (int i = 0; i < values.size(); i++)
                sb.append(segments.get(i)).append(values.get(i));
            return sb.append(segments.get(segments.size() - 1)).toString();
        });
    }

    private static List<String> split(String template) {
        List<String> segments = new ArrayList<>();
        int from = 0, at;
        while ((at = template.indexOf(PLACEHOLDER, from)) >= 0) {
            segments.add(template.substring(from, at));
            from = at + PLACEHOLDER.length();
        }
        segments.add(template.substring(from));
        return segments;
    }
}
