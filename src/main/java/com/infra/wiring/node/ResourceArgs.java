package com.infra.wiring.node;

import com.infra.wiring.value.Deferred;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Immutable draft arguments of a resource.
 *
 * Fields keep their insertion order. A value is one of:
 * <ul>
 * <li>a plain value (String, Number, Boolean, ...)</li>
 * <li>a {@link Deferred}</li>
 * <li>a {@link List} of values</li>
 * <li>a nested {@code ResourceArgs} (maps are converted on the way in)</li>
 * </ul>
 * A {@code null} value means "field absent": it is never stored.
 */
public final class ResourceArgs {
    private static final ResourceArgs EMPTY = new ResourceArgs(Map.of());

    private final Map<String, Object> fields;

    private ResourceArgs(Map<String, Object> fields) {
        this.fields = fields;
    }

    public static ResourceArgs empty() {
        return EMPTY;
    }

    public static ResourceArgs of(Map<String, ?> fields) {
        Builder b = builder();
        fields.forEach(b::put);
        return b.build();
    }

    public static ResourceArgs of(String k1, Object v1) {
        return builder().put(k1, v1).build();
    }

    public static ResourceArgs of(String k1, Object v1, String k2, Object v2) {
        return builder().put(k1, v1).put(k2, v2).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.fields.putAll(fields);
        return b;
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    public Set<String> fieldNames() {
        return fields.keySet();
    }

    public int size() {
        return fields.size();
    }

    /** Read-only view of the fields. */
    public Map<String, Object> asMap() {
        return fields;
    }

    /** Copy with {@code field} set, or removed when {@code value} is null. */
    public ResourceArgs with(String field, Object value) {
        return toBuilder().put(field, value).build();
    }

    public ResourceArgs without(String field) {
        if (!fields.containsKey(field))
            return this;
        return toBuilder().remove(field).build();
    }

    /** Shallow merge: fields of {@code overrides} win. */
    public ResourceArgs merge(ResourceArgs overrides) {
        if (overrides == null || overrides.fields.isEmpty())
            return this;
        Builder b = toBuilder();
        overrides.fields.forEach(b::put);
        return b.build();
    }

    /**
     * Union of the dependency sets of every Deferred reachable from these
     * args, including those nested in lists and structs.
     */
    public Set<String> dependencies() {
        Set<String> deps = new LinkedHashSet<>();
        for (Object v : fields.values())
            collect(v, deps);
        return deps;
    }

    /**
     * Resolves every Deferred reachable from these args. Nested structs resolve
     * to maps. Fails with the cause of the first Deferred that fails.
     */
    public CompletableFuture<Map<String, Object>> resolve() {
        List<String> names = new ArrayList<>(fields.keySet());
        CompletableFuture<?>[] parts = new CompletableFuture<?>[names.size()];
        for (int i = 0; i < names.size(); i++)
            parts[i] = resolveValue(fields.get(names.get(i)));
        return CompletableFuture.allOf(parts).thenApply(v -> {
            Map<String, Object> out = new LinkedHashMap<>();
            for (int i = 0; i < names.size(); i++)
                out.put(names.get(i), parts[i].join());
            return Collections.unmodifiableMap(out);
        });
    }

    private static void collect(Object v, Set<String> deps) {
        if (v instanceof Deferred<?> d) {
            deps.addAll(d.dependencies());
        } else if (v instanceof ResourceArgs nested) {
            for (Object nv : nested.fields.values())
                collect(nv, deps);
        } else if (v instanceof List<?> list) {
            for (Object item : list)
                collect(item, deps);
        }
    }

    private static CompletableFuture<Object> resolveValue(Object v) {
        if (v instanceof Deferred<?> d)
            return d.toCompletableFuture().thenApply(x -> x);
        if (v instanceof ResourceArgs nested)
            return nested.resolve().thenApply(x -> x);
        if (v instanceof List<?> list) {
            CompletableFuture<?>[] items = new CompletableFuture<?>[list.size()];
            for (int i = 0; i < items.length; i++)
                items[i] = resolveValue(list.get(i));
            return CompletableFuture.allOf(items).thenApply(x -> {
                List<Object> out = new ArrayList<>(items.length);
                for (CompletableFuture<?> item : items)
                    out.add(item.join());
                return Collections.unmodifiableList(out);
            });
        }
        return CompletableFuture.completedFuture(v);
    }

    private static Object normalize(Object v) {
        if (v instanceof Map<?, ?> map) {
            Builder b = builder();
            map.forEach((k, mv) -> b.put(String.valueOf(k), mv));
            return b.build();
        }
        if (v instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list)
                out.add(normalize(Objects.requireNonNull(item, "list element")));
            return Collections.unmodifiableList(out);
        }
        return v;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof ResourceArgs other && fields.equals(other.fields));
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return fields.toString();
    }

    /** Mutable builder; the only way to assemble new args. */
    public static final class Builder {
        private final Map<String, Object> fields = new LinkedHashMap<>();

        private Builder() {
        }

        /** Sets a field; a null value removes it. */
        public Builder put(String field, Object value) {
            Objects.requireNonNull(field, "field");
            if (value == null)
                fields.remove(field);
            else
                fields.put(field, normalize(value));
            return this;
        }

        public Builder remove(String field) {
            fields.remove(field);
            return this;
        }

        public ResourceArgs build() {
            if (fields.isEmpty())
                return EMPTY;
            return new ResourceArgs(Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
        }
    }
}
