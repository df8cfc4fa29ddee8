package com.infra.wiring.node;

import com.infra.wiring.value.Deferred;
import com.infra.wiring.value.DeferredState;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * The output attributes of one declared resource.
 *
 * Promises are allocated at declaration time so that later declarations can
 * reference them; the provisioning engine settles them exactly once through
 * {@link #settle(Map)}, {@link #fail(Throwable)} or {@link #cancel()}. Every
 * Deferred handed out depends on the owning resource's identity.
 */
public final class ResourceOutputs {
    private final String identity;
    private final Map<String, CompletableFuture<String>> promises;
    private final Map<String, Deferred<String>> views;

    public ResourceOutputs(String identity, Collection<String> fieldNames) {
        this.identity = identity;
        Map<String, CompletableFuture<String>> p = new LinkedHashMap<>();
        Map<String, Deferred<String>> v = new LinkedHashMap<>();
        for (String field : fieldNames) {
            CompletableFuture<String> promise = new CompletableFuture<>();
            p.put(field, promise);
            v.put(field, Deferred.of(promise, Set.of(identity)));
        }
        this.promises = Collections.unmodifiableMap(p);
        this.views = Collections.unmodifiableMap(v);
    }

    public String identity() {
        return identity;
    }

    public Set<String> fieldNames() {
        return promises.keySet();
    }

    /**
     * The Deferred for one output attribute.
     *
     * @throws IllegalArgumentException if the resource has no such output.
     */
    public Deferred<String> get(String field) {
        Deferred<String> d = views.get(field);
        if (d == null)
            throw new IllegalArgumentException("Resource '" + identity + "' has no output '" + field + "'");
        return d;
    }

    /**
     * Completes every output from {@code values}. Outputs missing from the map
     * fail, naming the missing attribute.
     *
     * @return false if the outputs had already settled.
     */
    public boolean settle(Map<String, String> values) {
        boolean changed = false;
        for (var e : promises.entrySet()) {
            String v = values.get(e.getKey());
            if (v != null)
                changed |= e.getValue().complete(v);
            else
                changed |= e.getValue().completeExceptionally(new IllegalStateException(
                        "Resource '" + identity + "' did not report output '" + e.getKey() + "'"));
        }
        return changed;
    }

    /** Fails every unsettled output with {@code cause}. */
    public boolean fail(Throwable cause) {
        boolean changed = false;
        for (CompletableFuture<String> p : promises.values())
            changed |= p.completeExceptionally(cause);
        return changed;
    }

    /** Cancels every unsettled output. Settled outputs are left as they are. */
    public boolean cancel() {
        boolean changed = false;
        for (CompletableFuture<String> p : promises.values())
            changed |= p.cancel(false);
        return changed;
    }

    /**
     * Aggregate state: PENDING while any output is pending, otherwise the worst
     * terminal state (CANCELLED, then FAILED, then RESOLVED).
     */
    public DeferredState state() {
        DeferredState worst = DeferredState.RESOLVED;
        for (Deferred<String> d : views.values()) {
            DeferredState s = d.state();
            if (s == DeferredState.PENDING)
                return s;
            if (s == DeferredState.CANCELLED || (s == DeferredState.FAILED && worst == DeferredState.RESOLVED))
                worst = s;
        }
        return worst;
    }
}
