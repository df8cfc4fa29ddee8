package com.infra.wiring.value;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/**
 * A value that becomes known only after some resource has been provisioned.
 *
 * A Deferred is the fundamental unit of wiring: every resource output is a
 * Deferred, and every derived value (an interpolated string, a projected field)
 * is a Deferred too. Besides the eventual value it carries the identities of
 * the resources it was computed from. That dependency set is structural: it is
 * fixed at construction, independent of whether the value happens to be
 * resolved already, so scheduling never depends on resolution timing.
 *
 * Deferreds are read-only. Settlement belongs to whoever owns the underlying
 * future (for resource outputs, the provisioning engine through
 * {@code ResourceOutputs}).
 *
 * @param <T> The type of the eventual value.
 */
public final class Deferred<T> {
    private final CompletableFuture<T> future;
    private final Set<String> dependencies;

    private Deferred(CompletableFuture<T> future, Set<String> dependencies) {
        this.future = future;
        this.dependencies = dependencies;
    }

    /**
     * Wraps a future and the identities it is sourced from.
     *
     * @param future       Future that will hold the value.
     * @param dependencies Identities of upstream resources.
     */
    public static <T> Deferred<T> of(CompletableFuture<T> future, Set<String> dependencies) {
        Objects.requireNonNull(future, "future");
        return new Deferred<>(future, freeze(dependencies));
    }

    /** A value that is known now and depends on nothing. */
    public static <T> Deferred<T> known(T value) {
        return new Deferred<>(CompletableFuture.completedFuture(value), Set.of());
    }

    /** Identities of every resource this value was derived from. */
    public Set<String> dependencies() {
        return dependencies;
    }

    /**
     * Applies {@code fn} to the eventual value. The dependency set is preserved
     * unchanged; failures and cancellation pass through untouched.
     */
    public <R> Deferred<R> map(Function<? super T, ? extends R> fn) {
        Objects.requireNonNull(fn, "fn");
        return new Deferred<>(future.thenApply(fn), dependencies);
    }

    public DeferredState state() {
        if (!future.isDone())
            return DeferredState.PENDING;
        if (future.isCancelled())
            return DeferredState.CANCELLED;
        if (!future.isCompletedExceptionally())
            return DeferredState.RESOLVED;
        return failure() instanceof CancellationException ? DeferredState.CANCELLED : DeferredState.FAILED;
    }

    /** True once the value is resolved. */
    public boolean isKnown() {
        return state() == DeferredState.RESOLVED;
    }

    /** The resolved value, or empty if the value is not (yet) known. */
    public Optional<T> now() {
        return isKnown() ? Optional.ofNullable(future.join()) : Optional.empty();
    }

    /**
     * The cause of a FAILED or CANCELLED value with completion wrappers
     * removed, or null otherwise.
     */
    public Throwable failure() {
        if (!future.isCompletedExceptionally())
            return null;
        try {
            future.getNow(null);
            return null;
        } catch (CancellationException e) {
            return e;
        } catch (CompletionException e) {
            return unwrap(e);
        }
    }

    /**
     * A copy of the underlying future. Completing or cancelling the copy does
     * not affect this value.
     */
    public CompletableFuture<T> toCompletableFuture() {
        return future.thenApply(Function.identity());
    }

    @Override
    public String toString() {
        DeferredState s = state();
        return switch (s) {
            case RESOLVED -> "Deferred[" + future.join() + "]";
            case FAILED, CANCELLED -> "Deferred[" + s + ", dependsOn=" + dependencies + "]";
            default -> "Deferred[PENDING, dependsOn=" + dependencies + "]";
        };
    }

    static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null)
            cur = cur.getCause();
        return cur;
    }

    CompletableFuture<T> future() {
        return future;
    }

    private static Set<String> freeze(Set<String> deps) {
        if (deps == null || deps.isEmpty())
            return Set.of();
        return Collections.unmodifiableSet(new LinkedHashSet<>(deps));
    }
}
