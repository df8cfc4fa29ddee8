package com.infra.wiring.engine;

import com.infra.wiring.api.ProvisioningEngine;
import com.infra.wiring.api.ProvisioningListener;
import com.infra.wiring.node.ResourceNode;
import com.infra.wiring.value.ResolutionException;
import com.infra.wiring.wiring.ProvisionEvent;
import com.infra.wiring.wiring.ProvisionHandler;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;

import java.util.*;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;

import lombok.extern.log4j.Log4j2;

/**
 * In-process provisioning engine.
 *
 * <p>
 * Resources are not created remotely: once a node's upstream resources and
 * arguments are resolved, the engine synthesizes deterministic outputs (ARNs,
 * physical names, ids) from its region and account. Everything else follows
 * the engine contract:
 * <ol>
 * <li>Registration queues nodes; {@link #provision()} schedules the queued
 * batch.</li>
 * <li>The batch is sorted with {@link TopologicalOrder} and published to a
 * Disruptor ring buffer in that order.</li>
 * <li>A node is created only after every registered node it depends on has
 * been created; if one of them failed, the node fails with a
 * {@link ResolutionException} naming it. Unrelated subgraphs carry on.</li>
 * <li>Released nodes settle as cancelled.</li>
 * </ol>
 *
 * <p>
 * {@link #failOn(String, String)} injects a creation failure, which is how the
 * failure paths are exercised.
 */
@Log4j2
public final class LocalProvisioningEngine implements ProvisioningEngine, AutoCloseable {
    public static final String DEFAULT_REGION = "us-east-1";
    public static final String DEFAULT_ACCOUNT = "123456789012";
    private static final int RING_BUFFER_SIZE = 1024;

    private final String region;
    private final String accountId;

    // guarded by this
    private final Map<String, ResourceNode> registered = new LinkedHashMap<>();
    private final List<ResourceNode> queued = new ArrayList<>();
    private long batch;

    private final Map<String, CompletableFuture<Void>> completions = new ConcurrentHashMap<>();
    private final Map<String, String> injectedFailures = new ConcurrentHashMap<>();
    private final List<String> provisionLog = new CopyOnWriteArrayList<>();
    private final List<String> releaseLog = new CopyOnWriteArrayList<>();

    private final Disruptor<ProvisionEvent> disruptor;
    private final RingBuffer<ProvisionEvent> ringBuffer;
    private volatile ProvisioningListener listener;
    private volatile boolean closed;

    public LocalProvisioningEngine() {
        this(DEFAULT_REGION, DEFAULT_ACCOUNT);
    }

    public LocalProvisioningEngine(String region, String accountId) {
        this.region = Objects.requireNonNull(region, "region");
        this.accountId = Objects.requireNonNull(accountId, "accountId");

        this.disruptor = new Disruptor<>(
                ProvisionEvent::new,
                RING_BUFFER_SIZE,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        disruptor.handleEventsWith(new ProvisionHandler(new EngineScheduler()));
        this.ringBuffer = disruptor.start();
    }

    public void setListener(ProvisioningListener listener) {
        this.listener = listener;
    }

    public String region() {
        return region;
    }

    public String accountId() {
        return accountId;
    }

    @Override
    public synchronized void register(ResourceNode node) {
        checkOpen();
        if (registered.containsKey(node.identity()))
            throw new IllegalArgumentException("Resource already registered: " + node.identity());
        registered.put(node.identity(), node);
        queued.add(node);
        completions.put(node.identity(), new CompletableFuture<>());
        log.debug("Registered {} dependsOn={}", node.path(), node.dependsOn());
    }

    /**
     * Releases a registered node. Pending outputs and the node's completion are
     * cancelled and the engine forgets the identity, so it may be registered
     * again. Nodes scheduled later treat a released upstream like one the
     * engine never knew; they still settle as cancelled when their arguments
     * reference the released outputs.
     */
    @Override
    public synchronized void release(ResourceNode node) {
        if (registered.get(node.identity()) != node)
            return;
        registered.remove(node.identity());
        queued.remove(node);
        injectedFailures.remove(node.identity());
        releaseLog.add(node.identity());

        CompletableFuture<Void> completion = completions.remove(node.identity());
        boolean cancelled = node.outputs().cancel();
        if (completion != null)
            completion.cancel(false);
        if (cancelled) {
            log.debug("Released {} before it was provisioned", node.identity());
            ProvisioningListener l = listener;
            if (l != null)
                l.onCancelled(node.identity());
        }
    }

    /**
     * Makes the creation of {@code identity} fail with {@code message}.
     */
    public void failOn(String identity, String message) {
        injectedFailures.put(identity, message);
    }

    /**
     * Schedules every node registered since the previous call.
     *
     * @return A future that completes once every node of the batch has settled,
     *         successfully or not. It never completes exceptionally; inspect the
     *         nodes' outputs for the outcome.
     * @throws IllegalStateException if the dependencies of the batch form a
     *                               cycle, or the engine is closed.
     */
    public synchronized CompletableFuture<Void> provision() {
        checkOpen();
        if (queued.isEmpty())
            return CompletableFuture.completedFuture(null);

        TopologicalOrder order = TopologicalOrder.of(queued);
        long b = ++batch;
        queued.clear();

        ProvisioningListener l = listener;
        if (l != null)
            l.onBatchStart(b, order.nodeCount());
        log.info("Provisioning batch {} with {} resources", b, order.nodeCount());

        CompletableFuture<?>[] settled = new CompletableFuture<?>[order.nodeCount()];
        for (int ti = 0; ti < order.nodeCount(); ti++) {
            ResourceNode node = order.node(ti);
            settled[ti] = completions.get(node.identity()).handle((v, e) -> null);

            long sequence = ringBuffer.next();
            try {
                ringBuffer.get(sequence).set(node, b, ti);
            } finally {
                ringBuffer.publish(sequence);
            }
        }
        return CompletableFuture.allOf(settled);
    }

    /** Identities in the order their resources were created. */
    public List<String> provisionLog() {
        return List.copyOf(provisionLog);
    }

    /** Identities in the order they were released. */
    public List<String> releaseLog() {
        return List.copyOf(releaseLog);
    }

    public synchronized boolean isRegistered(String identity) {
        return registered.containsKey(identity);
    }

    public synchronized int queuedCount() {
        return queued.size();
    }

    /** Number of identities the engine currently tracks a completion for. */
    public int trackedCount() {
        return completions.size();
    }

    /** Stops the ring buffer after the events already published are handled. */
    @Override
    public void close() {
        if (closed)
            return;
        closed = true;
        disruptor.shutdown();
    }

    private void checkOpen() {
        if (closed)
            throw new IllegalStateException("Provisioning engine is closed");
    }

    // ── Scheduling (ring buffer consumer side) ───────────────────────

    private final class EngineScheduler implements ProvisionHandler.Scheduler {
        @Override
        public void schedule(ResourceNode node) {
            CompletableFuture<Void> completion = completions.get(node.identity());
            if (completion == null || completion.isDone())
                return;

            List<CompletableFuture<Void>> upstream = new ArrayList<>();
            for (String dep : node.dependsOn()) {
                CompletableFuture<Void> c = completions.get(dep);
                if (c != null)
                    upstream.add(c);
            }

            CompletableFuture.allOf(upstream.toArray(new CompletableFuture<?>[0]))
                    .thenCompose(v -> node.args().resolve())
                    .whenComplete((resolved, error) -> {
                        if (error != null)
                            fail(node, completion, error);
                        else
                            create(node, completion, resolved);
                    });
        }

        @Override
        public void reject(ResourceNode node, Throwable error) {
            fail(node, completions.get(node.identity()), error);
        }
    }

    // completion is the one captured at scheduling time; the identity may have
    // been released and registered again since
    private void create(ResourceNode node, CompletableFuture<Void> completion, Map<String, Object> resolved) {
        if (completion == null || completion.isDone())
            return;

        ProvisioningListener l = listener;
        long start = System.nanoTime();
        if (l != null)
            l.onProvisionStart(node.identity());

        String injected = injectedFailures.get(node.identity());
        if (injected != null) {
            fail(node, completion, new ResolutionException(node.identity(), injected));
            return;
        }

        Map<String, String> outputs = synthesize(node, resolved);
        node.outputs().settle(outputs);
        provisionLog.add(node.identity());
        log.debug("Provisioned {} -> {}", node.identity(), outputs);
        // listeners run before dependents are released and before provision() completes
        if (l != null)
            l.onProvisioned(node.identity(), outputs, System.nanoTime() - start);
        completion.complete(null);
    }

    private void fail(ResourceNode node, CompletableFuture<Void> completion, Throwable error) {
        if (completion == null || completion.isDone())
            return;
        Throwable cause = unwrap(error);

        if (cause instanceof CancellationException) {
            // an upstream resource was released; this one cannot be created either
            node.outputs().cancel();
            ProvisioningListener l = listener;
            if (l != null)
                l.onCancelled(node.identity());
            completion.cancel(false);
            return;
        }

        ResolutionException failure;
        if (cause instanceof ResolutionException re && re.identity().equals(node.identity()))
            failure = re;
        else if (cause instanceof ResolutionException re)
            failure = new ResolutionException(node.identity(),
                    "upstream resource '" + re.failedIdentity() + "' failed", re);
        else
            failure = new ResolutionException(node.identity(), String.valueOf(cause.getMessage()), cause);

        node.outputs().fail(failure);
        log.warn(failure.getMessage());
        ProvisioningListener l = listener;
        if (l != null)
            l.onProvisionError(node.identity(), failure);
        completion.completeExceptionally(failure);
    }

    private Map<String, String> synthesize(ResourceNode node, Map<String, Object> resolved) {
        String identity = node.identity();
        return switch (node.kind()) {
            case FUNCTION -> {
                String name = identity + "-" + shortHash(identity);
                yield Map.of("name", name, "arn", arn(node, "function:" + name));
            }
            case TOPIC_RULE -> {
                String name = identity.replaceAll("[^A-Za-z0-9_]", "_") + "_" + shortHash(identity);
                yield Map.of("name", name, "arn", arn(node, "rule/" + name));
            }
            case PERMISSION -> Map.of("id", resolved.get("function") + "-" + identity);
        };
    }

    private String arn(ResourceNode node, String resource) {
        return "arn:aws:" + node.kind().service() + ":" + region + ":" + accountId + ":" + resource;
    }

    private static String shortHash(String identity) {
        return String.format("%07x", identity.hashCode() & 0xfffffff);
    }

    private static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null)
            cur = cur.getCause();
        return cur;
    }
}
