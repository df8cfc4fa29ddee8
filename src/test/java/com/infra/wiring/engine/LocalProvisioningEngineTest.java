package com.infra.wiring.engine;

import com.infra.wiring.api.ProvisioningListener;
import com.infra.wiring.node.ResourceArgs;
import com.infra.wiring.node.ResourceKind;
import com.infra.wiring.node.ResourceNode;
import com.infra.wiring.value.DeferredState;
import com.infra.wiring.value.ResolutionException;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class LocalProvisioningEngineTest {

    private LocalProvisioningEngine engine;
    private final List<String> events = new CopyOnWriteArrayList<>();

    @Before
    public void setUp() {
        engine = new LocalProvisioningEngine("eu-west-1", "111122223333");
        engine.setListener(new ProvisioningListener() {
            @Override
            public void onBatchStart(long batch, int nodeCount) {
                events.add("batch:" + nodeCount);
            }

            @Override
            public void onProvisionStart(String identity) {
            }

            @Override
            public void onProvisioned(String identity, Map<String, String> outputs, long durationNanos) {
                events.add("ok:" + identity);
            }

            @Override
            public void onProvisionError(String identity, Throwable error) {
                events.add("error:" + identity);
            }

            @Override
            public void onCancelled(String identity) {
                events.add("cancel:" + identity);
            }
        });
    }

    @After
    public void tearDown() {
        engine.close();
    }

    private ResourceNode function(String identity) {
        return new ResourceNode(identity, ResourceKind.FUNCTION, null, ResourceArgs.of("handler", "src/h.handler"),
                Set.of());
    }

    private ResourceNode rule(String identity, ResourceNode fn) {
        return new ResourceNode(identity, ResourceKind.TOPIC_RULE, null,
                ResourceArgs.of("lambdas", List.of(ResourceArgs.of("functionArn", fn.output("arn")))), Set.of());
    }

    private ResourceNode permission(String identity, ResourceNode fn, ResourceNode rule) {
        return new ResourceNode(identity, ResourceKind.PERMISSION, null,
                ResourceArgs.of("function", fn.output("name"), "sourceArn", rule.output("arn")), Set.of());
    }

    private void provision() throws Exception {
        engine.provision().get(5, TimeUnit.SECONDS);
    }

    @Test
    public void testProvisionsInDependencyOrder() throws Exception {
        ResourceNode fn = function("SubHandler");
        ResourceNode rule = rule("SubRule", fn);
        ResourceNode perm = permission("SubPermission", fn, rule);

        // registered backwards, the engine still honours dependencies
        engine.register(perm);
        engine.register(rule);
        engine.register(fn);
        provision();

        assertEquals(List.of("SubHandler", "SubRule", "SubPermission"), engine.provisionLog());
        assertEquals(DeferredState.RESOLVED, perm.outputs().state());
        assertEquals(0, engine.queuedCount());
        assertEquals("batch:3", events.get(0));
    }

    @Test
    public void testOutputsAreDeterministic() throws Exception {
        ResourceNode fn = function("SubHandler");
        ResourceNode rule = rule("SubRule", fn);
        ResourceNode perm = permission("SubPermission", fn, rule);
        engine.register(fn);
        engine.register(rule);
        engine.register(perm);
        provision();

        String name = fn.output("name").now().get();
        assertTrue(name.startsWith("SubHandler-"));
        assertEquals("arn:aws:lambda:eu-west-1:111122223333:function:" + name, fn.output("arn").now().get());
        assertTrue(rule.output("arn").now().get().startsWith("arn:aws:iot:eu-west-1:111122223333:rule/SubRule_"));
        assertEquals(name + "-SubPermission", perm.output("id").now().get());

        try (LocalProvisioningEngine other = new LocalProvisioningEngine("eu-west-1", "111122223333")) {
            ResourceNode again = function("SubHandler");
            other.register(again);
            other.provision().get(5, TimeUnit.SECONDS);
            assertEquals(fn.output("arn").now().get(), again.output("arn").now().get());
        }
    }

    @Test
    public void testFailurePropagatesToDependentsOnly() throws Exception {
        ResourceNode fn = function("SubHandler");
        ResourceNode rule = rule("SubRule", fn);
        ResourceNode perm = permission("SubPermission", fn, rule);
        ResourceNode sibling = function("OtherHandler");
        engine.failOn("SubRule", "topic rule quota exceeded");

        engine.register(fn);
        engine.register(rule);
        engine.register(perm);
        engine.register(sibling);
        provision();

        assertEquals(DeferredState.RESOLVED, fn.outputs().state());
        assertEquals(DeferredState.RESOLVED, sibling.outputs().state());
        assertEquals(DeferredState.FAILED, rule.outputs().state());
        assertEquals(DeferredState.FAILED, perm.outputs().state());

        ResolutionException ruleError = (ResolutionException) rule.output("arn").failure();
        assertEquals("SubRule", ruleError.identity());
        assertTrue(ruleError.getMessage().contains("topic rule quota exceeded"));

        ResolutionException permError = (ResolutionException) perm.output("id").failure();
        assertEquals("SubPermission", permError.identity());
        assertEquals("SubRule", permError.failedIdentity());

        assertFalse(engine.provisionLog().contains("SubPermission"));
        assertTrue(events.contains("error:SubRule"));
        assertTrue(events.contains("error:SubPermission"));
    }

    @Test
    public void testReleaseBeforeProvisionCancels() throws Exception {
        ResourceNode fn = function("SubHandler");
        ResourceNode rule = rule("SubRule", fn);
        engine.register(fn);
        engine.register(rule);

        engine.release(rule);
        engine.release(fn);
        provision();

        assertEquals(DeferredState.CANCELLED, fn.outputs().state());
        assertEquals(DeferredState.CANCELLED, rule.outputs().state());
        assertEquals(List.of("SubRule", "SubHandler"), engine.releaseLog());
        assertTrue(engine.provisionLog().isEmpty());
        assertFalse(engine.isRegistered("SubHandler"));
        assertTrue(events.contains("cancel:SubRule"));
    }

    @Test
    public void testReleasedUpstreamCancelsDependent() throws Exception {
        ResourceNode fn = function("SubHandler");
        ResourceNode rule = rule("SubRule", fn);
        engine.register(fn);
        engine.register(rule);
        engine.release(fn);
        provision();

        assertEquals(DeferredState.CANCELLED, rule.outputs().state());
    }

    @Test
    public void testReleaseAfterProvisionKeepsOutputs() throws Exception {
        ResourceNode fn = function("SubHandler");
        engine.register(fn);
        provision();

        engine.release(fn);
        assertEquals(DeferredState.RESOLVED, fn.outputs().state());
        assertEquals(List.of("SubHandler"), engine.releaseLog());
        assertFalse(events.contains("cancel:SubHandler"));
    }

    @Test
    public void testReleaseForgetsIdentity() throws Exception {
        ResourceNode first = function("SubHandler");
        engine.failOn("SubHandler", "boom");
        engine.register(first);
        assertEquals(1, engine.trackedCount());

        engine.release(first);
        assertEquals(0, engine.trackedCount());

        // a new node under the same identity is provisioned normally
        ResourceNode second = function("SubHandler");
        engine.register(second);
        provision();

        assertEquals(DeferredState.CANCELLED, first.outputs().state());
        assertEquals(DeferredState.RESOLVED, second.outputs().state());
        assertEquals(List.of("SubHandler"), engine.provisionLog());
    }

    @Test
    public void testReleaseIgnoresOtherNodeWithSameIdentity() {
        ResourceNode registered = function("SubHandler");
        engine.register(registered);

        engine.release(function("SubHandler"));

        assertTrue(engine.isRegistered("SubHandler"));
        assertEquals(DeferredState.PENDING, registered.outputs().state());
        assertTrue(engine.releaseLog().isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateRegistration() {
        engine.register(function("A"));
        engine.register(function("A"));
    }

    @Test(expected = IllegalStateException.class)
    public void testCycleInBatch() {
        engine.register(new ResourceNode("A", ResourceKind.FUNCTION, null, ResourceArgs.empty(), Set.of("B")));
        engine.register(new ResourceNode("B", ResourceKind.FUNCTION, null, ResourceArgs.empty(), Set.of("A")));
        engine.provision();
    }

    @Test(expected = IllegalStateException.class)
    public void testClosedEngineRejectsRegistration() {
        engine.close();
        engine.register(function("A"));
    }

    @Test
    public void testEmptyProvisionCompletes() throws Exception {
        assertTrue(engine.provision().isDone());
        provision();
        assertTrue(events.isEmpty());
    }
}
