package com.infra.wiring.node;

import com.infra.wiring.value.Deferred;
import com.infra.wiring.value.DeferredState;
import org.junit.Test;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.junit.Assert.*;

public class ResourceNodeTest {

    @Test
    public void testDependsOnIsUnionOfArgsAndExplicit() {
        Deferred<String> arn = Deferred.of(new CompletableFuture<>(), Set.of("A"));
        ResourceNode node = new ResourceNode("B", ResourceKind.TOPIC_RULE, null,
                ResourceArgs.of("target", arn), Set.of("C"));
        assertEquals(Set.of("A", "C"), node.dependsOn());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSelfDependencyRejected() {
        new ResourceNode("A", ResourceKind.FUNCTION, null, ResourceArgs.empty(), Set.of("A"));
    }

    @Test
    public void testOutputsFollowKind() {
        ResourceNode fn = new ResourceNode("F", ResourceKind.FUNCTION, null, ResourceArgs.empty(), Set.of());
        ResourceNode perm = new ResourceNode("P", ResourceKind.PERMISSION, null, ResourceArgs.empty(), Set.of());

        assertEquals(Set.of("arn", "name"), fn.outputs().fieldNames());
        assertEquals(Set.of("id"), perm.outputs().fieldNames());
        assertEquals(Set.of("F"), fn.output("arn").dependencies());
        assertEquals(DeferredState.PENDING, fn.outputs().state());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownOutputRejected() {
        new ResourceNode("P", ResourceKind.PERMISSION, null, ResourceArgs.empty(), Set.of()).output("arn");
    }

    @Test
    public void testMissingOutputFailsOnlyThatField() {
        ResourceNode fn = new ResourceNode("F", ResourceKind.FUNCTION, null, ResourceArgs.empty(), Set.of());
        fn.outputs().settle(Map.of("arn", "arn:1"));

        assertEquals("arn:1", fn.output("arn").now().get());
        assertEquals(DeferredState.FAILED, fn.output("name").state());
        assertEquals(DeferredState.FAILED, fn.outputs().state());
    }

    @Test
    public void testCancelLeavesSettledOutputsAlone() {
        ResourceNode fn = new ResourceNode("F", ResourceKind.FUNCTION, null, ResourceArgs.empty(), Set.of());
        fn.outputs().settle(Map.of("arn", "arn:1", "name", "f"));
        assertFalse(fn.outputs().cancel());
        assertEquals(DeferredState.RESOLVED, fn.outputs().state());
    }

    @Test
    public void testKindFromString() {
        assertEquals(ResourceKind.TOPIC_RULE, ResourceKind.fromString("topicRule"));
        assertEquals(ResourceKind.PERMISSION, ResourceKind.fromString("PERMISSION"));
        assertEquals(ResourceKind.FUNCTION, ResourceKind.fromString("function"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testKindFromStringUnknown() {
        ResourceKind.fromString("queue");
    }
}
