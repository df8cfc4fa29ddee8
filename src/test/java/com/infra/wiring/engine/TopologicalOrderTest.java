package com.infra.wiring.engine;

import com.infra.wiring.node.ResourceArgs;
import com.infra.wiring.node.ResourceKind;
import com.infra.wiring.node.ResourceNode;
import org.junit.Test;

import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;

public class TopologicalOrderTest {

    // Helper to create a node with explicit dependencies
    private ResourceNode node(String identity, String... deps) {
        return new ResourceNode(identity, ResourceKind.FUNCTION, null, ResourceArgs.empty(), Set.of(deps));
    }

    @Test
    public void testEmptyGraph() {
        TopologicalOrder order = TopologicalOrder.builder().build();
        assertEquals(0, order.nodeCount());
    }

    @Test
    public void testSingleNode() {
        TopologicalOrder order = TopologicalOrder.builder()
                .addNode(node("A"))
                .build();

        assertEquals(1, order.nodeCount());
        assertEquals("A", order.node(0).identity());
        assertEquals(0, order.topoIndex("A"));
        assertTrue(order.isRoot(0));
        assertEquals(0, order.childCount(0));
        assertEquals(0, order.parentCount(0));
    }

    @Test
    public void testLinearGraph() {
        // C depends on B depends on A, registered backwards
        TopologicalOrder order = TopologicalOrder.of(List.of(node("C", "B"), node("B", "A"), node("A")));

        assertEquals(3, order.nodeCount());
        assertEquals("A", order.node(0).identity());
        assertEquals("B", order.node(1).identity());
        assertEquals("C", order.node(2).identity());

        int a = order.topoIndex("A");
        assertEquals(1, order.childCount(a));
        assertEquals(order.topoIndex("B"), order.child(a, 0));
        assertFalse(order.isRoot(order.topoIndex("C")));
    }

    @Test
    public void testDiamondGraph() {
        // Handler <- Rule <- Permission, Handler <- Permission
        TopologicalOrder order = TopologicalOrder.of(List.of(
                node("Handler"),
                node("Rule", "Handler"),
                node("Permission", "Handler", "Rule")));

        assertEquals(2, order.childCount(order.topoIndex("Handler")));
        assertEquals(2, order.parentCount(order.topoIndex("Permission")));
        assertTrue(order.topoIndex("Rule") < order.topoIndex("Permission"));
    }

    @Test
    public void testIndependentNodesKeepRegistrationOrder() {
        TopologicalOrder order = TopologicalOrder.of(List.of(node("Z"), node("M"), node("A")));
        assertEquals(List.of("Z", "M", "A"), order.nodes().stream().map(ResourceNode::identity).toList());
    }

    @Test
    public void testDependentIsQueuedBehindLaterRoots() {
        // B is registered before C but waits for A to be emitted
        TopologicalOrder order = TopologicalOrder.of(List.of(node("A"), node("B", "A"), node("C")));
        assertEquals(List.of("A", "C", "B"), order.nodes().stream().map(ResourceNode::identity).toList());
    }

    @Test
    public void testDependenciesOutsideTheSetAreIgnored() {
        TopologicalOrder order = TopologicalOrder.of(List.of(node("B", "External")));
        assertTrue(order.isRoot(0));
        assertFalse(order.contains("External"));
    }

    @Test(expected = IllegalStateException.class)
    public void testCycleDetection() {
        TopologicalOrder.of(List.of(node("A", "B"), node("B", "A")));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateNode() {
        TopologicalOrder.builder().addNode(node("A")).addNode(node("A"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSelfEdge() {
        TopologicalOrder.builder().addNode(node("A")).addEdge("A", "A");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownIdentity() {
        TopologicalOrder.builder().build().topoIndex("missing");
    }
}
