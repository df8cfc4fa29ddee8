package com.infra.wiring.engine;

import com.infra.wiring.node.ResourceNode;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Immutable provisioning order over a set of declared resources.
 *
 * Nodes are sorted so that iterating 0..N-1 visits every resource after all of
 * the resources it depends on. The sort is a FIFO Kahn pass seeded in
 * registration order, so the result is deterministic for a given input; it
 * does not preserve registration order between unrelated nodes.
 *
 * Data layout:
 * - topoOrder: nodes in provisioning order.
 * - childrenOffset / childrenList: flattened dependents. The dependents of node
 * i are childrenList[childrenOffset[i]] inclusive to
 * childrenList[childrenOffset[i+1]] exclusive, as topological indices.
 */
@Log4j2
public final class TopologicalOrder {
    private final ResourceNode[] topoOrder;
    private final int[] childrenOffset;
    private final int[] childrenList;
    private final int[] parentCount;
    private final Map<String, Integer> identityToIndex;

    private TopologicalOrder(ResourceNode[] topoOrder, int[] childrenOffset, int[] childrenList,
            int[] parentCount, Map<String, Integer> identityToIndex) {
        this.topoOrder = topoOrder;
        this.childrenOffset = childrenOffset;
        this.childrenList = childrenList;
        this.parentCount = parentCount;
        this.identityToIndex = identityToIndex;
    }

    public int nodeCount() {
        return topoOrder.length;
    }

    /** Returns the node at the given topological index. */
    public ResourceNode node(int ti) {
        return topoOrder[ti];
    }

    /** Resolves an identity to its topological index. */
    public int topoIndex(String identity) {
        Integer idx = identityToIndex.get(identity);
        if (idx == null)
            throw new IllegalArgumentException("Unknown resource: " + identity);
        return idx;
    }

    public boolean contains(String identity) {
        return identityToIndex.containsKey(identity);
    }

    /** True if the node depends on no other node of this order. */
    public boolean isRoot(int ti) {
        return parentCount[ti] == 0;
    }

    /** Number of nodes that depend on node {@code ti}. */
    public int childCount(int ti) {
        return childrenOffset[ti + 1] - childrenOffset[ti];
    }

    public int child(int ti, int i) {
        return childrenList[childrenOffset[ti] + i];
    }

    /** Number of nodes of this order that node {@code ti} depends on. */
    public int parentCount(int ti) {
        return parentCount[ti];
    }

    /** Nodes in provisioning order. */
    public List<ResourceNode> nodes() {
        return List.of(topoOrder);
    }

    /**
     * Builds an order from declared nodes, adding an edge for every dependency
     * whose identity is part of {@code nodes}. Dependencies on resources outside
     * the set are left to their own owner.
     */
    public static TopologicalOrder of(Collection<ResourceNode> nodes) {
        Builder b = builder();
        for (ResourceNode node : nodes)
            b.addNode(node);
        for (ResourceNode node : nodes) {
            for (String dep : node.dependsOn()) {
                if (b.identityToIdx.containsKey(dep))
                    b.addEdge(dep, node.identity());
            }
        }
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for constructing the TopologicalOrder.
     * Handles cycle detection and topological sorting.
     */
    public static final class Builder {
        private final List<ResourceNode> nodes = new ArrayList<>();
        private final Map<String, Integer> identityToIdx = new HashMap<>();
        private final Map<Integer, List<Integer>> forwardEdges = new HashMap<>();

        public Builder addNode(ResourceNode node) {
            if (identityToIdx.containsKey(node.identity()))
                throw new IllegalArgumentException("Duplicate resource identity: " + node.identity());
            int idx = nodes.size();
            nodes.add(node);
            identityToIdx.put(node.identity(), idx);
            forwardEdges.put(idx, new ArrayList<>());
            return this;
        }

        /** Records that {@code to} must be provisioned after {@code from}. */
        public Builder addEdge(String from, String to) {
            if (from.equals(to))
                throw new IllegalArgumentException("Self-edge not allowed: " + from);
            List<Integer> edges = forwardEdges.get(requireIndex(from));
            int target = requireIndex(to);
            if (!edges.contains(target))
                edges.add(target);
            return this;
        }

        private int requireIndex(String identity) {
            Integer idx = identityToIdx.get(identity);
            if (idx == null)
                throw new IllegalArgumentException("Unknown resource: " + identity);
            return idx;
        }

        /**
         * Sorts the graph with Kahn's algorithm.
         *
         * @throws IllegalStateException if the dependencies form a cycle.
         */
        public TopologicalOrder build() {
            int n = nodes.size();
            int[] inDegree = new int[n];

            for (var entry : forwardEdges.entrySet())
                for (int child : entry.getValue())
                    inDegree[child]++;

            int[] queue = new int[n];
            int head = 0, tail = 0;
            for (int i = 0; i < n; i++)
                if (inDegree[i] == 0)
                    queue[tail++] = i;

            int[] topoMap = new int[n], reverseMap = new int[n];
            int topoIdx = 0;
            while (head < tail) {
                int curr = queue[head++];
                topoMap[curr] = topoIdx;
                reverseMap[topoIdx] = curr;
                topoIdx++;
                for (int child : forwardEdges.get(curr))
                    if (--inDegree[child] == 0)
                        queue[tail++] = child;
            }
            if (topoIdx != n) {
                List<String> stuck = new ArrayList<>();
                for (int i = 0; i < n; i++)
                    if (inDegree[i] > 0)
                        stuck.add(nodes.get(i).identity());
                throw new IllegalStateException("Dependency cycle detected between resources " + stuck);
            }

            ResourceNode[] ordered = new ResourceNode[n];
            int[] parentCounts = new int[n];
            Map<String, Integer> index = new HashMap<>(n * 2);
            for (int ti = 0; ti < n; ti++) {
                ordered[ti] = nodes.get(reverseMap[ti]);
                index.put(ordered[ti].identity(), ti);
            }

            int[] offsets = new int[n + 1];
            for (int ti = 0; ti < n; ti++)
                offsets[ti + 1] = offsets[ti] + forwardEdges.get(reverseMap[ti]).size();

            int[] flatChildren = new int[offsets[n]];
            for (int ti = 0; ti < n; ti++) {
                List<Integer> children = forwardEdges.get(reverseMap[ti]);
                int base = offsets[ti];
                for (int j = 0; j < children.size(); j++) {
                    int childTi = topoMap[children.get(j)];
                    flatChildren[base + j] = childTi;
                    parentCounts[childTi]++;
                }
            }
            log.debug("Ordered {} resources with {} dependency edges", n, offsets[n]);
            return new TopologicalOrder(ordered, offsets, flatChildren, parentCounts, index);
        }
    }
}
