package com.purchasingpower.codegraph.model.graph;

/**
 * Hands out node ids for one graph build.
 *
 * <p>Ids increase by one from the starting value. One allocator is created per build and passed to
 * every component that creates nodes; it is not thread-safe.
 */
public class NodeIdAllocator {

    private long nextId;

    public NodeIdAllocator(long firstId) {
        if (firstId < 0) {
            throw new IllegalArgumentException("firstId must be non-negative: " + firstId);
        }
        this.nextId = firstId;
    }

    public long allocate() {
        return nextId++;
    }

    public GraphNode newNode(NodePayload payload) {
        return new GraphNode(allocate(), payload);
    }

    /**
     * The id the next call to {@link #allocate()} will return.
     */
    public long peek() {
        return nextId;
    }
}
