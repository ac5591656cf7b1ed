package com.purchasingpower.codegraph.knowledge;

import com.purchasingpower.codegraph.model.graph.KnowledgeGraph;

import java.util.List;

/**
 * Interface for knowledge graph persistence.
 *
 * <p>The store is shared by many repositories. Each graph is identified by its root FileNode id and
 * consists of everything reachable from that root; no operation crosses into another graph.
 *
 * @since 1.0.0
 */
public interface GraphStore {

    // =========================================================================
    // Write Operations
    // =========================================================================

    /**
     * Persist a complete graph.
     *
     * <p>Node kinds are written before the edges that reference them. Writes are batched upserts
     * keyed by {@code node_id} and may be retried.
     *
     * @param graph Graph to write
     */
    void writeGraph(KnowledgeGraph graph);

    // =========================================================================
    // Read Operations
    // =========================================================================

    /**
     * Reconstruct the subgraph reachable from a root node.
     *
     * @param rootNodeId   Root FileNode id
     * @param maxAstDepth  Recorded on the returned graph, not re-derived
     * @param chunkSize    Recorded on the returned graph, not re-derived
     * @param chunkOverlap Recorded on the returned graph, not re-derived
     * @return The graph induced by reachability from the root
     */
    KnowledgeGraph readGraph(long rootNodeId, int maxAstDepth, int chunkSize, int chunkOverlap);

    /**
     * Check whether a graph with this root exists.
     *
     * @param rootNodeId Root FileNode id
     * @return true if the root node is stored
     */
    boolean graphExists(long rootNodeId);

    /**
     * First id that no stored node uses, 0 for an empty store.
     *
     * @return Start of a fresh id space
     */
    long nextNodeId();

    /**
     * Atomically claim a block of ids no other build can receive.
     *
     * <p>Concurrent callers, in this process or another one sharing the store, get disjoint
     * blocks. A block is never handed out twice, even when the build using it fails.
     *
     * @param count Number of ids to claim
     * @return First id of the claimed block
     */
    long reserveNodeIds(long count);

    /**
     * Root ids of all stored graphs.
     *
     * @return FileNode ids without an incoming HAS_FILE edge, ascending
     */
    List<Long> listRootNodeIds();

    // =========================================================================
    // Delete Operations
    // =========================================================================

    /**
     * Delete a root and everything reachable from it, in one transaction.
     *
     * @param rootNodeId Root FileNode id
     */
    void deleteGraph(long rootNodeId);

    /**
     * Delete every graph in the store, verifying the store is empty afterwards.
     */
    void deleteAllGraphs();
}
