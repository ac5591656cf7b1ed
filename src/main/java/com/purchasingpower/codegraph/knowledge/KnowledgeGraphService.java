package com.purchasingpower.codegraph.knowledge;

import com.purchasingpower.codegraph.model.graph.KnowledgeGraph;

import java.nio.file.Path;

/**
 * Builds, loads and deletes repository knowledge graphs.
 *
 * <p>Only one build or delete per repository may run at a time; callers serialize this.
 *
 * @since 1.0.0
 */
public interface KnowledgeGraphService {

    /**
     * Build and persist the graph of a repository checkout with the configured AST depth.
     *
     * @param rootDir Repository root directory
     * @return Root node id of the new graph
     */
    long buildGraph(Path rootDir);

    /**
     * Build and persist the graph of a repository checkout.
     *
     * @param rootDir     Repository root directory
     * @param maxAstDepth Maximum PARENT_OF depth below each AST root
     * @return Root node id of the new graph
     */
    long buildGraph(Path rootDir, int maxAstDepth);

    /**
     * Load a persisted graph using the configured reconstruction parameters.
     */
    KnowledgeGraph loadGraph(long rootNodeId);

    /**
     * Load a persisted graph.
     */
    KnowledgeGraph loadGraph(long rootNodeId, int maxAstDepth, int chunkSize, int chunkOverlap);

    boolean graphExists(long rootNodeId);

    void deleteGraph(long rootNodeId);

    /**
     * Remove every graph from the store.
     */
    void deleteAllGraphs();

    /**
     * Directory tree of a persisted graph, limited by the configured depth and line count.
     */
    String renderFileTree(long rootNodeId);
}
