package com.purchasingpower.codegraph.model.graph;

/**
 * Directed, typed edge between two graph nodes.
 */
public record GraphEdge(GraphNode source, GraphNode target, EdgeType type) {
}
