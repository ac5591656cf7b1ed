package com.purchasingpower.codegraph.parser;

import com.purchasingpower.codegraph.model.graph.GraphEdge;
import com.purchasingpower.codegraph.model.graph.GraphNode;

import java.util.List;

/**
 * Nodes and edges contributed by one file, excluding the file's own FileNode.
 */
public record FileGraph(List<GraphNode> nodes, List<GraphEdge> edges) {

    public static FileGraph empty() {
        return new FileGraph(List.of(), List.of());
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }
}
