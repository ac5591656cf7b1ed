package com.purchasingpower.codegraph.model.graph;

/**
 * Content carried by a {@link GraphNode}.
 *
 * <p>Exactly three variants exist: {@link FileNode}, {@link AstNode} and {@link TextNode}.
 * Each variant maps to one Neo4j label.
 */
public interface NodePayload {

    /**
     * Neo4j label the payload is stored under.
     */
    String label();
}
