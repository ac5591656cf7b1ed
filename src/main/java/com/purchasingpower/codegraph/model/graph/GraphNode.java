package com.purchasingpower.codegraph.model.graph;

/**
 * A node of the knowledge graph: an id plus its payload.
 */
public record GraphNode(long nodeId, NodePayload payload) {

    public boolean isFileNode() {
        return payload instanceof FileNode;
    }

    public boolean isAstNode() {
        return payload instanceof AstNode;
    }

    public boolean isTextNode() {
        return payload instanceof TextNode;
    }

    public FileNode asFileNode() {
        return (FileNode) payload;
    }

    public AstNode asAstNode() {
        return (AstNode) payload;
    }

    public TextNode asTextNode() {
        return (TextNode) payload;
    }
}
