package com.purchasingpower.codegraph.model.graph;

/**
 * Relationship types of the knowledge graph, with the labels they connect.
 *
 * <p>Constants are declared in the order the writer persists them.
 */
public enum EdgeType {
    HAS_AST(FileNode.LABEL, AstNode.LABEL),
    HAS_FILE(FileNode.LABEL, FileNode.LABEL),
    HAS_TEXT(FileNode.LABEL, TextNode.LABEL),
    NEXT_CHUNK(TextNode.LABEL, TextNode.LABEL),
    PARENT_OF(AstNode.LABEL, AstNode.LABEL);

    private final String sourceLabel;
    private final String targetLabel;

    EdgeType(String sourceLabel, String targetLabel) {
        this.sourceLabel = sourceLabel;
        this.targetLabel = targetLabel;
    }

    public String getSourceLabel() {
        return sourceLabel;
    }

    public String getTargetLabel() {
        return targetLabel;
    }
}
