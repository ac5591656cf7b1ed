package com.purchasingpower.codegraph.model.graph;

/**
 * One tree-sitter syntax node.
 *
 * @param type      grammar node type, e.g. {@code method_invocation}
 * @param startLine 0-indexed first line
 * @param endLine   0-indexed last line, inclusive
 * @param text      exact source slice covered by the node
 */
public record AstNode(String type, int startLine, int endLine, String text) implements NodePayload {

    public static final String LABEL = "ASTNode";

    @Override
    public String label() {
        return LABEL;
    }
}
