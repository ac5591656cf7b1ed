package com.purchasingpower.codegraph.model.graph;

/**
 * One chunk of a documentation file.
 *
 * @param text     chunk content without its header lines
 * @param metadata enclosing headers, e.g. {@code {'Header 1': 'A'}}, or empty
 */
public record TextNode(String text, String metadata) implements NodePayload {

    public static final String LABEL = "TextNode";

    @Override
    public String label() {
        return LABEL;
    }
}
