package com.purchasingpower.codegraph.model.graph;

/**
 * A file or directory of the indexed repository.
 *
 * @param basename     last path segment, e.g. {@code test.java}
 * @param relativePath path relative to the repository root, {@code "."} for the root itself
 */
public record FileNode(String basename, String relativePath) implements NodePayload {

    public static final String LABEL = "FileNode";

    @Override
    public String label() {
        return LABEL;
    }
}
