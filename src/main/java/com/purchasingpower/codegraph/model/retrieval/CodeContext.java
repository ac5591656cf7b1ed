package com.purchasingpower.codegraph.model.retrieval;

/**
 * A piece of repository content picked out of a traversal tool result.
 *
 * <p>Handed to the calling agent as context for its next step.
 *
 * @param relativePath file the content belongs to
 * @param content      code or documentation text
 * @param startLine    first line of the content, {@code null} for documentation chunks
 * @param endLine      last line of the content, {@code null} for documentation chunks
 *
 * @see com.purchasingpower.codegraph.query.ContextExtractor
 */
public record CodeContext(
        String relativePath,
        String content,
        Integer startLine,
        Integer endLine
) {
}
