/**
 * Read-only traversal tools over a stored knowledge graph.
 *
 * <p>Tools locate files, syntax nodes and documentation chunks, preview and read file content,
 * and step between neighbouring nodes. Results are rendered as numbered text within a token
 * budget and also returned as raw records.
 *
 * <p>Key classes:
 * <ul>
 *   <li>{@code GraphTraversalTools} - The tool set</li>
 *   <li>{@code QueryResultFormatter} - Text rendering of records</li>
 *   <li>{@code ContextExtractor} - Records to {@code CodeContext}</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.purchasingpower.codegraph.query;
