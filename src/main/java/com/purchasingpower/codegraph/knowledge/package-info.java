/**
 * Knowledge graph construction and storage.
 *
 * <p>This package turns a repository checkout into a graph and keeps it in Neo4j:
 * <ul>
 *   <li>Graph building - directory walk, ignore rules, AST and chunk extraction</li>
 *   <li>Graph storage - batched writes, root-scoped reads, deletes</li>
 * </ul>
 *
 * <p>Key classes:
 * <ul>
 *   <li>{@code GraphBuilder} - Builds the in-memory graph of one snapshot</li>
 *   <li>{@code GraphStore} - Neo4j persistence of whole graphs</li>
 *   <li>{@code KnowledgeGraphService} - Build/load/delete entry point</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.purchasingpower.codegraph.knowledge;
