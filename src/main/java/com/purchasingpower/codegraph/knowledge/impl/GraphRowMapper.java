package com.purchasingpower.codegraph.knowledge.impl;

import com.purchasingpower.codegraph.model.graph.AstNode;
import com.purchasingpower.codegraph.model.graph.FileNode;
import com.purchasingpower.codegraph.model.graph.GraphEdge;
import com.purchasingpower.codegraph.model.graph.GraphNode;
import com.purchasingpower.codegraph.model.graph.NodePayload;
import com.purchasingpower.codegraph.model.graph.TextNode;

import java.util.HashMap;
import java.util.Map;

/**
 * Converts graph nodes and edges to and from Neo4j property rows.
 *
 * <p>Property names follow the stored schema: {@code node_id}, {@code basename},
 * {@code relative_path}, {@code type}, {@code start_line}, {@code end_line}, {@code text},
 * {@code metadata}; edges are {@code source_id}/{@code target_id} pairs.
 */
final class GraphRowMapper {

    static final String NODE_ID = "node_id";
    static final String SOURCE_ID = "source_id";
    static final String TARGET_ID = "target_id";

    private GraphRowMapper() {
    }

    static Map<String, Object> toRow(GraphNode node) {
        Map<String, Object> row = new HashMap<>();
        row.put(NODE_ID, node.nodeId());
        NodePayload payload = node.payload();
        if (payload instanceof FileNode file) {
            row.put("basename", file.basename());
            row.put("relative_path", file.relativePath());
        } else if (payload instanceof AstNode ast) {
            row.put("type", ast.type());
            row.put("start_line", ast.startLine());
            row.put("end_line", ast.endLine());
            row.put("text", ast.text());
        } else if (payload instanceof TextNode text) {
            row.put("text", text.text());
            row.put("metadata", text.metadata());
        } else {
            throw new IllegalArgumentException("Unknown payload type: " + payload);
        }
        return row;
    }

    static Map<String, Object> toRow(GraphEdge edge) {
        return Map.of(
                SOURCE_ID, edge.source().nodeId(),
                TARGET_ID, edge.target().nodeId());
    }

    static GraphNode fileNode(Map<String, Object> row) {
        return new GraphNode(getLong(row, NODE_ID),
                new FileNode(getString(row, "basename"), getString(row, "relative_path")));
    }

    static GraphNode astNode(Map<String, Object> row) {
        return new GraphNode(getLong(row, NODE_ID), new AstNode(
                getString(row, "type"),
                (int) getLong(row, "start_line"),
                (int) getLong(row, "end_line"),
                getString(row, "text")));
    }

    static GraphNode textNode(Map<String, Object> row) {
        return new GraphNode(getLong(row, NODE_ID),
                new TextNode(getString(row, "text"), getString(row, "metadata")));
    }

    static long getLong(Map<String, Object> row, String key) {
        Object value = row.get(key);
        if (!(value instanceof Number number)) {
            throw new IllegalStateException("Missing numeric property '" + key + "' in " + row.keySet());
        }
        return number.longValue();
    }

    private static String getString(Map<String, Object> row, String key) {
        Object value = row.get(key);
        return value != null ? value.toString() : "";
    }
}
