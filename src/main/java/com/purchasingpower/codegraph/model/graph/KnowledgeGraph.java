package com.purchasingpower.codegraph.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * In-memory knowledge graph of one repository snapshot.
 * Output of GraphBuilder and Neo4jGraphStoreImpl#readGraph, input to the writer.
 */
@Getter
@Builder
@AllArgsConstructor
public class KnowledgeGraph {

    private static final String SPACE = "    ";
    private static final String BRANCH = "|   ";
    private static final String TEE = "├── ";
    private static final String LAST = "└── ";

    private final long rootNodeId;

    private final int maxAstDepth;

    private final int chunkSize;

    private final int chunkOverlap;

    @Builder.Default
    private final List<GraphNode> nodes = new ArrayList<>();

    @Builder.Default
    private final List<GraphEdge> edges = new ArrayList<>();

    public GraphNode getRootNode() {
        return nodes.stream()
                .filter(node -> node.nodeId() == rootNodeId)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Node with node_id " + rootNodeId + " not found"));
    }

    public List<GraphNode> getFileNodes() {
        return nodes.stream().filter(GraphNode::isFileNode).toList();
    }

    public List<GraphNode> getAstNodes() {
        return nodes.stream().filter(GraphNode::isAstNode).toList();
    }

    public List<GraphNode> getTextNodes() {
        return nodes.stream().filter(GraphNode::isTextNode).toList();
    }

    public List<GraphEdge> getEdges(EdgeType type) {
        return edges.stream().filter(edge -> edge.type() == type).toList();
    }

    /**
     * Number of ids between the root and the highest node id, inclusive.
     */
    public long getNodeIdSpan() {
        long maxId = nodes.stream().mapToLong(GraphNode::nodeId).max().orElse(rootNodeId);
        return maxId - rootNodeId + 1;
    }

    /**
     * Copy of this graph with every node id shifted so the root gets {@code firstNodeId}.
     * Payloads and edge structure are unchanged.
     */
    public KnowledgeGraph relocate(long firstNodeId) {
        long offset = firstNodeId - rootNodeId;
        if (offset == 0) {
            return this;
        }

        Map<Long, GraphNode> moved = new HashMap<>();
        List<GraphNode> relocatedNodes = new ArrayList<>(nodes.size());
        for (GraphNode node : nodes) {
            GraphNode copy = new GraphNode(node.nodeId() + offset, node.payload());
            moved.put(node.nodeId(), copy);
            relocatedNodes.add(copy);
        }

        List<GraphEdge> relocatedEdges = new ArrayList<>(edges.size());
        for (GraphEdge edge : edges) {
            relocatedEdges.add(new GraphEdge(
                    moved.get(edge.source().nodeId()), moved.get(edge.target().nodeId()), edge.type()));
        }

        return new KnowledgeGraph(firstNodeId, maxAstDepth, chunkSize, chunkOverlap, relocatedNodes, relocatedEdges);
    }

    /**
     * Distinct tree-sitter types present in the graph, sorted.
     */
    public List<String> getAstNodeTypes() {
        TreeSet<String> types = new TreeSet<>();
        for (GraphNode node : getAstNodes()) {
            types.add(node.asAstNode().type());
        }
        return new ArrayList<>(types);
    }

    /**
     * Renders the directory structure like the Unix {@code tree} command.
     *
     * @param maxDepth entries deeper than this are omitted, the root is depth 0
     * @param maxLines output stops after this many lines
     */
    public String renderFileTree(int maxDepth, int maxLines) {
        Map<Long, List<GraphNode>> children = new HashMap<>();
        for (GraphEdge edge : getEdges(EdgeType.HAS_FILE)) {
            children.computeIfAbsent(edge.source().nodeId(), id -> new ArrayList<>()).add(edge.target());
        }

        Deque<TreeEntry> stack = new ArrayDeque<>();
        stack.push(new TreeEntry(getRootNode(), 0, "", false));
        List<String> lines = new ArrayList<>();

        while (!stack.isEmpty() && lines.size() < maxLines) {
            TreeEntry entry = stack.pop();
            if (entry.depth() > maxDepth) {
                continue;
            }

            String pointer = entry.last() ? LAST : TEE;
            String linePrefix = entry.depth() == 0 ? "" : entry.prefix() + pointer;
            lines.add(linePrefix + entry.node().asFileNode().basename());

            List<GraphNode> sorted = new ArrayList<>(children.getOrDefault(entry.node().nodeId(), List.of()));
            sorted.sort(Comparator.comparing(node -> node.asFileNode().basename()));

            // reverse push so the first child is rendered first
            for (int i = sorted.size() - 1; i >= 0; i--) {
                String extension = entry.last() ? SPACE : BRANCH;
                String childPrefix = entry.depth() == 0 ? "" : entry.prefix() + extension;
                stack.push(new TreeEntry(sorted.get(i), entry.depth() + 1, childPrefix, i == sorted.size() - 1));
            }
        }
        return String.join("\n", lines);
    }

    private record TreeEntry(GraphNode node, int depth, String prefix, boolean last) {
    }
}
