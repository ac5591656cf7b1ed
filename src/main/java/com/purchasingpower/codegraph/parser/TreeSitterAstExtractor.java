package com.purchasingpower.codegraph.parser;

import com.purchasingpower.codegraph.model.graph.AstNode;
import com.purchasingpower.codegraph.model.graph.EdgeType;
import com.purchasingpower.codegraph.model.graph.GraphEdge;
import com.purchasingpower.codegraph.model.graph.GraphNode;
import com.purchasingpower.codegraph.model.graph.NodeIdAllocator;
import lombok.extern.slf4j.Slf4j;
import org.treesitter.TSInputEncoding;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSReader;
import org.treesitter.TSTree;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * Flattens a file's tree-sitter syntax tree into ASTNodes linked by PARENT_OF.
 *
 * <p>Nodes deeper than {@code maxAstDepth} PARENT_OF hops below the file's AST root are never
 * created. Traversal uses an explicit stack so deeply nested sources cannot overflow the call
 * stack.
 *
 * <p>Not thread-safe: a {@link TSParser} is created per call and must not be shared.
 */
@Slf4j
public class TreeSitterAstExtractor {

    private final int maxAstDepth;

    public TreeSitterAstExtractor(int maxAstDepth) {
        if (maxAstDepth < 1) {
            throw new IllegalArgumentException("maxAstDepth must be at least 1: " + maxAstDepth);
        }
        this.maxAstDepth = maxAstDepth;
    }

    /**
     * Parses {@code source} and builds the AST subgraph below {@code fileNode}.
     *
     * @return empty when the grammar reports a syntax error or the tree has no top-level children
     */
    public FileGraph extract(GraphNode fileNode, FileType fileType, String source, NodeIdAllocator ids) {
        TSParser parser = new TSParser();
        if (!parser.setLanguage(fileType.newLanguage())) {
            throw new IllegalStateException("Failed to set tree-sitter language " + fileType);
        }

        byte[] bytes = source.getBytes(StandardCharsets.UTF_8);
        TSTree tree = parse(parser, bytes);
        TSNode root = tree.getRootNode();
        if (root.hasError() || root.getChildCount() == 0) {
            if (source.indexOf('\0') >= 0) {
                // grammars lex NUL as end of input, so such files never parse cleanly
                log.warn("No AST for {}: source contains NUL characters", fileNode.asFileNode().relativePath());
            } else {
                log.debug("No usable AST for {} (error={}, children={})",
                        fileNode.asFileNode().relativePath(), root.hasError(), root.getChildCount());
            }
            return FileGraph.empty();
        }

        List<GraphNode> nodes = new ArrayList<>();
        List<GraphEdge> edges = new ArrayList<>();

        GraphNode astRoot = ids.newNode(toAstNode(root, bytes));
        nodes.add(astRoot);
        edges.add(new GraphEdge(fileNode, astRoot, EdgeType.HAS_AST));

        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, astRoot, 1));
        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            if (frame.depth() > maxAstDepth) {
                continue;
            }

            int childCount = frame.syntaxNode().getChildCount();
            for (int i = 0; i < childCount; i++) {
                TSNode child = frame.syntaxNode().getChild(i);
                GraphNode childNode = ids.newNode(toAstNode(child, bytes));
                nodes.add(childNode);
                edges.add(new GraphEdge(frame.graphNode(), childNode, EdgeType.PARENT_OF));
                stack.push(new Frame(child, childNode, frame.depth() + 1));
            }
        }

        log.debug("Extracted {} AST nodes from {}", nodes.size(), fileNode.asFileNode().relativePath());
        return new FileGraph(nodes, edges);
    }

    /**
     * Feeds the raw UTF-8 bytes to the parser, so node byte offsets index {@code source} exactly,
     * supplementary code points included.
     */
    private static TSTree parse(TSParser parser, byte[] source) {
        byte[] buffer = new byte[Math.max(source.length, 1)];
        TSReader reader = (buf, offset, position) -> {
            if (offset >= source.length) {
                return 0;
            }
            int length = Math.min(buf.length, source.length - offset);
            System.arraycopy(source, offset, buf, 0, length);
            return length;
        };
        return parser.parse(buffer, null, reader, TSInputEncoding.TSInputEncodingUTF8);
    }

    private static AstNode toAstNode(TSNode node, byte[] source) {
        String text = new String(Arrays.copyOfRange(source, node.getStartByte(), node.getEndByte()),
                StandardCharsets.UTF_8);
        return new AstNode(node.getType(), node.getStartPoint().getRow(), node.getEndPoint().getRow(), text);
    }

    private record Frame(TSNode syntaxNode, GraphNode graphNode, int depth) {
    }
}
