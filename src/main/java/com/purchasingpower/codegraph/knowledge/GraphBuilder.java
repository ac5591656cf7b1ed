package com.purchasingpower.codegraph.knowledge;

import com.purchasingpower.codegraph.model.CallContext;
import com.purchasingpower.codegraph.model.ServiceType;
import com.purchasingpower.codegraph.model.graph.EdgeType;
import com.purchasingpower.codegraph.model.graph.FileNode;
import com.purchasingpower.codegraph.model.graph.GraphEdge;
import com.purchasingpower.codegraph.model.graph.GraphNode;
import com.purchasingpower.codegraph.model.graph.KnowledgeGraph;
import com.purchasingpower.codegraph.model.graph.NodeIdAllocator;
import com.purchasingpower.codegraph.parser.FileGraph;
import com.purchasingpower.codegraph.parser.FileType;
import com.purchasingpower.codegraph.parser.LanguageRegistry;
import com.purchasingpower.codegraph.parser.MarkdownDocumentChunker;
import com.purchasingpower.codegraph.parser.TreeSitterAstExtractor;
import com.purchasingpower.codegraph.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.stream.Stream;

/**
 * Builds the in-memory knowledge graph of a directory tree.
 *
 * <p>The walk is depth-first with an explicit stack and visits the entries of each directory in
 * lexicographic order, so the same tree always yields the same node set. Every node id comes from
 * the single {@link NodeIdAllocator} created for the build.
 *
 * <p>Per-file problems (unsupported type, syntax errors, undecodable bytes, read failures) are
 * logged and never fail the build; the file keeps its FileNode.
 */
@Slf4j
public class GraphBuilder {

    private final int maxAstDepth;
    private final int chunkSize;
    private final int chunkOverlap;
    private final TreeSitterAstExtractor astExtractor;
    private final MarkdownDocumentChunker documentChunker;

    public GraphBuilder(int maxAstDepth, int chunkSize, int chunkOverlap) {
        this.maxAstDepth = maxAstDepth;
        this.chunkSize = chunkSize;
        this.chunkOverlap = chunkOverlap;
        this.astExtractor = new TreeSitterAstExtractor(maxAstDepth);
        this.documentChunker = new MarkdownDocumentChunker(chunkSize, chunkOverlap);
    }

    /**
     * Builds the graph of {@code rootDir} with ids starting at {@code firstNodeId}.
     *
     * @throws UncheckedIOException if a directory cannot be listed
     */
    public KnowledgeGraph build(Path rootDir, long firstNodeId) {
        Path root = rootDir.toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("Not a directory: " + root);
        }

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.FILESYSTEM, "BuildGraph", log);
        ctx.logRequest("Walking " + root, "FirstNodeId", firstNodeId, "MaxAstDepth", maxAstDepth);

        NodeIdAllocator ids = new NodeIdAllocator(firstNodeId);
        GitignoreFilter ignoreFilter = new GitignoreFilter(root);
        List<GraphNode> nodes = new ArrayList<>();
        List<GraphEdge> edges = new ArrayList<>();

        String rootName = root.getFileName() == null ? root.toString() : root.getFileName().toString();
        GraphNode rootNode = ids.newNode(new FileNode(rootName, "."));
        nodes.add(rootNode);

        Deque<PendingEntry> stack = new ArrayDeque<>();
        stack.push(new PendingEntry(root, rootNode));

        while (!stack.isEmpty()) {
            PendingEntry entry = stack.pop();

            // symlinked directories below the root are not followed
            if (entry.node() == rootNode || Files.isDirectory(entry.path(), LinkOption.NOFOLLOW_LINKS)) {
                log.info("Processing directory {}", entry.path());
                for (Path child : sortedChildren(entry.path())) {
                    boolean childIsDirectory = Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS);
                    if (ignoreFilter.isIgnored(child, childIsDirectory)) {
                        log.info("Skipping {} because it is ignored", child);
                        continue;
                    }

                    GraphNode childNode = ids.newNode(new FileNode(
                            child.getFileName().toString(),
                            root.relativize(child).toString().replace('\\', '/')));
                    nodes.add(childNode);
                    edges.add(new GraphEdge(entry.node(), childNode, EdgeType.HAS_FILE));
                    stack.push(new PendingEntry(child, childNode));
                }
            } else {
                FileGraph fileGraph = buildFileGraph(entry.path(), entry.node(), ids);
                nodes.addAll(fileGraph.nodes());
                edges.addAll(fileGraph.edges());
            }
        }

        KnowledgeGraph graph = KnowledgeGraph.builder()
                .rootNodeId(rootNode.nodeId())
                .maxAstDepth(maxAstDepth)
                .chunkSize(chunkSize)
                .chunkOverlap(chunkOverlap)
                .nodes(nodes)
                .edges(edges)
                .build();

        ctx.logResponse("Graph built",
                "FileNodes", graph.getFileNodes().size(),
                "ASTNodes", graph.getAstNodes().size(),
                "TextNodes", graph.getTextNodes().size(),
                "Edges", edges.size());
        return graph;
    }

    private FileGraph buildFileGraph(Path file, GraphNode fileNode, NodeIdAllocator ids) {
        FileType fileType = LanguageRegistry.fileTypeOf(file);
        if (!fileType.hasGrammar() && fileType != FileType.TEXT) {
            log.info("Skip parsing {} because it is not supported", file);
            return FileGraph.empty();
        }
        if (!Files.isRegularFile(file)) {
            log.info("Skip parsing {} because it is not a regular file", file);
            return FileGraph.empty();
        }

        log.info("Processing file {}", file);
        String content;
        try {
            content = decodeUtf8(Files.readAllBytes(file));
        } catch (CharacterCodingException e) {
            log.warn("Skip parsing {} because it is not valid UTF-8", file);
            return FileGraph.empty();
        } catch (IOException e) {
            log.warn("Skip parsing {} because it could not be read: {}", file, e.getMessage());
            return FileGraph.empty();
        }

        if (fileType.hasGrammar()) {
            return astExtractor.extract(fileNode, fileType, content, ids);
        }
        return documentChunker.extract(fileNode, content, ids);
    }

    private static List<Path> sortedChildren(Path directory) {
        try (Stream<Path> children = Files.list(directory)) {
            return children
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list directory " + directory, e);
        }
    }

    private static String decodeUtf8(byte[] bytes) throws CharacterCodingException {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
    }

    private record PendingEntry(Path path, GraphNode node) {
    }
}
