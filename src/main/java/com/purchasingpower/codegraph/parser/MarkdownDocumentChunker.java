package com.purchasingpower.codegraph.parser;

import com.purchasingpower.codegraph.model.graph.EdgeType;
import com.purchasingpower.codegraph.model.graph.GraphEdge;
import com.purchasingpower.codegraph.model.graph.GraphNode;
import com.purchasingpower.codegraph.model.graph.NodeIdAllocator;
import com.purchasingpower.codegraph.model.graph.TextNode;
import com.vladsch.flexmark.ast.Heading;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.ast.Node;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Splits documentation files into header-delimited chunks linked by NEXT_CHUNK.
 *
 * <ul>
 *   <li>Headings of level 1 to 3 open a new section; deeper headings are ordinary content.</li>
 *   <li>Each section is tagged with its enclosing headings, e.g. {@code {'Header 1': 'A', 'Header 2': 'B'}}.</li>
 *   <li>Heading lines are not part of chunk text.</li>
 *   <li>Sections longer than {@code chunkSize} characters are cut into overlapping pieces.</li>
 * </ul>
 *
 * Only the first chunk of a file is linked from the FileNode (HAS_TEXT); the others are reached
 * through the NEXT_CHUNK chain.
 */
@Slf4j
public class MarkdownDocumentChunker {

    private static final int MAX_SPLIT_LEVEL = 3;
    private static final String[] SEPARATORS = {"\n\n", "\n", " "};

    private final int chunkSize;
    private final int chunkOverlap;
    private final Parser parser = Parser.builder().build();

    public MarkdownDocumentChunker(int chunkSize, int chunkOverlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        if (chunkOverlap < 0 || chunkOverlap >= chunkSize) {
            throw new IllegalArgumentException(
                    "chunkOverlap must be in [0, chunkSize): " + chunkOverlap + " vs " + chunkSize);
        }
        this.chunkSize = chunkSize;
        this.chunkOverlap = chunkOverlap;
    }

    /**
     * Chunks {@code content} and links the chunks below {@code fileNode}.
     */
    public FileGraph extract(GraphNode fileNode, String content, NodeIdAllocator ids) {
        List<DocumentChunk> chunks = split(content);
        if (chunks.isEmpty()) {
            log.debug("No chunks produced for {}", fileNode.asFileNode().relativePath());
            return FileGraph.empty();
        }

        List<GraphNode> nodes = new ArrayList<>();
        List<GraphEdge> edges = new ArrayList<>();
        GraphNode previous = null;
        for (DocumentChunk chunk : chunks) {
            GraphNode textNode = ids.newNode(new TextNode(chunk.text(), chunk.metadata()));
            nodes.add(textNode);
            if (previous == null) {
                edges.add(new GraphEdge(fileNode, textNode, EdgeType.HAS_TEXT));
            } else {
                edges.add(new GraphEdge(previous, textNode, EdgeType.NEXT_CHUNK));
            }
            previous = textNode;
        }

        log.debug("Split {} into {} chunks", fileNode.asFileNode().relativePath(), nodes.size());
        return new FileGraph(nodes, edges);
    }

    /**
     * Splits a document into ordered chunks with their header metadata.
     */
    public List<DocumentChunk> split(String content) {
        List<DocumentChunk> chunks = new ArrayList<>();
        Deque<HeaderEntry> headers = new ArrayDeque<>();
        StringBuilder current = new StringBuilder();
        String currentMetadata = "";

        Node node = parser.parse(content).getFirstChild();
        while (node != null) {
            // only #, ## and ### lines split; setext underlines stay section content
            if (node instanceof Heading heading && heading.isAtxHeading() && heading.getLevel() <= MAX_SPLIT_LEVEL) {
                flush(current, currentMetadata, chunks);
                current = new StringBuilder();

                while (!headers.isEmpty() && headers.peekLast().level() >= heading.getLevel()) {
                    headers.removeLast();
                }
                headers.addLast(new HeaderEntry(heading.getLevel(), heading.getText().toString().trim()));
                currentMetadata = formatMetadata(headers);
            } else {
                String block = node.getChars().toString().stripTrailing();
                if (!block.isBlank()) {
                    if (current.length() > 0) {
                        current.append("\n\n");
                    }
                    current.append(block);
                }
            }
            node = node.getNext();
        }
        flush(current, currentMetadata, chunks);
        return chunks;
    }

    private void flush(StringBuilder section, String metadata, List<DocumentChunk> out) {
        String text = section.toString().strip();
        if (text.isEmpty()) {
            return;
        }
        for (String piece : splitBySize(text)) {
            out.add(new DocumentChunk(piece, metadata));
        }
    }

    /**
     * Cuts text into pieces of at most {@code chunkSize} characters, breaking at the widest
     * separator found in the second half of the window and overlapping by {@code chunkOverlap}.
     */
    List<String> splitBySize(String text) {
        if (text.length() <= chunkSize) {
            return List.of(text);
        }

        List<String> pieces = new ArrayList<>();
        int length = text.length();
        int start = 0;
        while (start < length) {
            int end = Math.min(start + chunkSize, length);
            if (end < length) {
                end = findBreak(text, start, end);
            }

            String piece = text.substring(start, end).strip();
            if (!piece.isEmpty()) {
                pieces.add(piece);
            }
            if (end >= length) {
                break;
            }

            int next = Math.max(end - chunkOverlap, start + 1);
            // start the overlap on a word boundary when one is available
            int space = text.indexOf(' ', next);
            if (next > start + 1 && space >= 0 && space < end) {
                next = space + 1;
            }
            start = next;
        }
        return pieces;
    }

    private int findBreak(String text, int start, int end) {
        int floor = start + chunkSize / 2;
        for (String separator : SEPARATORS) {
            int index = text.lastIndexOf(separator, end - separator.length());
            if (index >= floor) {
                return index + separator.length();
            }
        }
        return end;
    }

    static String formatMetadata(Deque<HeaderEntry> headers) {
        if (headers.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("{");
        Iterator<HeaderEntry> iterator = headers.iterator();
        while (iterator.hasNext()) {
            HeaderEntry entry = iterator.next();
            sb.append(quote("Header " + entry.level())).append(": ").append(quote(entry.text()));
            if (iterator.hasNext()) {
                sb.append(", ");
            }
        }
        return sb.append('}').toString();
    }

    // single quotes unless the value itself contains one and no double quote
    private static String quote(String value) {
        if (value.contains("'") && !value.contains("\"")) {
            return "\"" + value.replace("\\", "\\\\") + "\"";
        }
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    /**
     * One chunk of a document.
     */
    public record DocumentChunk(String text, String metadata) {
    }

    record HeaderEntry(int level, String text) {
    }
}
