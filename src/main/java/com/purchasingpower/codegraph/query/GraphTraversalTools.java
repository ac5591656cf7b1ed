package com.purchasingpower.codegraph.query;

import com.purchasingpower.codegraph.configuration.GraphProperties;
import com.purchasingpower.codegraph.model.query.ToolResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only graph traversal tools offered to the retrieval agent.
 *
 * <p>Every tool is scoped to the graph whose root FileNode has {@code rootNodeId}, returns at most
 * {@link #MAX_RESULT} rows and renders them within {@code maxTokenPerResult} tokens. All values
 * reach Cypher as parameters. Each tool has an overload without the budget that applies
 * {@code app.graph.max-token-per-result}.
 *
 * <p>Records are keyed by column: {@code FileNode}, {@code ASTNode}, {@code TextNode},
 * {@code preview}, {@code SelectedLines}, {@code ParentNode} or {@code ChildNode}.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GraphTraversalTools {

    public static final int MAX_RESULT = 30;
    public static final int MAX_PREVIEW_LINES = 1000;

    public static final String FILE_NODE = "FileNode";
    public static final String AST_NODE = "ASTNode";
    public static final String TEXT_NODE = "TextNode";
    public static final String PREVIEW = "preview";
    public static final String SELECTED_LINES = "SelectedLines";
    public static final String PARENT_NODE = "ParentNode";
    public static final String CHILD_NODE = "ChildNode";

    private static final String LINE_BREAK = "\\r\\n|\\n|\\r";
    private static final String ANY_EDGE = "HAS_FILE|HAS_AST|PARENT_OF|HAS_TEXT|NEXT_CHUNK";

    // ================================================================
    // CYPHER
    // ================================================================

    private static final String FILES_IN_GRAPH =
            "MATCH (root:FileNode {node_id: $root_id})-[:HAS_FILE*0..]->(f:FileNode) ";

    private static final String FILES_BELOW_SCOPE =
            "MATCH (root:FileNode {node_id: $root_id})-[:HAS_FILE*0..]->(scope:FileNode)"
                    + "-[:HAS_FILE*0..]->(f:FileNode) ";

    private static final String AST_OF_FILE =
            "MATCH (f)-[:HAS_AST]->(:ASTNode)-[:PARENT_OF*0..]->(a:ASTNode) ";

    private static final String TEXT_OF_FILE =
            "MATCH (f)-[:HAS_TEXT]->(:TextNode)-[:NEXT_CHUNK*0..]->(t:TextNode) ";

    private static final String RETURN_FILE =
            "RETURN f AS FileNode ORDER BY f.node_id LIMIT $limit";

    private static final String RETURN_AST =
            "WITH DISTINCT f, a RETURN f AS FileNode, a AS ASTNode ORDER BY size(a.text), a.node_id LIMIT $limit";

    private static final String RETURN_TEXT =
            "RETURN f AS FileNode, t AS TextNode ORDER BY t.node_id LIMIT $limit";

    private static final String FILE_CONTENT_ROOTS =
            "OPTIONAL MATCH (f)-[:HAS_AST]->(a:ASTNode) "
                    + "OPTIONAL MATCH (f)-[:HAS_TEXT]->(t:TextNode) WHERE NOT ()-[:NEXT_CHUNK]->(t) "
                    + "RETURN f AS FileNode, a AS ASTNode, t AS TextNode ORDER BY f.node_id LIMIT $limit";

    private static final String FILE_AST_ROOT =
            "MATCH (f)-[:HAS_AST]->(a:ASTNode) "
                    + "RETURN f AS FileNode, a AS ASTNode ORDER BY f.node_id LIMIT $limit";

    private final GraphQueryRunner queryRunner;
    private final QueryResultFormatter formatter;
    private final GraphProperties graphProperties;

    // ================================================================
    // FILE NODES
    // ================================================================

    public ToolResult findFileNodeWithBasename(long rootNodeId, String basename, int maxTokenPerResult) {
        return run(FILES_IN_GRAPH + "WHERE f.basename = $basename " + RETURN_FILE,
                params(rootNodeId, "basename", basename), maxTokenPerResult);
    }

    public ToolResult findFileNodeWithRelativePath(long rootNodeId, String relativePath, int maxTokenPerResult) {
        return run(FILES_IN_GRAPH + "WHERE f.relative_path = $relative_path " + RETURN_FILE,
                params(rootNodeId, "relative_path", relativePath), maxTokenPerResult);
    }

    // ================================================================
    // AST NODES
    // ================================================================

    public ToolResult findAstNodeWithText(long rootNodeId, String text, int maxTokenPerResult) {
        return run(FILES_IN_GRAPH + AST_OF_FILE + "WHERE a.text CONTAINS $text " + RETURN_AST,
                params(rootNodeId, "text", text), maxTokenPerResult);
    }

    public ToolResult findAstNodeWithType(long rootNodeId, String type, int maxTokenPerResult) {
        return run(FILES_IN_GRAPH + AST_OF_FILE + "WHERE a.type = $type " + RETURN_AST,
                params(rootNodeId, "type", type), maxTokenPerResult);
    }

    /**
     * AST nodes containing {@code text} in any file at or below a file or directory named {@code basename}.
     */
    public ToolResult findAstNodeWithTextInFileWithBasename(long rootNodeId, String text, String basename,
                                                            int maxTokenPerResult) {
        return run(FILES_BELOW_SCOPE + "WHERE scope.basename = $basename "
                        + AST_OF_FILE + "WHERE a.text CONTAINS $text " + RETURN_AST,
                params(rootNodeId, "text", text, "basename", basename), maxTokenPerResult);
    }

    public ToolResult findAstNodeWithTextInFileWithRelativePath(long rootNodeId, String text, String relativePath,
                                                                int maxTokenPerResult) {
        return run(FILES_BELOW_SCOPE + "WHERE scope.relative_path = $relative_path "
                        + AST_OF_FILE + "WHERE a.text CONTAINS $text " + RETURN_AST,
                params(rootNodeId, "text", text, "relative_path", relativePath), maxTokenPerResult);
    }

    public ToolResult findAstNodeWithTypeInFileWithBasename(long rootNodeId, String type, String basename,
                                                            int maxTokenPerResult) {
        return run(FILES_BELOW_SCOPE + "WHERE scope.basename = $basename "
                        + AST_OF_FILE + "WHERE a.type = $type " + RETURN_AST,
                params(rootNodeId, "type", type, "basename", basename), maxTokenPerResult);
    }

    public ToolResult findAstNodeWithTypeInFileWithRelativePath(long rootNodeId, String type, String relativePath,
                                                                int maxTokenPerResult) {
        return run(FILES_BELOW_SCOPE + "WHERE scope.relative_path = $relative_path "
                        + AST_OF_FILE + "WHERE a.type = $type " + RETURN_AST,
                params(rootNodeId, "type", type, "relative_path", relativePath), maxTokenPerResult);
    }

    // ================================================================
    // TEXT NODES
    // ================================================================

    public ToolResult findTextNodeWithText(long rootNodeId, String text, int maxTokenPerResult) {
        return run(FILES_IN_GRAPH + TEXT_OF_FILE + "WHERE t.text CONTAINS $text " + RETURN_TEXT,
                params(rootNodeId, "text", text), maxTokenPerResult);
    }

    public ToolResult findTextNodeWithTextInFile(long rootNodeId, String text, String basename,
                                                 int maxTokenPerResult) {
        return run(FILES_IN_GRAPH + "WHERE f.basename = $basename "
                        + TEXT_OF_FILE + "WHERE t.text CONTAINS $text " + RETURN_TEXT,
                params(rootNodeId, "text", text, "basename", basename), maxTokenPerResult);
    }

    public ToolResult getNextTextNodeWithNodeId(long rootNodeId, long nodeId, int maxTokenPerResult) {
        return run(FILES_IN_GRAPH
                        + "MATCH (f)-[:HAS_TEXT]->(:TextNode)-[:NEXT_CHUNK*0..]->(:TextNode {node_id: $node_id})"
                        + "-[:NEXT_CHUNK]->(t:TextNode) " + RETURN_TEXT,
                params(rootNodeId, "node_id", nodeId), maxTokenPerResult);
    }

    // ================================================================
    // FILE CONTENT
    // ================================================================

    public ToolResult previewFileContentWithBasename(long rootNodeId, String basename, int maxTokenPerResult) {
        List<Map<String, Object>> rows = queryRunner.read(
                FILES_IN_GRAPH + "WHERE f.basename = $basename " + FILE_CONTENT_ROOTS,
                params(rootNodeId, "basename", basename));
        return finish(toPreviews(rows), maxTokenPerResult);
    }

    public ToolResult previewFileContentWithRelativePath(long rootNodeId, String relativePath,
                                                         int maxTokenPerResult) {
        List<Map<String, Object>> rows = queryRunner.read(
                FILES_IN_GRAPH + "WHERE f.relative_path = $relative_path " + FILE_CONTENT_ROOTS,
                params(rootNodeId, "relative_path", relativePath));
        return finish(toPreviews(rows), maxTokenPerResult);
    }

    /**
     * Lines {@code [startLine, endLine)} of a source file, 1-indexed.
     */
    public ToolResult readCodeWithBasename(long rootNodeId, String basename, int startLine, int endLine,
                                           int maxTokenPerResult) {
        if (endLine < startLine) {
            return ToolResult.message(lineRangeError(startLine, endLine));
        }
        List<Map<String, Object>> rows = queryRunner.read(
                FILES_IN_GRAPH + "WHERE f.basename = $basename " + FILE_AST_ROOT,
                params(rootNodeId, "basename", basename));
        return finish(toSelectedLines(rows, startLine, endLine), maxTokenPerResult);
    }

    public ToolResult readCodeWithRelativePath(long rootNodeId, String relativePath, int startLine, int endLine,
                                               int maxTokenPerResult) {
        if (endLine < startLine) {
            return ToolResult.message(lineRangeError(startLine, endLine));
        }
        List<Map<String, Object>> rows = queryRunner.read(
                FILES_IN_GRAPH + "WHERE f.relative_path = $relative_path " + FILE_AST_ROOT,
                params(rootNodeId, "relative_path", relativePath));
        return finish(toSelectedLines(rows, startLine, endLine), maxTokenPerResult);
    }

    // ================================================================
    // NAVIGATION
    // ================================================================

    public ToolResult getParentNode(long rootNodeId, long nodeId, int maxTokenPerResult) {
        return run("MATCH (root:FileNode {node_id: $root_id})-[:" + ANY_EDGE + "*0..]->(p)"
                        + "-[:" + ANY_EDGE + "]->(c {node_id: $node_id}) "
                        + "WITH DISTINCT p RETURN p AS ParentNode ORDER BY p.node_id LIMIT $limit",
                params(rootNodeId, "node_id", nodeId), maxTokenPerResult);
    }

    public ToolResult getChildrenNode(long rootNodeId, long nodeId, int maxTokenPerResult) {
        return run("MATCH (root:FileNode {node_id: $root_id})-[:" + ANY_EDGE + "*0..]->(p {node_id: $node_id})"
                        + "-[:" + ANY_EDGE + "]->(c) "
                        + "WITH DISTINCT c RETURN c AS ChildNode ORDER BY c.node_id LIMIT $limit",
                params(rootNodeId, "node_id", nodeId), maxTokenPerResult);
    }

    // ================================================================
    // CONFIGURED BUDGET
    // ================================================================

    public ToolResult findFileNodeWithBasename(long rootNodeId, String basename) {
        return findFileNodeWithBasename(rootNodeId, basename, defaultBudget());
    }

    public ToolResult findFileNodeWithRelativePath(long rootNodeId, String relativePath) {
        return findFileNodeWithRelativePath(rootNodeId, relativePath, defaultBudget());
    }

    public ToolResult findAstNodeWithText(long rootNodeId, String text) {
        return findAstNodeWithText(rootNodeId, text, defaultBudget());
    }

    public ToolResult findAstNodeWithType(long rootNodeId, String type) {
        return findAstNodeWithType(rootNodeId, type, defaultBudget());
    }

    public ToolResult findAstNodeWithTextInFileWithBasename(long rootNodeId, String text, String basename) {
        return findAstNodeWithTextInFileWithBasename(rootNodeId, text, basename, defaultBudget());
    }

    public ToolResult findAstNodeWithTextInFileWithRelativePath(long rootNodeId, String text, String relativePath) {
        return findAstNodeWithTextInFileWithRelativePath(rootNodeId, text, relativePath, defaultBudget());
    }

    public ToolResult findAstNodeWithTypeInFileWithBasename(long rootNodeId, String type, String basename) {
        return findAstNodeWithTypeInFileWithBasename(rootNodeId, type, basename, defaultBudget());
    }

    public ToolResult findAstNodeWithTypeInFileWithRelativePath(long rootNodeId, String type, String relativePath) {
        return findAstNodeWithTypeInFileWithRelativePath(rootNodeId, type, relativePath, defaultBudget());
    }

    public ToolResult findTextNodeWithText(long rootNodeId, String text) {
        return findTextNodeWithText(rootNodeId, text, defaultBudget());
    }

    public ToolResult findTextNodeWithTextInFile(long rootNodeId, String text, String basename) {
        return findTextNodeWithTextInFile(rootNodeId, text, basename, defaultBudget());
    }

    public ToolResult getNextTextNodeWithNodeId(long rootNodeId, long nodeId) {
        return getNextTextNodeWithNodeId(rootNodeId, nodeId, defaultBudget());
    }

    public ToolResult previewFileContentWithBasename(long rootNodeId, String basename) {
        return previewFileContentWithBasename(rootNodeId, basename, defaultBudget());
    }

    public ToolResult previewFileContentWithRelativePath(long rootNodeId, String relativePath) {
        return previewFileContentWithRelativePath(rootNodeId, relativePath, defaultBudget());
    }

    public ToolResult readCodeWithBasename(long rootNodeId, String basename, int startLine, int endLine) {
        return readCodeWithBasename(rootNodeId, basename, startLine, endLine, defaultBudget());
    }

    public ToolResult readCodeWithRelativePath(long rootNodeId, String relativePath, int startLine, int endLine) {
        return readCodeWithRelativePath(rootNodeId, relativePath, startLine, endLine, defaultBudget());
    }

    public ToolResult getParentNode(long rootNodeId, long nodeId) {
        return getParentNode(rootNodeId, nodeId, defaultBudget());
    }

    public ToolResult getChildrenNode(long rootNodeId, long nodeId) {
        return getChildrenNode(rootNodeId, nodeId, defaultBudget());
    }

    private int defaultBudget() {
        return graphProperties.getMaxTokenPerResult();
    }

    // ================================================================
    // HELPERS
    // ================================================================

    private ToolResult run(String cypher, Map<String, Object> parameters, int maxTokenPerResult) {
        return finish(queryRunner.read(cypher, parameters), maxTokenPerResult);
    }

    private ToolResult finish(List<Map<String, Object>> records, int maxTokenPerResult) {
        if (records.isEmpty()) {
            return ToolResult.message(QueryResultFormatter.EMPTY_DATA_MESSAGE);
        }
        return new ToolResult(formatter.format(records, maxTokenPerResult), records);
    }

    private static Map<String, Object> params(long rootNodeId, Object... keyValues) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("root_id", rootNodeId);
        parameters.put("limit", MAX_RESULT);
        for (int i = 0; i < keyValues.length; i += 2) {
            parameters.put((String) keyValues[i], keyValues[i + 1]);
        }
        return parameters;
    }

    /**
     * Directories and files without content (no AST, no chunks) produce no preview row.
     */
    private static List<Map<String, Object>> toPreviews(List<Map<String, Object>> rows) {
        List<Map<String, Object>> previews = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            String content = nodeText(row, AST_NODE);
            if (content == null) {
                content = nodeText(row, TEXT_NODE);
            }
            if (content == null) {
                log.debug("No previewable content for {}", row.get(FILE_NODE));
                continue;
            }

            String[] lines = content.split(LINE_BREAK, -1);
            int shown = Math.min(countLines(lines), MAX_PREVIEW_LINES);
            Map<String, Object> preview = new LinkedHashMap<>();
            preview.put("text", numberLines(lines, 0, shown, 1));
            preview.put("start_line", 1);
            preview.put("end_line", shown);

            Map<String, Object> record = new LinkedHashMap<>();
            record.put(FILE_NODE, row.get(FILE_NODE));
            record.put(PREVIEW, preview);
            previews.add(record);
        }
        return previews;
    }

    private static List<Map<String, Object>> toSelectedLines(List<Map<String, Object>> rows,
                                                             int startLine, int endLine) {
        List<Map<String, Object>> selections = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            String content = nodeText(row, AST_NODE);
            if (content == null) {
                continue;
            }

            String[] lines = content.split(LINE_BREAK, -1);
            int from = Math.max(startLine, 1) - 1;
            int to = Math.min(endLine - 1, countLines(lines));
            Map<String, Object> selected = new LinkedHashMap<>();
            selected.put("text", numberLines(lines, from, Math.max(from, to), from + 1));
            selected.put("start_line", startLine);
            selected.put("end_line", endLine);

            Map<String, Object> record = new LinkedHashMap<>();
            record.put(FILE_NODE, row.get(FILE_NODE));
            record.put(SELECTED_LINES, selected);
            selections.add(record);
        }
        return selections;
    }

    private static String nodeText(Map<String, Object> row, String column) {
        if (row.get(column) instanceof Map<?, ?> node && node.get("text") != null) {
            return node.get("text").toString();
        }
        return null;
    }

    /**
     * A trailing line break does not start another line.
     */
    private static int countLines(String[] lines) {
        int count = lines.length;
        if (count > 0 && lines[count - 1].isEmpty()) {
            count--;
        }
        return count;
    }

    private static String numberLines(String[] lines, int from, int to, int firstNumber) {
        StringBuilder text = new StringBuilder();
        for (int i = from; i < to; i++) {
            if (text.length() > 0) {
                text.append('\n');
            }
            text.append(firstNumber + i - from).append(". ").append(lines[i]);
        }
        return text.toString();
    }

    static String lineRangeError(int startLine, int endLine) {
        return "The end line number " + endLine + " must be greater than the start line number "
                + startLine + ".";
    }
}
