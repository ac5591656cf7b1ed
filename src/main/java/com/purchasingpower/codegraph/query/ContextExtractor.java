package com.purchasingpower.codegraph.query;

import com.purchasingpower.codegraph.model.retrieval.CodeContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns traversal tool records into {@link CodeContext} values.
 *
 * <p>Rows holding nothing but a FileNode, and rows without a FileNode, carry no content and are
 * skipped. Content is taken from the first present column in the order
 * ASTNode, TextNode, preview, SelectedLines.
 */
public final class ContextExtractor {

    private static final List<String> CONTENT_COLUMNS =
            List.of(GraphTraversalTools.AST_NODE, GraphTraversalTools.TEXT_NODE,
                    GraphTraversalTools.PREVIEW, GraphTraversalTools.SELECTED_LINES);

    private static final List<String> LINE_COLUMNS =
            List.of(GraphTraversalTools.AST_NODE, GraphTraversalTools.SELECTED_LINES,
                    GraphTraversalTools.PREVIEW);

    private ContextExtractor() {
    }

    public static List<CodeContext> fromRecords(List<Map<String, Object>> records) {
        List<CodeContext> contexts = new ArrayList<>();
        if (records == null) {
            return contexts;
        }
        for (Map<String, Object> row : records) {
            Map<?, ?> fileNode = column(row, GraphTraversalTools.FILE_NODE);
            if (row.size() <= 1 || fileNode == null) {
                continue;
            }
            Object content = firstValue(row, CONTENT_COLUMNS, "text");
            contexts.add(new CodeContext(
                    String.valueOf(fileNode.get("relative_path")),
                    content == null ? null : content.toString(),
                    toInteger(firstValue(row, LINE_COLUMNS, "start_line")),
                    toInteger(firstValue(row, LINE_COLUMNS, "end_line"))));
        }
        return contexts;
    }

    private static Object firstValue(Map<String, Object> row, List<String> columns, String property) {
        for (String column : columns) {
            Map<?, ?> values = column(row, column);
            if (values != null && values.get(property) != null) {
                return values.get(property);
            }
        }
        return null;
    }

    private static Map<?, ?> column(Map<String, Object> row, String column) {
        return row.get(column) instanceof Map<?, ?> map ? map : null;
    }

    private static Integer toInteger(Object value) {
        return value instanceof Number number ? number.intValue() : null;
    }
}
