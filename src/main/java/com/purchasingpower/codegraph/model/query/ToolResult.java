package com.purchasingpower.codegraph.model.query;

import java.util.List;
import java.util.Map;

/**
 * Output of one traversal tool call.
 *
 * @param text    token-budgeted rendering of the records, or a sentinel/error message
 * @param records raw rows as returned by the store, keyed by column name
 */
public record ToolResult(String text, List<Map<String, Object>> records) {

    public static ToolResult message(String text) {
        return new ToolResult(text, List.of());
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
