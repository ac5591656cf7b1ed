package com.purchasingpower.codegraph.query;

import com.purchasingpower.codegraph.util.TokenTruncator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders query rows as numbered plain-text blocks for an LLM agent.
 *
 * <pre>
 * Result 1:
 * ASTNode: {end_line=3, node_id=12, start_line=3, text=..., type=call}
 * FileNode: {basename=test.c, node_id=7, relative_path=test.c}
 * </pre>
 */
@Component
@RequiredArgsConstructor
public class QueryResultFormatter {

    public static final String EMPTY_DATA_MESSAGE =
            "Your query returned empty result, please try a different query!";

    private final TokenTruncator tokenTruncator;

    public String format(List<Map<String, Object>> rows, int maxTokenPerResult) {
        if (rows == null || rows.isEmpty()) {
            return EMPTY_DATA_MESSAGE;
        }

        StringBuilder output = new StringBuilder();
        for (int i = 0; i < rows.size(); i++) {
            output.append("Result ").append(i + 1).append(":\n");
            new TreeMap<>(rows.get(i)).forEach((key, value) ->
                    output.append(key).append(": ").append(render(value)).append('\n'));
            output.append("\n\n");
        }
        return tokenTruncator.truncate(output.toString().strip(), maxTokenPerResult);
    }

    private static String render(Object value) {
        if (value instanceof Map<?, ?> map) {
            TreeMap<String, Object> sorted = new TreeMap<>();
            map.forEach((k, v) -> sorted.put(String.valueOf(k), v));
            return sorted.toString();
        }
        return String.valueOf(value);
    }
}
