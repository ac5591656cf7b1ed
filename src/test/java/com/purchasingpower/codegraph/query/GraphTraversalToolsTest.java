package com.purchasingpower.codegraph.query;

import com.purchasingpower.codegraph.configuration.GraphProperties;
import com.purchasingpower.codegraph.model.query.ToolResult;
import com.purchasingpower.codegraph.util.TokenTruncator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Traversal tool behaviour that does not depend on a live database: parameter passing,
 * sentinels, and the line handling done after the query returns.
 */
@DisplayName("Graph Traversal Tools Tests")
class GraphTraversalToolsTest {

    private static final long ROOT_ID = 0L;
    private static final Map<String, Object> TEST_C = Map.of(
            "node_id", 7L, "basename", "test.c", "relative_path", "test.c");
    private static final String C_SOURCE =
            "#include <stdio.h>\n\nint main() {\n   printf(\"Hello world!\");\n   return 0;\n}\n";

    private GraphQueryRunner queryRunner;
    private GraphProperties properties;
    private TokenTruncator truncator;
    private GraphTraversalTools tools;

    @BeforeEach
    void setUp() {
        queryRunner = mock(GraphQueryRunner.class);
        properties = new GraphProperties();
        truncator = new TokenTruncator();
        tools = new GraphTraversalTools(queryRunner, new QueryResultFormatter(truncator), properties);
    }

    // ======================================================================
    // SENTINELS AND ERRORS
    // ======================================================================

    @Test
    @DisplayName("Should return the sentinel and no records for an unknown basename")
    void testFindFileNode_UnknownBasename() {
        when(queryRunner.read(anyString(), anyMap())).thenReturn(List.of());

        ToolResult result = tools.findFileNodeWithBasename(ROOT_ID, "missing.txt", 5000);

        assertEquals(QueryResultFormatter.EMPTY_DATA_MESSAGE, result.text());
        assertTrue(result.isEmpty());
    }

    @Test
    @DisplayName("Should reject an end line before the start line without querying")
    void testReadCode_InvalidRange() {
        ToolResult result = tools.readCodeWithBasename(ROOT_ID, "test.c", 5, 3, 5000);

        assertEquals("The end line number 3 must be greater than the start line number 5.", result.text());
        assertThat(result.text()).contains("must be greater than");
        assertTrue(result.records().isEmpty());
        verifyNoInteractions(queryRunner);

        assertTrue(tools.readCodeWithRelativePath(ROOT_ID, "test.c", 5, 3, 5000).isEmpty());
    }

    // ======================================================================
    // PARAMETERS
    // ======================================================================

    @Test
    @DisplayName("Should pass values as parameters scoped to the root and result limit")
    @SuppressWarnings("unchecked")
    void testFindAstNode_Parameters() {
        // Given
        Map<String, Object> row = Map.of("FileNode", TEST_C,
                "ASTNode", Map.of("node_id", 20L, "type", "identifier", "text", "printf",
                        "start_line", 3L, "end_line", 3L));
        when(queryRunner.read(anyString(), anyMap())).thenReturn(List.of(row));
        ArgumentCaptor<String> cypher = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<Map<String, Object>> params = ArgumentCaptor.forClass(Map.class);

        // When: a value that would break string-built Cypher
        ToolResult result = tools.findAstNodeWithTextInFileWithBasename(ROOT_ID, "it's", "test.c", 5000);

        // Then
        verify(queryRunner).read(cypher.capture(), params.capture());
        assertEquals(0L, params.getValue().get("root_id"));
        assertEquals(GraphTraversalTools.MAX_RESULT, params.getValue().get("limit"));
        assertEquals("it's", params.getValue().get("text"));
        assertEquals("test.c", params.getValue().get("basename"));
        assertThat(cypher.getValue()).doesNotContain("it's").contains("$text").contains("ORDER BY size(a.text)");
        assertEquals(List.of(row), result.records());
        assertThat(result.text()).startsWith("Result 1:\nASTNode: {end_line=3");
    }

    @Test
    @DisplayName("Should navigate by node id across every edge kind")
    @SuppressWarnings("unchecked")
    void testGetChildrenNode_Parameters() {
        when(queryRunner.read(anyString(), anyMap()))
                .thenReturn(List.of(Map.of("ChildNode", Map.of("node_id", 8L))));
        ArgumentCaptor<String> cypher = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<Map<String, Object>> params = ArgumentCaptor.forClass(Map.class);

        tools.getChildrenNode(ROOT_ID, 7L, 5000);

        verify(queryRunner).read(cypher.capture(), params.capture());
        assertEquals(7L, params.getValue().get("node_id"));
        assertThat(cypher.getValue()).contains("HAS_FILE|HAS_AST|PARENT_OF|HAS_TEXT|NEXT_CHUNK");
    }

    // ======================================================================
    // PREVIEW AND READ CODE
    // ======================================================================

    @Test
    @DisplayName("Should number preview lines from 1 for source files")
    @SuppressWarnings("unchecked")
    void testPreview_SourceFile() {
        // Given
        when(queryRunner.read(anyString(), anyMap())).thenReturn(List.of(row(
                "FileNode", TEST_C, "ASTNode", Map.of("text", C_SOURCE), "TextNode", null)));

        // When
        ToolResult result = tools.previewFileContentWithBasename(ROOT_ID, "test.c", 5000);

        // Then
        Map<String, Object> preview = (Map<String, Object>) result.records().get(0).get("preview");
        assertEquals("1. #include <stdio.h>\n2. \n3. int main() {\n4.    printf(\"Hello world!\");\n"
                + "5.    return 0;\n6. }", preview.get("text"));
        assertEquals(1, preview.get("start_line"));
        assertEquals(6, preview.get("end_line"));
        assertEquals(TEST_C, result.records().get(0).get("FileNode"));
    }

    @Test
    @DisplayName("Should preview the head chunk of a text file and split on any line ending")
    @SuppressWarnings("unchecked")
    void testPreview_TextFile() {
        when(queryRunner.read(anyString(), anyMap())).thenReturn(List.of(row(
                "FileNode", Map.of("basename", "test.md", "relative_path", "foo/test.md"),
                "ASTNode", null,
                "TextNode", Map.of("text", "first\r\nsecond\rthird"))));

        ToolResult result = tools.previewFileContentWithRelativePath(ROOT_ID, "foo/test.md", 5000);

        Map<String, Object> preview = (Map<String, Object>) result.records().get(0).get("preview");
        assertEquals("1. first\n2. second\n3. third", preview.get("text"));
    }

    @Test
    @DisplayName("Should cap previews at 1000 lines")
    @SuppressWarnings("unchecked")
    void testPreview_LineCap() {
        String longSource = "x = 1\n".repeat(1500);
        when(queryRunner.read(anyString(), anyMap())).thenReturn(List.of(row(
                "FileNode", TEST_C, "ASTNode", Map.of("text", longSource), "TextNode", null)));

        ToolResult result = tools.previewFileContentWithBasename(ROOT_ID, "big.py", 1_000_000);

        Map<String, Object> preview = (Map<String, Object>) result.records().get(0).get("preview");
        assertEquals(1000, preview.get("end_line"));
        assertThat((String) preview.get("text")).endsWith("1000. x = 1").doesNotContain("1001. ");
    }

    @Test
    @DisplayName("Should return the sentinel when the match has nothing to preview")
    void testPreview_Directory() {
        when(queryRunner.read(anyString(), anyMap())).thenReturn(List.of(row(
                "FileNode", Map.of("basename", "foo", "relative_path", "foo"), "ASTNode", null, "TextNode", null)));

        ToolResult result = tools.previewFileContentWithBasename(ROOT_ID, "foo", 5000);

        assertEquals(QueryResultFormatter.EMPTY_DATA_MESSAGE, result.text());
        assertTrue(result.isEmpty());
    }

    @Test
    @DisplayName("Should select [start, end) and number lines from start")
    @SuppressWarnings("unchecked")
    void testReadCode_Range() {
        // Given
        when(queryRunner.read(anyString(), anyMap())).thenReturn(List.of(row(
                "FileNode", TEST_C, "ASTNode", Map.of("text", C_SOURCE))));

        // When
        ToolResult result = tools.readCodeWithRelativePath(ROOT_ID, "test.c", 3, 5, 5000);

        // Then
        Map<String, Object> selected = (Map<String, Object>) result.records().get(0).get("SelectedLines");
        assertEquals("3. int main() {\n4.    printf(\"Hello world!\");", selected.get("text"));
        assertEquals(3, selected.get("start_line"));
        assertEquals(5, selected.get("end_line"));
        assertThat(result.text()).contains("SelectedLines: {end_line=5, start_line=3, text=3. int main() {");
    }

    @Test
    @DisplayName("Should clip a range running past the end of the file")
    @SuppressWarnings("unchecked")
    void testReadCode_PastEnd() {
        when(queryRunner.read(anyString(), anyMap())).thenReturn(List.of(row(
                "FileNode", TEST_C, "ASTNode", Map.of("text", C_SOURCE))));

        ToolResult result = tools.readCodeWithBasename(ROOT_ID, "test.c", 5, 100, 5000);

        Map<String, Object> selected = (Map<String, Object>) result.records().get(0).get("SelectedLines");
        assertEquals("5.    return 0;\n6. }", selected.get("text"));
    }

    /**
     * Map.of rejects null values, which the store returns for unmatched OPTIONAL MATCH columns.
     */
    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }

    // ======================================================================
    // CONFIGURED BUDGET
    // ======================================================================

    @Test
    @DisplayName("Should apply the configured token budget when none is given")
    void testConfiguredBudget_Truncates() {
        // Given: a budget far smaller than one formatted record
        properties.setMaxTokenPerResult(8);
        when(queryRunner.read(anyString(), anyMap())).thenReturn(List.of(Map.of("FileNode", TEST_C)));

        // When
        ToolResult defaulted = tools.findFileNodeWithBasename(ROOT_ID, "test.c");
        ToolResult explicit = tools.findFileNodeWithBasename(ROOT_ID, "test.c", 8);

        // Then
        assertEquals(explicit.text(), defaulted.text());
        assertThat(defaulted.text()).endsWith(TokenTruncator.TRUNCATION_MARKER);
        assertTrue(truncator.countTokens(defaulted.text()) <= 8);
        assertEquals(1, defaulted.records().size());
    }

    @Test
    @DisplayName("Should leave results within the default budget untouched")
    void testConfiguredBudget_Default() {
        when(queryRunner.read(anyString(), anyMap())).thenReturn(List.of(Map.of("FileNode", TEST_C)));

        ToolResult result = tools.getParentNode(ROOT_ID, 7L);

        assertEquals(5000, properties.getMaxTokenPerResult());
        assertThat(result.text()).doesNotContain(TokenTruncator.TRUNCATION_MARKER);
        assertThat(result.text()).contains("test.c");
    }
}
