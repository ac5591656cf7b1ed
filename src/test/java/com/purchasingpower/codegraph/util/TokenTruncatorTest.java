package com.purchasingpower.codegraph.util;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Token Truncator Tests")
class TokenTruncatorTest {

    private static TokenTruncator truncator;

    @BeforeAll
    static void setUp() {
        truncator = new TokenTruncator();
    }

    @Test
    @DisplayName("Should return text within the budget unchanged")
    void testTruncate_WithinBudget() {
        String text = "Result 1:\nFileNode: {basename=test.c, node_id=7, relative_path=test.c}";
        int tokens = truncator.countTokens(text);

        assertSame(text, truncator.truncate(text, tokens));
        assertSame(text, truncator.truncate(text, 5000));
    }

    @Test
    @DisplayName("Should cut long text to the budget and end with the marker")
    void testTruncate_OverBudget() {
        // Given
        String text = "public static void main(String[] args) { }\n".repeat(500);

        for (int budget : new int[]{20, 100, 1000}) {
            // When
            String truncated = truncator.truncate(text, budget);

            // Then
            assertThat(truncated).endsWith(TokenTruncator.TRUNCATION_MARKER);
            assertThat(truncator.countTokens(truncated)).isLessThanOrEqualTo(budget);
            assertThat(text).startsWith(truncated.substring(0,
                    truncated.length() - TokenTruncator.TRUNCATION_MARKER.length()));
        }
    }

    @Test
    @DisplayName("Should stay within a budget smaller than the marker itself")
    void testTruncate_TinyBudget() {
        String text = "word ".repeat(100);

        assertThat(truncator.countTokens(truncator.truncate(text, 1))).isLessThanOrEqualTo(1);
        assertEquals("", truncator.truncate(text, 0));
    }

    @Test
    @DisplayName("Should not exceed the budget for multi-byte text")
    void testTruncate_MultiByte() {
        String text = "知识图谱 🌳 代码检索 ".repeat(200);

        String truncated = truncator.truncate(text, 50);

        assertThat(truncator.countTokens(truncated)).isLessThanOrEqualTo(50);
        assertThat(truncated).endsWith(TokenTruncator.TRUNCATION_MARKER);
    }
}
