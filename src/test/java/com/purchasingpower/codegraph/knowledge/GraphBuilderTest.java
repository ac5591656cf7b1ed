package com.purchasingpower.codegraph.knowledge;

import com.purchasingpower.codegraph.model.graph.EdgeType;
import com.purchasingpower.codegraph.model.graph.GraphEdge;
import com.purchasingpower.codegraph.model.graph.GraphNode;
import com.purchasingpower.codegraph.model.graph.KnowledgeGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Graph Builder Tests")
class GraphBuilderTest {

    private static final Path FIXTURE = Path.of("src/test/resources/test_project");

    private GraphBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new GraphBuilder(1000, 10000, 1000);
    }

    // ======================================================================
    // FIXTURE REPOSITORY
    // ======================================================================

    @Test
    @DisplayName("Should build the expected node and edge counts for the fixture repository")
    void testBuild_FixtureCounts() {
        // When
        KnowledgeGraph graph = builder.build(FIXTURE, 0);

        // Then
        assertEquals(8, graph.getFileNodes().size());
        assertEquals(84, graph.getAstNodes().size());
        assertEquals(4, graph.getTextNodes().size());

        assertEquals(81, graph.getEdges(EdgeType.PARENT_OF).size());
        assertEquals(7, graph.getEdges(EdgeType.HAS_FILE).size());
        assertEquals(3, graph.getEdges(EdgeType.HAS_AST).size());
        assertEquals(1, graph.getEdges(EdgeType.HAS_TEXT).size());
        assertEquals(3, graph.getEdges(EdgeType.NEXT_CHUNK).size());
    }

    @Test
    @DisplayName("Should give the root id 0 and relative path '.' in an empty id space")
    void testBuild_RootNode() {
        KnowledgeGraph graph = builder.build(FIXTURE, 0);

        GraphNode root = graph.getRootNode();
        assertEquals(0L, root.nodeId());
        assertEquals(0L, graph.getRootNodeId());
        assertEquals(".", root.asFileNode().relativePath());
        assertEquals("test_project", root.asFileNode().basename());
    }

    @Test
    @DisplayName("Should create FileNodes with slash-separated relative paths, unsupported files included")
    void testBuild_RelativePaths() {
        KnowledgeGraph graph = builder.build(FIXTURE, 0);

        List<String> paths = graph.getFileNodes().stream()
                .map(node -> node.asFileNode().relativePath())
                .sorted()
                .toList();
        assertEquals(List.of(".", "bar", "bar/test.java", "bar/test.py",
                "foo", "foo/test.dummy", "foo/test.md", "test.c"), paths);
    }

    @Test
    @DisplayName("Should give every non-root FileNode exactly one incoming HAS_FILE edge")
    void testBuild_FileTreeInvariant() {
        KnowledgeGraph graph = builder.build(FIXTURE, 0);

        Map<Long, Integer> incoming = new HashMap<>();
        for (GraphEdge edge : graph.getEdges(EdgeType.HAS_FILE)) {
            incoming.merge(edge.target().nodeId(), 1, Integer::sum);
        }
        for (GraphNode file : graph.getFileNodes()) {
            int expected = file.nodeId() == graph.getRootNodeId() ? 0 : 1;
            assertEquals(expected, incoming.getOrDefault(file.nodeId(), 0), file.asFileNode().relativePath());
        }
    }

    @Test
    @DisplayName("Should produce the same graph on every build of the same tree")
    void testBuild_Deterministic() {
        KnowledgeGraph first = builder.build(FIXTURE, 0);
        KnowledgeGraph second = builder.build(FIXTURE, 0);

        assertEquals(first.getNodes(), second.getNodes());
        assertEquals(first.getEdges(), second.getEdges());
    }

    @Test
    @DisplayName("Should allocate unique ids starting at the requested first id")
    void testBuild_IdSpace() {
        KnowledgeGraph graph = builder.build(FIXTURE, 500);

        assertEquals(500L, graph.getRootNodeId());
        Set<Long> ids = new HashSet<>();
        for (GraphNode node : graph.getNodes()) {
            assertTrue(ids.add(node.nodeId()), "duplicate id " + node.nodeId());
        }
        assertThat(ids).allMatch(id -> id >= 500 && id < 500 + graph.getNodes().size());
    }

    @Test
    @DisplayName("Should keep the AST depth bound across the whole build")
    void testBuild_AstDepthBound() {
        KnowledgeGraph shallow = new GraphBuilder(2, 10000, 1000).build(FIXTURE, 0);

        assertThat(shallow.getAstNodes().size()).isLessThan(84);
        assertEquals(2, shallow.getMaxAstDepth());
        assertEquals(3, shallow.getEdges(EdgeType.HAS_AST).size());
    }

    // ======================================================================
    // IGNORE RULES AND SKIPPED INPUT
    // ======================================================================

    @Test
    @DisplayName("Should honour .gitignore rules and always skip the .git directory")
    void testBuild_Gitignore(@TempDir Path repo) throws IOException {
        // Given
        Files.writeString(repo.resolve(".gitignore"), "*.log\nbuild/\n");
        Files.writeString(repo.resolve("app.py"), "x = 1\n");
        Files.writeString(repo.resolve("debug.log"), "noise\n");
        Files.createDirectories(repo.resolve("build"));
        Files.writeString(repo.resolve("build/out.py"), "y = 2\n");
        Files.createDirectories(repo.resolve(".git"));
        Files.writeString(repo.resolve(".git/config"), "[core]\n");
        Files.createDirectories(repo.resolve("logs"));
        Files.writeString(repo.resolve("logs/.gitignore"), "!keep.log\n");
        Files.writeString(repo.resolve("logs/keep.log"), "kept\n");
        Files.writeString(repo.resolve("logs/drop.log"), "dropped\n");

        // When
        KnowledgeGraph graph = builder.build(repo, 0);

        // Then: nested negation re-includes keep.log
        List<String> paths = graph.getFileNodes().stream()
                .map(node -> node.asFileNode().relativePath())
                .sorted()
                .toList();
        assertEquals(List.of(".", ".gitignore", "app.py", "logs", "logs/.gitignore", "logs/keep.log"), paths);
        assertEquals(1, graph.getEdges(EdgeType.HAS_AST).size());
    }

    @Test
    @DisplayName("Should keep only the FileNode for undecodable or unparseable files")
    void testBuild_SkipsBadFiles(@TempDir Path repo) throws IOException {
        // Given
        Files.write(repo.resolve("binary.py"), new byte[]{(byte) 0xff, (byte) 0xfe, (byte) 0x00});
        Files.writeString(repo.resolve("broken.py"), "def (:\n");
        Files.writeString(repo.resolve("empty.md"), "");

        // When
        KnowledgeGraph graph = builder.build(repo, 0);

        // Then
        assertEquals(4, graph.getFileNodes().size());
        assertTrue(graph.getAstNodes().isEmpty());
        assertTrue(graph.getTextNodes().isEmpty());
        assertEquals(3, graph.getEdges().size());
    }

    @Test
    @DisplayName("Should reject a root that is not a directory")
    void testBuild_RootMustBeDirectory() {
        assertThrows(IllegalArgumentException.class,
                () -> builder.build(FIXTURE.resolve("test.c"), 0));
    }
}
