package com.purchasingpower.codegraph.knowledge.impl;

import com.purchasingpower.codegraph.configuration.GraphProperties;
import com.purchasingpower.codegraph.exception.GraphStoreException;
import com.purchasingpower.codegraph.knowledge.GraphStore;
import com.purchasingpower.codegraph.model.graph.EdgeType;
import com.purchasingpower.codegraph.model.graph.KnowledgeGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

@DisplayName("Knowledge Graph Service Tests")
class KnowledgeGraphServiceImplTest {

    private static final Path FIXTURE = Path.of("src/test/resources/test_project");

    private GraphStore graphStore;
    private GraphProperties properties;
    private KnowledgeGraphServiceImpl service;

    @BeforeEach
    void setUp() {
        graphStore = mock(GraphStore.class);
        properties = new GraphProperties();
        service = new KnowledgeGraphServiceImpl(graphStore, properties);
    }

    @Test
    @DisplayName("Should move the graph into the reserved id block and persist it")
    void testBuildGraph_ShouldWriteReservedIdSpace() {
        // Given: the store reserves a block starting at 42
        when(graphStore.reserveNodeIds(anyLong())).thenReturn(42L);
        ArgumentCaptor<KnowledgeGraph> written = ArgumentCaptor.forClass(KnowledgeGraph.class);

        // When
        long rootId = service.buildGraph(FIXTURE);

        // Then
        assertEquals(42L, rootId);
        verify(graphStore).reserveNodeIds(96L);
        verify(graphStore, never()).nextNodeId();
        verify(graphStore).writeGraph(written.capture());
        KnowledgeGraph graph = written.getValue();
        assertEquals(42L, graph.getRootNodeId());
        assertEquals(96, graph.getNodes().size());
        assertEquals(properties.getMaxAstDepth(), graph.getMaxAstDepth());
        assertEquals(properties.getChunkSize(), graph.getChunkSize());
        assertTrue(graph.getNodes().stream().allMatch(node -> node.nodeId() >= 42L && node.nodeId() < 138L));
        assertTrue(graph.getEdges().stream().allMatch(edge -> edge.source().nodeId() >= 42L));
    }

    @Test
    @DisplayName("Should apply an explicit AST depth bound")
    void testBuildGraph_CustomDepth() {
        when(graphStore.reserveNodeIds(anyLong())).thenReturn(0L);
        ArgumentCaptor<KnowledgeGraph> written = ArgumentCaptor.forClass(KnowledgeGraph.class);

        service.buildGraph(FIXTURE, 1);

        verify(graphStore).writeGraph(written.capture());
        assertEquals(1, written.getValue().getMaxAstDepth());
        assertEquals(3, written.getValue().getEdges(EdgeType.HAS_AST).size());
        assertTrue(written.getValue().getAstNodes().size() < 84);
    }

    @Test
    @DisplayName("Should propagate a failed write")
    void testBuildGraph_WriteFailure() {
        when(graphStore.reserveNodeIds(anyLong())).thenReturn(0L);
        doThrow(new GraphStoreException("WriteGraph", "connection refused"))
                .when(graphStore).writeGraph(any());

        GraphStoreException error = assertThrows(GraphStoreException.class, () -> service.buildGraph(FIXTURE));
        assertEquals("WriteGraph", error.getOperation());
    }

    @Test
    @DisplayName("Should load with the configured reconstruction parameters")
    void testLoadGraph_Defaults() {
        KnowledgeGraph stored = KnowledgeGraph.builder().rootNodeId(5).build();
        when(graphStore.readGraph(5L, 50, 10000, 1000)).thenReturn(stored);

        assertSame(stored, service.loadGraph(5L));
    }

    @Test
    @DisplayName("Should delegate existence checks and deletes to the store")
    void testDeleteAndExists() {
        when(graphStore.graphExists(3L)).thenReturn(true);

        assertTrue(service.graphExists(3L));
        service.deleteGraph(3L);
        service.deleteAllGraphs();

        verify(graphStore).deleteGraph(3L);
        verify(graphStore).deleteAllGraphs();
    }

    @Test
    @DisplayName("Should not write when the id reservation fails")
    void testBuildGraph_ReservationFailure() {
        when(graphStore.reserveNodeIds(anyLong()))
                .thenThrow(new GraphStoreException("ReserveNodeIds", "connection refused"));

        GraphStoreException error = assertThrows(GraphStoreException.class, () -> service.buildGraph(FIXTURE));

        assertEquals("ReserveNodeIds", error.getOperation());
        verify(graphStore, never()).writeGraph(any());
    }

    @Test
    @DisplayName("Should give each concurrent build the block its own reservation returned")
    void testBuildGraph_ConcurrentBuildsUseOwnBlocks() throws Exception {
        // Given: a store handing out consecutive blocks like the Neo4j sequence does
        AtomicLong sequence = new AtomicLong();
        when(graphStore.reserveNodeIds(anyLong())).thenAnswer(call -> sequence.getAndAdd(call.<Long>getArgument(0)));
        List<KnowledgeGraph> written = new CopyOnWriteArrayList<>();
        doAnswer(call -> written.add(call.getArgument(0))).when(graphStore).writeGraph(any());

        // When
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<Long>> roots = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                roots.add(executor.submit(() -> service.buildGraph(FIXTURE)));
            }
            for (Future<Long> root : roots) {
                root.get(1, TimeUnit.MINUTES);
            }
        } finally {
            executor.shutdownNow();
        }

        // Then: four graphs whose ids tile 0..383 without overlap
        assertEquals(4, written.size());
        Set<Long> ids = new HashSet<>();
        for (KnowledgeGraph graph : written) {
            graph.getNodes().forEach(node -> assertTrue(ids.add(node.nodeId()), "duplicate id " + node.nodeId()));
        }
        assertEquals(384, ids.size());
        assertEquals(383L, ids.stream().mapToLong(Long::longValue).max().orElseThrow());
    }
}
