package com.purchasingpower.codegraph.knowledge.impl;

import com.purchasingpower.codegraph.configuration.GraphProperties;
import com.purchasingpower.codegraph.knowledge.GraphBuilder;
import com.purchasingpower.codegraph.knowledge.GraphStore;
import com.purchasingpower.codegraph.knowledge.KnowledgeGraphService;
import com.purchasingpower.codegraph.model.graph.KnowledgeGraph;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;

/**
 * Default KnowledgeGraphService: builds in memory, then hands the graph to the GraphStore.
 *
 * <p>A graph is built with provisional ids, then moved into a block of ids the store reserves
 * atomically just before the write. Builds running at the same time, for different repositories
 * or in different processes, therefore never share ids.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KnowledgeGraphServiceImpl implements KnowledgeGraphService {

    private final GraphStore graphStore;
    private final GraphProperties graphProperties;

    @Override
    public long buildGraph(Path rootDir) {
        return buildGraph(rootDir, graphProperties.getMaxAstDepth());
    }

    @Override
    public long buildGraph(Path rootDir, int maxAstDepth) {
        long startTime = System.currentTimeMillis();
        log.info("Starting knowledge graph build for {}", rootDir);

        GraphBuilder builder = new GraphBuilder(maxAstDepth,
                graphProperties.getChunkSize(), graphProperties.getChunkOverlap());
        KnowledgeGraph provisional = builder.build(rootDir, 0);

        long firstNodeId = graphStore.reserveNodeIds(provisional.getNodeIdSpan());
        KnowledgeGraph graph = provisional.relocate(firstNodeId);

        graphStore.writeGraph(graph);

        long duration = System.currentTimeMillis() - startTime;
        log.info("Knowledge graph {} built for {}: {} nodes, {} edges in {}ms",
                graph.getRootNodeId(), rootDir, graph.getNodes().size(), graph.getEdges().size(), duration);
        return graph.getRootNodeId();
    }

    @Override
    public KnowledgeGraph loadGraph(long rootNodeId) {
        return loadGraph(rootNodeId, graphProperties.getMaxAstDepth(),
                graphProperties.getChunkSize(), graphProperties.getChunkOverlap());
    }

    @Override
    public KnowledgeGraph loadGraph(long rootNodeId, int maxAstDepth, int chunkSize, int chunkOverlap) {
        return graphStore.readGraph(rootNodeId, maxAstDepth, chunkSize, chunkOverlap);
    }

    @Override
    public boolean graphExists(long rootNodeId) {
        return graphStore.graphExists(rootNodeId);
    }

    @Override
    public void deleteGraph(long rootNodeId) {
        log.info("Deleting knowledge graph {}", rootNodeId);
        graphStore.deleteGraph(rootNodeId);
    }

    @Override
    public void deleteAllGraphs() {
        log.info("Deleting all knowledge graphs");
        graphStore.deleteAllGraphs();
    }

    @Override
    public String renderFileTree(long rootNodeId) {
        return loadGraph(rootNodeId).renderFileTree(
                graphProperties.getFileTreeMaxDepth(), graphProperties.getFileTreeMaxLines());
    }
}
