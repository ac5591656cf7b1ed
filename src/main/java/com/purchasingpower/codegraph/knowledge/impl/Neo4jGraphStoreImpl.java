package com.purchasingpower.codegraph.knowledge.impl;

import com.purchasingpower.codegraph.configuration.GraphProperties;
import com.purchasingpower.codegraph.exception.GraphStoreException;
import com.purchasingpower.codegraph.knowledge.GraphStore;
import com.purchasingpower.codegraph.model.CallContext;
import com.purchasingpower.codegraph.model.ServiceType;
import com.purchasingpower.codegraph.model.graph.AstNode;
import com.purchasingpower.codegraph.model.graph.EdgeType;
import com.purchasingpower.codegraph.model.graph.FileNode;
import com.purchasingpower.codegraph.model.graph.GraphEdge;
import com.purchasingpower.codegraph.model.graph.GraphNode;
import com.purchasingpower.codegraph.model.graph.KnowledgeGraph;
import com.purchasingpower.codegraph.model.graph.TextNode;
import com.purchasingpower.codegraph.util.ExternalCallLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Neo4j implementation of GraphStore interface.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class Neo4jGraphStoreImpl implements GraphStore {

    static final int DELETE_ALL_ATTEMPTS = 3;

    private static final String ROOT_FILES = """
            MATCH (root:FileNode {node_id: $root_id})-[:HAS_FILE*0..]->(f:FileNode)
            """;

    private static final Map<EdgeType, String> EDGE_READ_PATTERNS = new EnumMap<>(Map.of(
            EdgeType.HAS_FILE, ROOT_FILES + "MATCH (f)-[:HAS_FILE]->(t:FileNode) WITH f AS s, t",
            EdgeType.HAS_AST, ROOT_FILES + "MATCH (f)-[:HAS_AST]->(t:ASTNode) WITH f AS s, t",
            EdgeType.HAS_TEXT, ROOT_FILES + "MATCH (f)-[:HAS_TEXT]->(t:TextNode) WITH f AS s, t",
            EdgeType.PARENT_OF, ROOT_FILES
                    + "MATCH (f)-[:HAS_AST]->(:ASTNode)-[:PARENT_OF*0..]->(s:ASTNode)-[:PARENT_OF]->(t:ASTNode)",
            EdgeType.NEXT_CHUNK, ROOT_FILES
                    + "MATCH (f)-[:HAS_TEXT]->(:TextNode)-[:NEXT_CHUNK*0..]->(s:TextNode)-[:NEXT_CHUNK]->(t:TextNode)"
    ));

    private static final List<String> NODE_LABELS = List.of(FileNode.LABEL, AstNode.LABEL, TextNode.LABEL);

    private static final String OWN_LABELS = "n:FileNode OR n:ASTNode OR n:TextNode";

    static final String SEQUENCE_LABEL = "NodeIdSequence";

    private static final String SEQUENCE_NAME = "node_id";

    // the _lock write takes the node's write lock before s.next is read
    private static final String RESERVE_CYPHER = """
            MERGE (s:NodeIdSequence {name: $name})
              ON CREATE SET s.next = 0
            SET s._lock = true
            WITH s
            OPTIONAL MATCH (n) WHERE %s
            WITH s, coalesce(max(n.node_id) + 1, 0) AS stored_next
            WITH s, CASE WHEN s.next > stored_next THEN s.next ELSE stored_next END AS first_id
            SET s.next = first_id + $count
            REMOVE s._lock
            RETURN first_id
            """.formatted(OWN_LABELS);

    private final Driver driver;
    private final SessionConfig sessionConfig;
    private final GraphProperties graphProperties;

    private final Object schemaLock = new Object();
    private volatile boolean schemaReady;

    // ================================================================
    // WRITE
    // ================================================================

    @Override
    public void writeGraph(KnowledgeGraph graph) {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.NEO4J, "WriteGraph", log);
        ctx.logRequest("Writing knowledge graph " + graph.getRootNodeId(),
                "FileNodes", graph.getFileNodes().size(),
                "ASTNodes", graph.getAstNodes().size(),
                "TextNodes", graph.getTextNodes().size(),
                "Edges", graph.getEdges().size(),
                "BatchSize", graphProperties.getNeo4jBatchSize());

        try (Session session = driver.session(sessionConfig)) {
            ensureSchema(session);

            writeNodes(session, ctx, FileNode.LABEL, graph.getFileNodes());
            writeNodes(session, ctx, AstNode.LABEL, graph.getAstNodes());
            writeNodes(session, ctx, TextNode.LABEL, graph.getTextNodes());

            // enum order: HAS_AST, HAS_FILE, HAS_TEXT, NEXT_CHUNK, then PARENT_OF on its own
            for (EdgeType type : EdgeType.values()) {
                writeEdges(session, ctx, type, graph.getEdges(type));
            }

            ctx.logResponse("Knowledge graph written");
        } catch (Exception e) {
            ctx.logError("Failed to write knowledge graph", e);
            throw new GraphStoreException("WriteGraph", "Failed to write knowledge graph " + graph.getRootNodeId(), e);
        }
    }

    // once per store instance; concurrent IF NOT EXISTS creations of one constraint can conflict
    private void ensureSchema(Session session) {
        if (schemaReady) {
            return;
        }
        synchronized (schemaLock) {
            if (schemaReady) {
                return;
            }
            List<String> statements = new ArrayList<>();
            for (String label : NODE_LABELS) {
                statements.add(String.format(
                        "CREATE CONSTRAINT unique_%s_node_id IF NOT EXISTS FOR (n:%s) REQUIRE n.node_id IS UNIQUE",
                        toSnakeCase(label), label));
            }
            statements.add("CREATE CONSTRAINT unique_node_id_sequence_name IF NOT EXISTS "
                    + "FOR (s:" + SEQUENCE_LABEL + ") REQUIRE s.name IS UNIQUE");

            for (String cypher : statements) {
                session.executeWrite(tx -> {
                    tx.run(cypher);
                    return null;
                });
            }
            schemaReady = true;
            log.debug("Uniqueness constraints ensured");
        }
    }

    private void writeNodes(Session session, CallContext ctx, String label, List<GraphNode> nodes) {
        String cypher = String.format("""
                UNWIND $rows AS row
                MERGE (n:%s {node_id: row.node_id})
                SET n += row
                """, label);
        writeBatches(session, ctx, label, cypher, nodes, GraphRowMapper::toRow);
    }

    private void writeEdges(Session session, CallContext ctx, EdgeType type, List<GraphEdge> edges) {
        String cypher = String.format("""
                UNWIND $rows AS row
                MATCH (s:%s {node_id: row.source_id})
                MATCH (t:%s {node_id: row.target_id})
                MERGE (s)-[:%s]->(t)
                """, type.getSourceLabel(), type.getTargetLabel(), type.name());
        writeBatches(session, ctx, type.name(), cypher, edges, GraphRowMapper::toRow);
    }

    private <T> void writeBatches(Session session, CallContext ctx, String kind, String cypher, List<T> items,
                                  Function<T, Map<String, Object>> toRow) {
        int batchSize = graphProperties.getNeo4jBatchSize();
        for (int start = 0; start < items.size(); start += batchSize) {
            List<Map<String, Object>> rows = items.subList(start, Math.min(start + batchSize, items.size()))
                    .stream()
                    .map(toRow)
                    .toList();
            // one managed transaction per batch so the driver can retry it
            session.executeWrite(tx -> {
                tx.run(cypher, Map.of("rows", rows));
                return null;
            });
        }
        ctx.logProgress("Wrote " + items.size() + " " + kind);
    }

    // ================================================================
    // READ
    // ================================================================

    @Override
    public KnowledgeGraph readGraph(long rootNodeId, int maxAstDepth, int chunkSize, int chunkOverlap) {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.NEO4J, "ReadGraph", log);
        ctx.logRequest("Reading knowledge graph " + rootNodeId);

        try (Session session = driver.session(sessionConfig)) {
            Map<String, Object> params = Map.of("root_id", rootNodeId);

            Map<Long, GraphNode> fileNodes = readNodes(session, ROOT_FILES + "RETURN DISTINCT properties(f) AS n",
                    params, GraphRowMapper::fileNode);
            if (!fileNodes.containsKey(rootNodeId)) {
                throw new GraphStoreException("ReadGraph", "Node with node_id " + rootNodeId + " not found");
            }
            Map<Long, GraphNode> astNodes = readNodes(session, ROOT_FILES + """
                    MATCH (f)-[:HAS_AST]->(:ASTNode)-[:PARENT_OF*0..]->(a:ASTNode)
                    RETURN DISTINCT properties(a) AS n
                    """, params, GraphRowMapper::astNode);
            Map<Long, GraphNode> textNodes = readNodes(session, ROOT_FILES + """
                    MATCH (f)-[:HAS_TEXT]->(:TextNode)-[:NEXT_CHUNK*0..]->(t:TextNode)
                    RETURN DISTINCT properties(t) AS n
                    """, params, GraphRowMapper::textNode);

            Map<Long, GraphNode> allNodes = new LinkedHashMap<>();
            allNodes.putAll(fileNodes);
            allNodes.putAll(astNodes);
            allNodes.putAll(textNodes);

            List<GraphEdge> edges = new ArrayList<>();
            for (EdgeType type : EdgeType.values()) {
                edges.addAll(readEdges(session, type, params, allNodes));
            }

            KnowledgeGraph graph = KnowledgeGraph.builder()
                    .rootNodeId(rootNodeId)
                    .maxAstDepth(maxAstDepth)
                    .chunkSize(chunkSize)
                    .chunkOverlap(chunkOverlap)
                    .nodes(new ArrayList<>(allNodes.values()))
                    .edges(edges)
                    .build();

            ctx.logResponse("Knowledge graph read",
                    "Nodes", allNodes.size(),
                    "Edges", edges.size());
            return graph;
        } catch (GraphStoreException e) {
            ctx.logError(e.getMessage(), e);
            throw e;
        } catch (Exception e) {
            ctx.logError("Failed to read knowledge graph", e);
            throw new GraphStoreException("ReadGraph", "Failed to read knowledge graph " + rootNodeId, e);
        }
    }

    private Map<Long, GraphNode> readNodes(Session session, String cypher, Map<String, Object> params,
                                           Function<Map<String, Object>, GraphNode> mapper) {
        return session.executeRead(tx -> {
            Map<Long, GraphNode> nodes = new LinkedHashMap<>();
            for (Record record : tx.run(cypher, params).list()) {
                GraphNode node = mapper.apply(record.get("n").asMap());
                nodes.put(node.nodeId(), node);
            }
            return nodes;
        });
    }

    private List<GraphEdge> readEdges(Session session, EdgeType type, Map<String, Object> params,
                                      Map<Long, GraphNode> nodes) {
        String cypher = EDGE_READ_PATTERNS.get(type) + """

                RETURN DISTINCT s.node_id AS source_id, t.node_id AS target_id
                """;
        List<Record> records = session.executeRead(tx -> tx.run(cypher, params).list());

        List<GraphEdge> edges = new ArrayList<>();
        for (Record record : records) {
            GraphNode source = nodes.get(record.get(GraphRowMapper.SOURCE_ID).asLong());
            GraphNode target = nodes.get(record.get(GraphRowMapper.TARGET_ID).asLong());
            // both endpoints must belong to this root's subgraph
            if (source != null && target != null) {
                edges.add(new GraphEdge(source, target, type));
            }
        }
        return edges;
    }

    @Override
    public boolean graphExists(long rootNodeId) {
        String cypher = """
                MATCH (f:FileNode {node_id: $root_id})
                WHERE NOT ()-[:HAS_FILE]->(f)
                RETURN count(f) > 0 AS found
                """;

        try (Session session = driver.session(sessionConfig)) {
            return session.executeRead(tx ->
                    tx.run(cypher, Map.of("root_id", rootNodeId)).single().get("found").asBoolean());
        } catch (Exception e) {
            throw new GraphStoreException("GraphExists", "Failed to check knowledge graph " + rootNodeId, e);
        }
    }

    @Override
    public long nextNodeId() {
        String cypher = """
                OPTIONAL MATCH (n) WHERE %s
                WITH coalesce(max(n.node_id) + 1, 0) AS stored_next
                OPTIONAL MATCH (s:NodeIdSequence {name: $name})
                RETURN CASE WHEN s.next > stored_next THEN s.next ELSE stored_next END AS next_id
                """.formatted(OWN_LABELS);

        try (Session session = driver.session(sessionConfig)) {
            return session.executeRead(tx ->
                    tx.run(cypher, Map.of("name", SEQUENCE_NAME)).single().get("next_id").asLong());
        } catch (Exception e) {
            throw new GraphStoreException("NextNodeId", "Failed to read the highest node_id", e);
        }
    }

    @Override
    public long reserveNodeIds(long count) {
        if (count < 1) {
            throw new IllegalArgumentException("count must be positive: " + count);
        }

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.NEO4J, "ReserveNodeIds", log);
        ctx.logRequest("Reserving " + count + " node ids");

        try (Session session = driver.session(sessionConfig)) {
            ensureSchema(session);
            long firstId = session.executeWrite(tx -> {
                Value first = tx.run(RESERVE_CYPHER, Map.of("name", SEQUENCE_NAME, "count", count))
                        .single()
                        .get("first_id");
                return first.asLong();
            });
            ctx.logResponse("Reserved node ids " + firstId + ".." + (firstId + count - 1));
            return firstId;
        } catch (Exception e) {
            ctx.logError("Failed to reserve node ids", e);
            throw new GraphStoreException("ReserveNodeIds", "Failed to reserve " + count + " node ids", e);
        }
    }

    @Override
    public List<Long> listRootNodeIds() {
        String cypher = """
                MATCH (f:FileNode)
                WHERE NOT ()-[:HAS_FILE]->(f)
                RETURN f.node_id AS node_id
                ORDER BY node_id
                """;

        try (Session session = driver.session(sessionConfig)) {
            return session.executeRead(tx -> tx.run(cypher).list(record -> record.get("node_id").asLong()));
        } catch (Exception e) {
            throw new GraphStoreException("ListRootNodeIds", "Failed to list knowledge graphs", e);
        }
    }

    // ================================================================
    // DELETE
    // ================================================================

    @Override
    public void deleteGraph(long rootNodeId) {
        String cypher = """
                MATCH (root:FileNode {node_id: $root_id})
                OPTIONAL MATCH (root)-[:HAS_FILE|HAS_AST|HAS_TEXT|PARENT_OF|NEXT_CHUNK*]->(n)
                WITH root, collect(DISTINCT n) AS reachable
                FOREACH (x IN reachable | DETACH DELETE x)
                DETACH DELETE root
                """;

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.NEO4J, "DeleteGraph", log);
        ctx.logRequest("Deleting knowledge graph " + rootNodeId);

        try (Session session = driver.session(sessionConfig)) {
            session.executeWrite(tx -> {
                tx.run(cypher, Map.of("root_id", rootNodeId));
                return null;
            });
            ctx.logResponse("Knowledge graph deleted");
        } catch (Exception e) {
            ctx.logError("Failed to delete knowledge graph", e);
            throw new GraphStoreException("DeleteGraph", "Failed to delete knowledge graph " + rootNodeId, e);
        }
    }

    @Override
    public void deleteAllGraphs() {
        // the id sequence goes too, so an emptied store numbers from 0 again
        String labels = OWN_LABELS + " OR n:" + SEQUENCE_LABEL;
        String deleteCypher = "MATCH (n) WHERE " + labels + " DETACH DELETE n";
        String countCypher = "MATCH (n) WHERE " + labels + " RETURN count(n) AS remaining";

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.NEO4J, "DeleteAllGraphs", log);
        ctx.logRequest("Deleting all knowledge graphs");

        Exception lastError = null;
        long remaining = -1;
        for (int attempt = 1; attempt <= DELETE_ALL_ATTEMPTS; attempt++) {
            try (Session session = driver.session(sessionConfig)) {
                session.executeWrite(tx -> {
                    tx.run(deleteCypher);
                    return null;
                });
                remaining = session.executeRead(tx -> tx.run(countCypher).single().get("remaining").asLong());
                if (remaining == 0) {
                    ctx.logResponse("All knowledge graphs deleted", "Attempts", attempt);
                    return;
                }
                log.warn("Attempt {}/{}: {} nodes remain after delete", attempt, DELETE_ALL_ATTEMPTS, remaining);
            } catch (Exception e) {
                lastError = e;
                log.warn("Attempt {}/{} to delete all knowledge graphs failed: {}",
                        attempt, DELETE_ALL_ATTEMPTS, e.getMessage());
            }
        }

        String message = remaining > 0
                ? "Store still holds " + remaining + " nodes after " + DELETE_ALL_ATTEMPTS + " attempts"
                : "Failed to delete all knowledge graphs after " + DELETE_ALL_ATTEMPTS + " attempts";
        ctx.logError(message, lastError);
        throw new GraphStoreException("DeleteAllGraphs", message, lastError);
    }

    private static String toSnakeCase(String label) {
        return switch (label) {
            case FileNode.LABEL -> "file_node";
            case AstNode.LABEL -> "ast_node";
            case TextNode.LABEL -> "text_node";
            default -> label.toLowerCase();
        };
    }
}
