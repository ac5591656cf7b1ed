package com.purchasingpower.codegraph.knowledge.impl;

import com.purchasingpower.codegraph.exception.GraphStoreException;
import com.purchasingpower.codegraph.model.CallContext;
import com.purchasingpower.codegraph.model.ServiceType;
import com.purchasingpower.codegraph.query.GraphQueryRunner;
import com.purchasingpower.codegraph.util.ExternalCallLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.Value;
import org.neo4j.driver.types.Node;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Executes traversal tool queries in read transactions.
 *
 * <p>Node values are flattened to their property maps so callers never see driver types.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class Neo4jGraphQueryRunner implements GraphQueryRunner {

    private final Driver driver;
    private final SessionConfig sessionConfig;

    @Override
    public List<Map<String, Object>> read(String cypher, Map<String, Object> parameters) {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.NEO4J, "ReadQuery", log);
        ctx.logRequest(ExternalCallLogger.truncate(cypher.strip(), 200), "Parameters", parameters);

        try (Session session = driver.session(sessionConfig)) {
            List<Map<String, Object>> rows = session.executeRead(tx ->
                    tx.run(cypher, parameters).list(record -> record.asMap(Neo4jGraphQueryRunner::toPlain)));
            ctx.logResponse("Query returned " + rows.size() + " rows");
            return rows;
        } catch (Exception e) {
            ctx.logError("Failed to execute query", e);
            throw new GraphStoreException("ReadQuery", "Failed to execute traversal query", e);
        }
    }

    private static Object toPlain(Value value) {
        Object object = value.asObject();
        if (object instanceof Node node) {
            return node.asMap();
        }
        return object;
    }
}
