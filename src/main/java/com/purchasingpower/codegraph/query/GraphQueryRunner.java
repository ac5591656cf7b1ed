package com.purchasingpower.codegraph.query;

import java.util.List;
import java.util.Map;

/**
 * Runs one parameterized read-only Cypher query and returns its rows.
 *
 * <p>Row values are plain Java types: maps for nodes, lists, strings and numbers.
 */
public interface GraphQueryRunner {

    List<Map<String, Object>> read(String cypher, Map<String, Object> parameters);
}
