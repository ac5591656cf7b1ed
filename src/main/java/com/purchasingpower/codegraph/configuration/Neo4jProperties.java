package com.purchasingpower.codegraph.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings for the Neo4j instance holding the graphs.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "neo4j")
public class Neo4jProperties {

    @NotBlank(message = "Neo4j URI is required")
    private String uri = "bolt://localhost:7687";

    @NotBlank
    private String username = "neo4j";

    private String password = "password";

    /**
     * Target database, blank for the server default.
     */
    private String database = "";
}
