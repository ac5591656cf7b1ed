package com.purchasingpower.codegraph.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Knowledge graph construction and query settings, bound from {@code app.graph}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.graph")
public class GraphProperties {

    /**
     * Maximum PARENT_OF distance kept below a file's AST root.
     */
    @Min(value = 1, message = "max-ast-depth must be at least 1")
    private int maxAstDepth = 50;

    /**
     * Maximum characters per documentation chunk.
     */
    @Min(value = 1, message = "chunk-size must be positive")
    private int chunkSize = 10000;

    /**
     * Characters shared between consecutive chunks of one section.
     */
    @Min(0)
    private int chunkOverlap = 1000;

    @Min(value = 1, message = "neo4j-batch-size must be positive")
    private int neo4jBatchSize = 1000;

    /**
     * Default token budget for a formatted tool result.
     */
    @Min(1)
    private int maxTokenPerResult = 5000;

    @Min(0)
    private int fileTreeMaxDepth = 5;

    @Min(1)
    private int fileTreeMaxLines = 5000;
}
