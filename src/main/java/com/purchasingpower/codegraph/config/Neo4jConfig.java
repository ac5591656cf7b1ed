package com.purchasingpower.codegraph.config;

import com.purchasingpower.codegraph.configuration.Neo4jProperties;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.SessionConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Neo4j driver wiring.
 *
 * <p>The driver is thread-safe and shared; sessions are opened per operation.
 * Creating the driver does not connect, so the context starts without a running database.
 */
@Slf4j
@Configuration
public class Neo4jConfig {

    @Bean(destroyMethod = "close")
    public Driver neo4jDriver(Neo4jProperties properties) {
        log.info("Initializing Neo4j driver at: {}", properties.getUri());
        return GraphDatabase.driver(properties.getUri(),
                AuthTokens.basic(properties.getUsername(), properties.getPassword()));
    }

    @Bean
    public SessionConfig neo4jSessionConfig(Neo4jProperties properties) {
        if (properties.getDatabase() == null || properties.getDatabase().isBlank()) {
            return SessionConfig.defaultConfig();
        }
        return SessionConfig.forDatabase(properties.getDatabase());
    }
}
