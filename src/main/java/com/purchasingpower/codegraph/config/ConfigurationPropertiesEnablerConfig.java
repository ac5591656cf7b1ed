package com.purchasingpower.codegraph.config;

import com.purchasingpower.codegraph.configuration.GraphProperties;
import com.purchasingpower.codegraph.configuration.Neo4jProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the application's @ConfigurationProperties classes.
 *
 * <p>Enabled configuration classes:
 * <ul>
 *   <li>{@link GraphProperties} - graph construction and query limits
 *   <li>{@link Neo4jProperties} - Neo4j connection settings
 * </ul>
 *
 * @since 1.0.0
 */
@Configuration
@EnableConfigurationProperties({
    GraphProperties.class,
    Neo4jProperties.class
})
public class ConfigurationPropertiesEnablerConfig {
}
