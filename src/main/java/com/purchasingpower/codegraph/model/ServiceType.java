package com.purchasingpower.codegraph.model;

/**
 * Enumeration of external service types for unified logging.
 *
 * Used by ExternalCallLogger to categorize and log calls to
 * the services the graph engine depends on.
 *
 * @see com.purchasingpower.codegraph.util.ExternalCallLogger
 */
public enum ServiceType {
    NEO4J("🟢", "Neo4j"),
    FILESYSTEM("📁", "Filesystem");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
