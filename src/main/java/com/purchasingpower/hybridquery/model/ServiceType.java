package com.purchasingpower.hybridquery.model;

/**
 * Store collaborators reached by the executor, used to tag call logs.
 *
 * @see com.purchasingpower.hybridquery.util.ExternalCallLogger
 */
public enum ServiceType {
    RELATIONAL("🟠", "Relational"),
    VECTOR("🔵", "Vector"),
    GRAPH("🟢", "Graph"),
    EMBEDDING("🔴", "Embedding");

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
