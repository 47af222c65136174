package com.purchasingpower.hsn.util;

/**
 * External services the classifier talks to, for unified call logging.
 *
 * @see ExternalCallLogger
 */
public enum ServiceType {
    VECTOR_STORE("🔵", "VectorStore"),
    PINECONE("🔵", "Pinecone"),
    EMBEDDING("🟣", "Embedding"),
    RERANKER("🟡", "Reranker"),
    NEO4J("🟢", "Neo4j"),
    LLM("🔴", "LLM");

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
