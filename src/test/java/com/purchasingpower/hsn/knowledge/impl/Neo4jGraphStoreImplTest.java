package com.purchasingpower.hsn.knowledge.impl;

import com.purchasingpower.hsn.core.GraphEdge;
import com.purchasingpower.hsn.core.GraphNode;
import com.purchasingpower.hsn.core.NodeLabel;
import com.purchasingpower.hsn.core.RelationType;
import com.purchasingpower.hsn.knowledge.GraphCapability;
import com.purchasingpower.hsn.knowledge.RelationshipDirection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests against a live Neo4j instance.
 *
 * REQUIRES: NEO4J_URI, NEO4J_USERNAME and NEO4J_PASSWORD environment variables.
 * Writes nodes with ids prefixed {@code it_}.
 */
@DisplayName("Neo4j graph store")
@EnabledIfEnvironmentVariable(named = "NEO4J_URI", matches = ".+")
class Neo4jGraphStoreImplTest {

    private Neo4jGraphStoreImpl store;

    @BeforeEach
    void setUp() {
        store = new Neo4jGraphStoreImpl(System.getenv("NEO4J_URI"),
                System.getenv().getOrDefault("NEO4J_USERNAME", "neo4j"),
                System.getenv().getOrDefault("NEO4J_PASSWORD", "password"));
        store.createIndexes();
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    @DisplayName("MERGE makes node and edge insertion idempotent")
    void addNodeAndEdge_areIdempotent() {
        // Given
        GraphNode heading = GraphNode.of("it_head_4011", NodeLabel.HEADING, "New pneumatic tyres, of rubber");
        GraphNode subheading = GraphNode.of("it_sub_401110", NodeLabel.SUBHEADING, "Motor car tyres");
        store.addNode(heading);
        store.addNode(subheading);
        store.addEdge(GraphEdge.of(heading.getId(), subheading.getId(), RelationType.HAS_SUBHEADING));

        // When
        boolean nodeAgain = store.addNode(heading);
        boolean edgeAgain = store.addEdge(GraphEdge.of(heading.getId(), subheading.getId(), RelationType.HAS_SUBHEADING));

        // Then
        assertThat(nodeAgain).isFalse();
        assertThat(edgeAgain).isFalse();
        assertThat(store.neighbors(subheading.getId(), RelationshipDirection.INCOMING))
                .extracting(GraphNode::getId).containsExactly(heading.getId());
        assertThat(store.findNode(subheading.getId())).get()
                .extracting(GraphNode::getLabel).isEqualTo(NodeLabel.SUBHEADING);
    }

    @Test
    @DisplayName("Reports no direct traversal capability")
    void capabilities() {
        assertThat(store.supports(GraphCapability.DIRECT_TRAVERSAL)).isFalse();
        assertThat(store.supports(GraphCapability.TRANSACTIONAL)).isTrue();
    }
}
