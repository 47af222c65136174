package com.purchasingpower.hsn.knowledge;

import com.purchasingpower.hsn.core.GraphEdge;
import com.purchasingpower.hsn.core.GraphNode;
import com.purchasingpower.hsn.core.NodeLabel;
import com.purchasingpower.hsn.knowledge.export.GraphMlExporter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Storage of the HSN taxonomy graph.
 *
 * <p>Two backends satisfy this contract: an in-memory directed graph and a Neo4j
 * database. They differ only in persistence and latency. Insertion is
 * idempotent and reports whether the entity was newly created; inserting an
 * existing node id or an existing (source, target, relation) edge is a no-op,
 * never an error.
 *
 * <p>Implementations must tolerate concurrent reads once a build has completed.
 *
 * @since 1.0.0
 */
public interface GraphStore extends AutoCloseable {

    // =========================================================================
    // Write Operations
    // =========================================================================

    /**
     * Add a node unless a node with the same id exists.
     *
     * @param node Node to add
     * @return true if the node was created
     */
    boolean addNode(GraphNode node);

    /**
     * Add an edge unless an identical (source, target, relation) edge exists.
     * Edges whose endpoints are missing are skipped.
     *
     * @param edge Edge to add
     * @return true if the edge was created
     */
    boolean addEdge(GraphEdge edge);

    /**
     * Create backend indexes. No-op where the backend has none.
     */
    void createIndexes();

    // =========================================================================
    // Read Operations
    // =========================================================================

    Optional<GraphNode> findNode(String nodeId);

    /**
     * Nodes one hop away. Order is deterministic within one process run.
     *
     * @param nodeId Start node
     * @param direction INCOMING for predecessors, OUTGOING for successors
     * @return Neighbor nodes, empty if the node is unknown
     */
    List<GraphNode> neighbors(String nodeId, RelationshipDirection direction);

    /**
     * Edges pointing at a node, in insertion order where the backend keeps one.
     */
    List<GraphEdge> incomingEdges(String nodeId);

    List<GraphNode> nodesWithLabel(NodeLabel label);

    /**
     * Induced subgraph of all nodes within {@code depth} hops, ignoring edge
     * direction.
     */
    GraphSnapshot subgraph(String nodeId, int depth);

    /**
     * Every node and edge in the graph.
     */
    GraphSnapshot snapshot();

    GraphStatistics statistics();

    // =========================================================================
    // Capabilities and lifecycle
    // =========================================================================

    Set<GraphCapability> capabilities();

    default boolean supports(GraphCapability capability) {
        return capabilities().contains(capability);
    }

    /**
     * Write the graph as GraphML.
     *
     * @param path Target file
     */
    default void export(Path path) throws IOException {
        GraphMlExporter.write(snapshot(), path);
    }

    @Override
    void close();
}
