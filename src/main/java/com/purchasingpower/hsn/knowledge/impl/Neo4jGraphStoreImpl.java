package com.purchasingpower.hsn.knowledge.impl;

import com.purchasingpower.hsn.core.GraphEdge;
import com.purchasingpower.hsn.core.GraphNode;
import com.purchasingpower.hsn.core.NodeLabel;
import com.purchasingpower.hsn.core.RelationType;
import com.purchasingpower.hsn.exception.UpstreamFailureException;
import com.purchasingpower.hsn.knowledge.GraphCapability;
import com.purchasingpower.hsn.knowledge.GraphSnapshot;
import com.purchasingpower.hsn.knowledge.GraphStatistics;
import com.purchasingpower.hsn.knowledge.GraphStore;
import com.purchasingpower.hsn.knowledge.RelationshipDirection;
import com.purchasingpower.hsn.util.CallContext;
import com.purchasingpower.hsn.util.ExternalCallLogger;
import com.purchasingpower.hsn.util.ServiceType;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.exceptions.Neo4jException;
import org.neo4j.driver.types.Node;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Neo4j implementation of {@link GraphStore}.
 *
 * <p>Every node carries its taxonomy label both as a Neo4j label and as a
 * {@code label} property. Writes use {@code MERGE} and report creation through
 * the result summary counters.
 *
 * @since 1.0.0
 */
@Slf4j
public class Neo4jGraphStoreImpl implements GraphStore {

    private final Driver driver;

    public Neo4jGraphStoreImpl(String uri, String username, String password) {
        this(GraphDatabase.driver(uri, AuthTokens.basic(username, password)));
        log.info("Initialized Neo4j graph store at: {}", uri);
    }

    Neo4jGraphStoreImpl(Driver driver) {
        this.driver = driver;
    }

    @Override
    public void close() {
        if (driver != null) {
            driver.close();
            log.info("Neo4j graph store connection closed");
        }
    }

    @Override
    public void createIndexes() {
        log.info("Creating Neo4j indexes...");
        execute("CreateIndexes", session -> {
            for (NodeLabel label : NodeLabel.values()) {
                String name = label.getDisplayName().toLowerCase() + "_id";
                session.run("CREATE INDEX " + name + " IF NOT EXISTS FOR (n:" + label.getDisplayName() + ") ON (n.id)");
            }
            return null;
        });
        log.info("✅ Neo4j indexes created");
    }

    @Override
    public boolean addNode(GraphNode node) {
        // Label comes from the enum, never from user input
        String cypher = """
            MERGE (n:%s {id: $id})
            ON CREATE SET n.description = $description, n.label = $label
            """.formatted(node.getLabel().getDisplayName());

        Map<String, Object> params = createParams(
                "id", node.getId(),
                "description", node.getDescription(),
                "label", node.getLabel().getDisplayName());

        return execute("AddNode", session -> session.executeWrite(tx ->
                tx.run(cypher, params).consume().counters().nodesCreated() > 0));
    }

    @Override
    public boolean addEdge(GraphEdge edge) {
        String cypher = """
            MATCH (a {id: $source}), (b {id: $target})
            MERGE (a)-[r:%s]->(b)
            ON CREATE SET r += $properties
            """.formatted(edge.getRelation().name());

        Map<String, Object> params = createParams(
                "source", edge.getSourceId(),
                "target", edge.getTargetId(),
                "properties", edge.getProperties());

        return execute("AddEdge", session -> session.executeWrite(tx ->
                tx.run(cypher, params).consume().counters().relationshipsCreated() > 0));
    }

    @Override
    public Optional<GraphNode> findNode(String nodeId) {
        List<GraphNode> found = readNodes("MATCH (n {id: $id}) RETURN n", createParams("id", nodeId));
        return found.stream().findFirst();
    }

    @Override
    public List<GraphNode> neighbors(String nodeId, RelationshipDirection direction) {
        String pattern = switch (direction) {
            case INCOMING -> "(a {id: $id})<--(b)";
            case OUTGOING -> "(a {id: $id})-->(b)";
            case BOTH -> "(a {id: $id})--(b)";
        };
        return readNodes("MATCH " + pattern + " RETURN DISTINCT b AS n ORDER BY n.id", createParams("id", nodeId));
    }

    @Override
    public List<GraphEdge> incomingEdges(String nodeId) {
        String cypher = """
            MATCH (a)-[r]->(b {id: $id})
            RETURN a.id AS source, b.id AS target, type(r) AS relation, properties(r) AS props
            ORDER BY source, relation
            """;
        return readEdges(cypher, createParams("id", nodeId));
    }

    @Override
    public List<GraphNode> nodesWithLabel(NodeLabel label) {
        return readNodes("MATCH (n:" + label.getDisplayName() + ") RETURN n ORDER BY n.id", Map.of());
    }

    @Override
    public GraphSnapshot subgraph(String nodeId, int depth) {
        List<GraphNode> nodes;
        if (depth <= 0) {
            nodes = findNode(nodeId).map(List::of).orElse(List.of());
        } else {
            String cypher = """
                MATCH (start {id: $id})
                OPTIONAL MATCH (start)-[*1..%d]-(m)
                WITH start, collect(DISTINCT m) AS reached
                UNWIND [start] + reached AS n
                RETURN DISTINCT n ORDER BY n.id
                """.formatted(depth);
            nodes = readNodes(cypher, createParams("id", nodeId));
        }

        List<String> ids = nodes.stream().map(GraphNode::getId).toList();
        String edgeCypher = """
            MATCH (a)-[r]->(b)
            WHERE a.id IN $ids AND b.id IN $ids
            RETURN a.id AS source, b.id AS target, type(r) AS relation, properties(r) AS props
            ORDER BY source, target, relation
            """;
        List<GraphEdge> edges = ids.isEmpty() ? List.of() : readEdges(edgeCypher, createParams("ids", ids));
        return new GraphSnapshot(nodes, edges);
    }

    @Override
    public GraphSnapshot snapshot() {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.NEO4J, "Snapshot", log);
        callCtx.logRequest("Reading full graph");
        List<GraphNode> nodes = readNodes("MATCH (n) WHERE n.label IS NOT NULL RETURN n ORDER BY n.id", Map.of());
        List<GraphEdge> edges = readEdges("""
            MATCH (a)-[r]->(b)
            RETURN a.id AS source, b.id AS target, type(r) AS relation, properties(r) AS props
            ORDER BY source, target, relation
            """, Map.of());
        callCtx.logResponse("Graph read", "Nodes", nodes.size(), "Edges", edges.size());
        return new GraphSnapshot(nodes, edges);
    }

    @Override
    public GraphStatistics statistics() {
        return execute("Statistics", session -> {
            Map<NodeLabel, Long> byLabel = new EnumMap<>(NodeLabel.class);
            session.run("MATCH (n) WHERE n.label IS NOT NULL RETURN n.label AS label, count(n) AS count")
                    .forEachRemaining(r -> byLabel.put(
                            NodeLabel.fromDisplayName(r.get("label").asString()), r.get("count").asLong()));

            Map<RelationType, Long> byRelation = new EnumMap<>(RelationType.class);
            session.run("MATCH ()-[r]->() RETURN type(r) AS relation, count(r) AS count")
                    .forEachRemaining(r -> byRelation.put(
                            RelationType.valueOf(r.get("relation").asString()), r.get("count").asLong()));

            return GraphStatistics.builder()
                    .nodeCount(byLabel.values().stream().mapToLong(Long::longValue).sum())
                    .edgeCount(byRelation.values().stream().mapToLong(Long::longValue).sum())
                    .nodesByLabel(byLabel)
                    .edgesByRelation(byRelation)
                    .build();
        });
    }

    @Override
    public Set<GraphCapability> capabilities() {
        return EnumSet.of(GraphCapability.TRANSACTIONAL);
    }

    // ================================================================
    // HELPERS
    // ================================================================

    private List<GraphNode> readNodes(String cypher, Map<String, Object> params) {
        return execute("ReadNodes", session -> session.executeRead(tx ->
                tx.run(cypher, params).list(r -> toGraphNode(r.get("n").asNode()))));
    }

    private List<GraphEdge> readEdges(String cypher, Map<String, Object> params) {
        return execute("ReadEdges", session -> session.executeRead(tx ->
                tx.run(cypher, params).list(this::toGraphEdge)));
    }

    private <T> T execute(String operation, Function<Session, T> work) {
        try (Session session = driver.session()) {
            return work.apply(session);
        } catch (Neo4jException e) {
            log.error("Neo4j {} failed: {}", operation, e.getMessage());
            throw new UpstreamFailureException(ServiceType.NEO4J, operation + " failed", e);
        }
    }

    private GraphNode toGraphNode(Node node) {
        return GraphNode.builder()
                .id(node.get("id").asString())
                .label(NodeLabel.fromDisplayName(node.get("label").asString()))
                .description(node.get("description").asString(GraphNode.NOT_SPECIFIED))
                .build();
    }

    private GraphEdge toGraphEdge(Record record) {
        return GraphEdge.builder()
                .sourceId(record.get("source").asString())
                .targetId(record.get("target").asString())
                .relation(RelationType.valueOf(record.get("relation").asString()))
                .properties(record.get("props").asMap())
                .build();
    }

    /**
     * Build a params map, replacing nulls with empty strings (Neo4j rejects
     * null map entries in {@code SET +=}).
     */
    private Map<String, Object> createParams(Object... keyValues) {
        Map<String, Object> params = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            Object value = keyValues[i + 1];
            params.put((String) keyValues[i], value == null ? "" : value);
        }
        return params;
    }
}
