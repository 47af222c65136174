package com.purchasingpower.hsn.knowledge.impl;

import com.purchasingpower.hsn.core.GraphEdge;
import com.purchasingpower.hsn.core.GraphNode;
import com.purchasingpower.hsn.core.NodeLabel;
import com.purchasingpower.hsn.core.RelationType;
import com.purchasingpower.hsn.knowledge.GraphCapability;
import com.purchasingpower.hsn.knowledge.GraphSnapshot;
import com.purchasingpower.hsn.knowledge.GraphStatistics;
import com.purchasingpower.hsn.knowledge.GraphStore;
import com.purchasingpower.hsn.knowledge.RelationshipDirection;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory directed graph.
 *
 * <p>Nodes and edges live in an arena keyed by node id and edge key. All maps
 * preserve insertion order, which makes neighbor order deterministic for one
 * process run.
 *
 * @since 1.0.0
 */
@Slf4j
public class InMemoryGraphStore implements GraphStore {

    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final Map<GraphEdge.Key, GraphEdge> edges = new LinkedHashMap<>();
    private final Map<String, Set<GraphEdge.Key>> outgoing = new LinkedHashMap<>();
    private final Map<String, Set<GraphEdge.Key>> incoming = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public InMemoryGraphStore() {
        log.info("Initializing in-memory graph store");
    }

    @Override
    public boolean addNode(GraphNode node) {
        lock.writeLock().lock();
        try {
            if (nodes.containsKey(node.getId())) {
                return false;
            }
            nodes.put(node.getId(), node);
            outgoing.put(node.getId(), new LinkedHashSet<>());
            incoming.put(node.getId(), new LinkedHashSet<>());
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean addEdge(GraphEdge edge) {
        lock.writeLock().lock();
        try {
            GraphEdge.Key key = edge.key();
            if (edges.containsKey(key)) {
                return false;
            }
            if (!nodes.containsKey(edge.getSourceId()) || !nodes.containsKey(edge.getTargetId())) {
                log.warn("Skipping {} edge {} -> {}: endpoint not in graph",
                        edge.getRelation(), edge.getSourceId(), edge.getTargetId());
                return false;
            }
            edges.put(key, edge);
            outgoing.get(edge.getSourceId()).add(key);
            incoming.get(edge.getTargetId()).add(key);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void createIndexes() {
        log.info("In-memory graph store does not require explicit index creation");
    }

    @Override
    public Optional<GraphNode> findNode(String nodeId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(nodes.get(nodeId));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<GraphNode> neighbors(String nodeId, RelationshipDirection direction) {
        lock.readLock().lock();
        try {
            if (!nodes.containsKey(nodeId)) {
                return Collections.emptyList();
            }
            Set<String> ids = new LinkedHashSet<>();
            if (direction != RelationshipDirection.INCOMING) {
                outgoing.get(nodeId).forEach(key -> ids.add(key.targetId()));
            }
            if (direction != RelationshipDirection.OUTGOING) {
                incoming.get(nodeId).forEach(key -> ids.add(key.sourceId()));
            }
            List<GraphNode> result = new ArrayList<>(ids.size());
            ids.forEach(id -> result.add(nodes.get(id)));
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<GraphEdge> incomingEdges(String nodeId) {
        lock.readLock().lock();
        try {
            Set<GraphEdge.Key> keys = incoming.get(nodeId);
            if (keys == null) {
                return Collections.emptyList();
            }
            return keys.stream().map(edges::get).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<GraphNode> nodesWithLabel(NodeLabel label) {
        lock.readLock().lock();
        try {
            return nodes.values().stream()
                    .filter(node -> node.getLabel() == label)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public GraphSnapshot subgraph(String nodeId, int depth) {
        lock.readLock().lock();
        try {
            if (!nodes.containsKey(nodeId)) {
                return new GraphSnapshot(List.of(), List.of());
            }

            // Undirected BFS over the directed graph
            Set<String> visited = new LinkedHashSet<>();
            visited.add(nodeId);
            Deque<String> frontier = new ArrayDeque<>();
            frontier.add(nodeId);
            for (int hop = 0; hop < depth && !frontier.isEmpty(); hop++) {
                Deque<String> next = new ArrayDeque<>();
                for (String current : frontier) {
                    for (GraphEdge.Key key : outgoing.get(current)) {
                        if (visited.add(key.targetId())) {
                            next.add(key.targetId());
                        }
                    }
                    for (GraphEdge.Key key : incoming.get(current)) {
                        if (visited.add(key.sourceId())) {
                            next.add(key.sourceId());
                        }
                    }
                }
                frontier = next;
            }

            List<GraphNode> subNodes = visited.stream().map(nodes::get).toList();
            List<GraphEdge> subEdges = edges.values().stream()
                    .filter(e -> visited.contains(e.getSourceId()) && visited.contains(e.getTargetId()))
                    .toList();
            return new GraphSnapshot(subNodes, subEdges);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public GraphSnapshot snapshot() {
        lock.readLock().lock();
        try {
            return new GraphSnapshot(new ArrayList<>(nodes.values()), new ArrayList<>(edges.values()));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public GraphStatistics statistics() {
        lock.readLock().lock();
        try {
            Map<NodeLabel, Long> byLabel = new EnumMap<>(NodeLabel.class);
            nodes.values().forEach(n -> byLabel.merge(n.getLabel(), 1L, Long::sum));
            Map<RelationType, Long> byRelation = new EnumMap<>(RelationType.class);
            edges.keySet().forEach(k -> byRelation.merge(k.relation(), 1L, Long::sum));

            return GraphStatistics.builder()
                    .nodeCount(nodes.size())
                    .edgeCount(edges.size())
                    .nodesByLabel(byLabel)
                    .edgesByRelation(byRelation)
                    .build();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Set<GraphCapability> capabilities() {
        return EnumSet.of(GraphCapability.DIRECT_TRAVERSAL);
    }

    @Override
    public void close() {
        log.info("Closing in-memory graph store (no action needed)");
    }
}
