package com.purchasingpower.hsn.knowledge;

import com.purchasingpower.hsn.core.GraphEdge;
import com.purchasingpower.hsn.core.GraphNode;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Detached copy of a set of nodes and the edges between them.
 *
 * <p>Returned for subgraph queries and used as the input of exports, so both
 * backends share one export path.
 *
 * @since 1.0.0
 */
public record GraphSnapshot(List<GraphNode> nodes, List<GraphEdge> edges) {

    public GraphSnapshot {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public Set<String> nodeIds() {
        return nodes.stream().map(GraphNode::getId).collect(Collectors.toSet());
    }

    public boolean containsNode(String nodeId) {
        return nodes.stream().anyMatch(n -> n.getId().equals(nodeId));
    }
}
