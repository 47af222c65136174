package com.purchasingpower.hsn.knowledge;

import com.purchasingpower.hsn.core.NodeLabel;
import com.purchasingpower.hsn.core.RelationType;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Node and edge counts of a graph.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class GraphStatistics {

    long nodeCount;
    long edgeCount;

    @Builder.Default
    Map<NodeLabel, Long> nodesByLabel = Map.of();

    @Builder.Default
    Map<RelationType, Long> edgesByRelation = Map.of();
}
