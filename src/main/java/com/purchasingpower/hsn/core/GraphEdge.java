package com.purchasingpower.hsn.core;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.Map;

/**
 * Directed, typed edge between two graph nodes.
 *
 * <p>Identity is the triple (source, target, relation); properties are not part
 * of it.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class GraphEdge {

    public static final String SCORE = "score";

    String sourceId;
    String targetId;
    RelationType relation;

    @Builder.Default
    Map<String, Object> properties = Collections.emptyMap();

    public static GraphEdge of(String sourceId, String targetId, RelationType relation) {
        return GraphEdge.builder()
                .sourceId(sourceId)
                .targetId(targetId)
                .relation(relation)
                .build();
    }

    public Key key() {
        return new Key(sourceId, targetId, relation);
    }

    /**
     * Identity of an edge inside one graph instance.
     */
    public record Key(String sourceId, String targetId, RelationType relation) {
    }
}
