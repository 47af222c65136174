package com.purchasingpower.hsn.core;

import lombok.Builder;
import lombok.Value;

/**
 * Node of the taxonomy graph. Immutable once stored.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class GraphNode {

    public static final String NOT_SPECIFIED = "not specified";

    String id;
    NodeLabel label;
    String description;

    public static GraphNode of(String id, NodeLabel label, String description) {
        return GraphNode.builder()
                .id(id)
                .label(label)
                .description(description == null || description.isBlank() ? NOT_SPECIFIED : description)
                .build();
    }
}
