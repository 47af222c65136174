package com.purchasingpower.hsn.knowledge;

import com.purchasingpower.hsn.core.GraphNode;
import com.purchasingpower.hsn.core.HsnDocument;

import java.util.List;

/**
 * Builds, enriches and checks the HSN taxonomy graph on top of a
 * {@link GraphStore}. Safe to run repeatedly over the same documents.
 *
 * @since 1.0.0
 */
public interface GraphBuilder {

    /**
     * Add Chapter, Heading, Subheading and Code nodes plus the hierarchy edges
     * for every document, in hierarchy order.
     *
     * @param documents Processed documents
     * @return Counts of newly created entities
     */
    BuildResult build(List<HsnDocument> documents);

    /**
     * Connect Code nodes that share a Subheading with {@code SIBLING_OF} edges
     * in both directions.
     *
     * @return Number of edges created
     */
    int enrichSiblings();

    /**
     * Add {@code SIMILAR_TO} edges between Code nodes whose description
     * embeddings have a cosine similarity strictly above {@code threshold}.
     * Quadratic in the number of codes.
     *
     * @param threshold Similarity threshold in (0, 1)
     * @return Number of edges created
     */
    int enrichSimilarity(double threshold);

    /**
     * Check that every Code node has exactly one hierarchy parent and that it
     * is a Subheading.
     */
    IntegrityReport validateIntegrity();

    /**
     * One-hop hierarchy neighbors of a code.
     *
     * @param hsnCode 8-digit code
     * @param direction UP for the parent, DOWN for children
     */
    List<GraphNode> traverseHierarchy(String hsnCode, HierarchyDirection direction);

    GraphSnapshot contextSubgraph(String hsnCode, int depth);

    GraphStatistics statistics();
}
