package com.purchasingpower.hsn.knowledge;

/**
 * What one builder step added to the graph. Zero on a repeated run over the
 * same documents.
 *
 * @since 1.0.0
 */
public record BuildResult(int recordsProcessed, int nodesCreated, int edgesCreated) {
}
