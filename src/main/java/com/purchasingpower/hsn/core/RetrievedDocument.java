package com.purchasingpower.hsn.core;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * A document returned by a vector store or a retrieval strategy.
 *
 * <p>Higher {@code score} is better. Strategies never mutate a document in place;
 * they derive copies with {@code withScore} / {@code withGraphContext}.
 *
 * @since 1.0.0
 */
@Value
@With
@Builder
public class RetrievedDocument {

    String id;
    String text;
    HsnMetadata metadata;
    double score;

    /**
     * Root-to-leaf description path, attached by graph-contextual retrieval.
     */
    String graphContext;

    public String getHsnCode() {
        return metadata != null ? metadata.getHsnCode() : null;
    }
}
