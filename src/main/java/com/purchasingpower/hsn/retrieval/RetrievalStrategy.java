package com.purchasingpower.hsn.retrieval;

import com.purchasingpower.hsn.core.RetrievedDocument;
import com.purchasingpower.hsn.vector.VectorStore;

import java.util.List;

/**
 * Pluggable retrieval algorithm. Implementations compose by decoration.
 *
 * @since 1.0.0
 */
public interface RetrievalStrategy {

    /**
     * @param query Free-text user query
     * @param vectorStore Index to search
     * @return At most top-k documents, ordered by descending score
     */
    List<RetrievedDocument> retrieve(String query, VectorStore vectorStore);

    /**
     * Configuration name of this strategy.
     */
    String name();
}
