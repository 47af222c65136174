package com.purchasingpower.hsn.retrieval.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.hsn.core.RetrievedDocument;
import com.purchasingpower.hsn.retrieval.RetrievalStrategy;
import com.purchasingpower.hsn.retrieval.RetrievalStrategyType;
import com.purchasingpower.hsn.vector.VectorStore;

import java.util.List;

/**
 * Plain top-k similarity search; score is the vector store's cosine similarity.
 */
public class VectorOnlyStrategy implements RetrievalStrategy {

    private final int topK;

    public VectorOnlyStrategy(int topK) {
        Preconditions.checkArgument(topK > 0, "topK must be positive: %s", topK);
        this.topK = topK;
    }

    @Override
    public List<RetrievedDocument> retrieve(String query, VectorStore vectorStore) {
        return vectorStore.query(query, topK);
    }

    @Override
    public String name() {
        return RetrievalStrategyType.VECTOR_ONLY.getConfigName();
    }
}
