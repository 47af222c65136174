package com.purchasingpower.hsn.retrieval.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.hsn.core.RetrievedDocument;
import com.purchasingpower.hsn.retrieval.RelevanceScorer;
import com.purchasingpower.hsn.retrieval.RetrievalStrategy;
import com.purchasingpower.hsn.retrieval.RetrievalStrategyType;
import com.purchasingpower.hsn.vector.VectorStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Two-stage retrieval: over-fetch {@code topK * candidateMultiplier} candidates
 * from the vector store, then re-score each (query, text) pair with a
 * pairwise relevance model and keep the best {@code topK}.
 *
 * <p>Returned documents carry the re-rank score in place of the vector score.
 */
@Slf4j
public class ReRankStrategy implements RetrievalStrategy {

    private final RelevanceScorer scorer;
    private final int topK;
    private final int candidateMultiplier;

    public ReRankStrategy(RelevanceScorer scorer, int topK, int candidateMultiplier) {
        Preconditions.checkArgument(topK > 0, "topK must be positive: %s", topK);
        Preconditions.checkArgument(candidateMultiplier >= 1, "candidateMultiplier must be >= 1: %s", candidateMultiplier);
        this.scorer = scorer;
        this.topK = topK;
        this.candidateMultiplier = candidateMultiplier;
    }

    @Override
    public List<RetrievedDocument> retrieve(String query, VectorStore vectorStore) {
        List<RetrievedDocument> candidates = vectorStore.query(query, topK * candidateMultiplier);
        if (candidates.isEmpty()) {
            return List.of();
        }

        List<Double> scores = scorer.score(query, candidates.stream().map(RetrievedDocument::getText).toList());

        List<RetrievedDocument> reranked = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            reranked.add(candidates.get(i).withScore(scores.get(i)));
        }
        // Stable sort: equal scores keep vector-store order
        reranked.sort(Comparator.comparingDouble(RetrievedDocument::getScore).reversed());

        log.debug("Re-ranked {} candidates for query, keeping top {}", candidates.size(), topK);
        return List.copyOf(reranked.subList(0, Math.min(topK, reranked.size())));
    }

    @Override
    public String name() {
        return RetrievalStrategyType.RERANK.getConfigName();
    }
}
