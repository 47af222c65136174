package com.purchasingpower.hsn.config;

import com.purchasingpower.hsn.configuration.HsnProperties;
import com.purchasingpower.hsn.configuration.RetrievalProperties;
import com.purchasingpower.hsn.knowledge.GraphStore;
import com.purchasingpower.hsn.retrieval.EmbeddingScoringModel;
import com.purchasingpower.hsn.retrieval.RelevanceScorer;
import com.purchasingpower.hsn.retrieval.RetrievalStrategy;
import com.purchasingpower.hsn.retrieval.RetrievalStrategyType;
import com.purchasingpower.hsn.retrieval.impl.GraphContextualStrategy;
import com.purchasingpower.hsn.retrieval.impl.ReRankStrategy;
import com.purchasingpower.hsn.retrieval.impl.VectorOnlyStrategy;
import com.purchasingpower.hsn.vector.EmbeddingService;
import dev.langchain4j.model.scoring.ScoringModel;
import dev.langchain4j.model.scoring.onnx.OnnxScoringModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Re-ranking model and retrieval strategy ({@code hsn.retrieval.strategy}).
 */
@Slf4j
@Configuration
public class RetrievalConfig {

    @Bean
    @ConditionalOnMissingBean
    public ScoringModel scoringModel(HsnProperties properties, EmbeddingService embeddingService) {
        RetrievalProperties retrieval = properties.getRetrieval();
        if (isBlank(retrieval.getRerankerModelPath()) || isBlank(retrieval.getRerankerTokenizerPath())) {
            log.warn("⚠️  No cross-encoder model configured, re-ranking with embedding cosine similarity");
            return new EmbeddingScoringModel(embeddingService);
        }
        log.info("🟡 Loading ONNX cross-encoder from {}", retrieval.getRerankerModelPath());
        return new OnnxScoringModel(retrieval.getRerankerModelPath(), retrieval.getRerankerTokenizerPath());
    }

    @Bean
    public RelevanceScorer relevanceScorer(ScoringModel scoringModel) {
        return new RelevanceScorer(scoringModel);
    }

    @Bean
    public RetrievalStrategy retrievalStrategy(HsnProperties properties, RelevanceScorer scorer, GraphStore graphStore) {
        RetrievalProperties retrieval = properties.getRetrieval();
        RetrievalStrategyType type = RetrievalStrategyType.fromConfigName(retrieval.getStrategy());
        log.info("Using '{}' retrieval strategy (top-k {})", type.getConfigName(), retrieval.getTopK());

        return switch (type) {
            case VECTOR_ONLY -> new VectorOnlyStrategy(retrieval.getTopK());
            case RERANK -> new ReRankStrategy(scorer, retrieval.getTopK(), retrieval.getCandidateMultiplier());
            case GRAPH_CONTEXTUAL -> new GraphContextualStrategy(
                    new ReRankStrategy(scorer, retrieval.getTopK(), retrieval.getCandidateMultiplier()),
                    graphStore,
                    retrieval.getContextCacheSize());
        };
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
