package com.purchasingpower.hsn.retrieval;

import com.purchasingpower.hsn.exception.UpstreamFailureException;
import com.purchasingpower.hsn.util.CallContext;
import com.purchasingpower.hsn.util.ExternalCallLogger;
import com.purchasingpower.hsn.util.ServiceType;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.scoring.ScoringModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Pairwise (query, passage) relevance scoring for re-ranking.
 */
@Slf4j
@RequiredArgsConstructor
public class RelevanceScorer {

    private final ScoringModel scoringModel;

    /**
     * Score every passage against the query.
     *
     * @return One score per passage, in input order
     */
    public List<Double> score(String query, List<String> passages) {
        if (passages.isEmpty()) {
            return List.of();
        }

        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.RERANKER, "ScoreAll", log);
        callCtx.logRequest(ExternalCallLogger.truncate(query, 80), "Candidates", passages.size());
        try {
            List<TextSegment> segments = passages.stream().map(TextSegment::from).toList();
            Response<List<Double>> response = scoringModel.scoreAll(segments, query);
            List<Double> scores = response.content();
            if (scores == null || scores.size() != passages.size()) {
                throw new IllegalStateException("Expected " + passages.size() + " scores but got "
                        + (scores == null ? 0 : scores.size()));
            }
            callCtx.logResponse("Scored", "Count", scores.size());
            return scores;
        } catch (RuntimeException e) {
            callCtx.logError("Re-ranking failed", e);
            throw new UpstreamFailureException(ServiceType.RERANKER, "scoring failed", e);
        }
    }
}
