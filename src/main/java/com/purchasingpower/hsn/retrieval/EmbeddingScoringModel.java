package com.purchasingpower.hsn.retrieval;

import com.purchasingpower.hsn.vector.EmbeddingService;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.scoring.ScoringModel;
import dev.langchain4j.store.embedding.CosineSimilarity;

import java.util.ArrayList;
import java.util.List;

/**
 * Bi-encoder stand-in for a cross-encoder: scores a passage by the cosine
 * similarity of its embedding to the query embedding. Used when no
 * cross-encoder model files are configured.
 */
public class EmbeddingScoringModel implements ScoringModel {

    private final EmbeddingService embeddingService;

    public EmbeddingScoringModel(EmbeddingService embeddingService) {
        this.embeddingService = embeddingService;
    }

    @Override
    public Response<List<Double>> scoreAll(List<TextSegment> segments, String query) {
        Embedding queryEmbedding = embeddingService.embed(query);
        List<Embedding> passageEmbeddings = embeddingService.embedAll(
                segments.stream().map(TextSegment::text).toList());

        List<Double> scores = new ArrayList<>(passageEmbeddings.size());
        for (Embedding passage : passageEmbeddings) {
            scores.add(CosineSimilarity.between(queryEmbedding, passage));
        }
        return Response.from(scores);
    }
}
