package com.purchasingpower.hsn.vector.impl;

import com.purchasingpower.hsn.exception.UpstreamFailureException;
import com.purchasingpower.hsn.util.CallContext;
import com.purchasingpower.hsn.util.ExternalCallLogger;
import com.purchasingpower.hsn.util.ServiceType;
import com.purchasingpower.hsn.vector.EmbeddingService;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link EmbeddingService} over a LangChain4j {@link EmbeddingModel}. Retries
 * and timeouts are configured on the model itself.
 *
 * @since 1.0.0
 */
@Slf4j
@RequiredArgsConstructor
public class LangChain4jEmbeddingService implements EmbeddingService {

    private static final int BATCH_SIZE = 100;

    private final EmbeddingModel embeddingModel;

    @Override
    public Embedding embed(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Text cannot be empty");
        }
        try {
            return embeddingModel.embed(text).content();
        } catch (RuntimeException e) {
            log.error("❌ Failed to embed text after retries: {}", e.getMessage());
            throw new UpstreamFailureException(ServiceType.EMBEDDING, "Embedding generation failed", e);
        }
    }

    @Override
    public List<Embedding> embedAll(List<String> texts) {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.EMBEDDING, "EmbedAll", log);
        callCtx.logRequest("Embedding batch", "Texts", texts.size());

        try {
            List<TextSegment> segments = texts.stream().map(TextSegment::from).toList();
            List<Embedding> embeddings = new ArrayList<>(segments.size());
            for (int i = 0; i < segments.size(); i += BATCH_SIZE) {
                List<TextSegment> batch = segments.subList(i, Math.min(i + BATCH_SIZE, segments.size()));
                embeddings.addAll(embeddingModel.embedAll(batch).content());
            }
            callCtx.logResponse("Embeddings created", "Count", embeddings.size());
            return embeddings;
        } catch (RuntimeException e) {
            callCtx.logError("Batch embedding failed", e);
            throw new UpstreamFailureException(ServiceType.EMBEDDING, "Batch embedding generation failed", e);
        }
    }
}
