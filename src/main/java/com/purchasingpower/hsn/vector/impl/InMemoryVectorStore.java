package com.purchasingpower.hsn.vector.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.hsn.core.HsnDocument;
import com.purchasingpower.hsn.core.RetrievedDocument;
import com.purchasingpower.hsn.vector.EmbeddingService;
import com.purchasingpower.hsn.vector.VectorStore;
import com.purchasingpower.hsn.util.CallContext;
import com.purchasingpower.hsn.util.ExternalCallLogger;
import com.purchasingpower.hsn.util.ServiceType;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.CosineSimilarity;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Embedded vector index backed by langchain4j's {@link InMemoryEmbeddingStore}.
 *
 * <p>langchain4j reports a relevance score in [0, 1]; it is converted back to
 * cosine similarity so scores are comparable with the remote backend.
 *
 * @since 1.0.0
 */
@Slf4j
public class InMemoryVectorStore implements VectorStore {

    private final EmbeddingService embeddingService;
    private final Map<String, HsnDocument> documentsById = new ConcurrentHashMap<>();
    private volatile InMemoryEmbeddingStore<TextSegment> store = new InMemoryEmbeddingStore<>();

    public InMemoryVectorStore(EmbeddingService embeddingService) {
        this.embeddingService = embeddingService;
    }

    @Override
    public void initialize(List<HsnDocument> documents) {
        Preconditions.checkArgument(documents != null, "documents must not be null");
        log.info("Initializing in-memory vector store with {} documents", documents.size());

        List<Embedding> embeddings = embeddingService.embedAll(
                documents.stream().map(HsnDocument::getText).toList());

        InMemoryEmbeddingStore<TextSegment> fresh = new InMemoryEmbeddingStore<>();
        Map<String, HsnDocument> byId = new ConcurrentHashMap<>();
        for (int i = 0; i < documents.size(); i++) {
            HsnDocument document = documents.get(i);
            fresh.add(document.getDocumentId(), embeddings.get(i));
            byId.put(document.getDocumentId(), document);
        }

        store = fresh;
        documentsById.clear();
        documentsById.putAll(byId);
        log.info("✅ In-memory vector store ready: {} vectors", byId.size());
    }

    @Override
    public List<RetrievedDocument> query(String text, int topK) {
        Preconditions.checkArgument(topK > 0, "topK must be positive: %s", topK);

        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.VECTOR_STORE, "Query", log);
        callCtx.logRequest(ExternalCallLogger.truncate(text, 80), "TopK", topK);

        Embedding queryEmbedding = embeddingService.embed(text);
        EmbeddingSearchRequest request = EmbeddingSearchRequest.builder()
                .queryEmbedding(queryEmbedding)
                .maxResults(topK)
                .minScore(0.0)
                .build();

        List<RetrievedDocument> results = store.search(request).matches().stream()
                .map(this::toRetrievedDocument)
                .flatMap(Optional::stream)
                .toList();

        callCtx.logResponse("Matches", "Count", results.size());
        return results;
    }

    @Override
    public Optional<RetrievedDocument> findById(String documentId) {
        return Optional.ofNullable(documentsById.get(documentId))
                .map(document -> toRetrievedDocument(document, 1.0));
    }

    private Optional<RetrievedDocument> toRetrievedDocument(EmbeddingMatch<TextSegment> match) {
        HsnDocument document = documentsById.get(match.embeddingId());
        if (document == null) {
            log.warn("Vector {} has no document, skipping", match.embeddingId());
            return Optional.empty();
        }
        return Optional.of(toRetrievedDocument(document, CosineSimilarity.fromRelevanceScore(match.score())));
    }

    private RetrievedDocument toRetrievedDocument(HsnDocument document, double score) {
        return RetrievedDocument.builder()
                .id(document.getDocumentId())
                .text(document.getText())
                .metadata(document.getMetadata())
                .score(score)
                .build();
    }
}
