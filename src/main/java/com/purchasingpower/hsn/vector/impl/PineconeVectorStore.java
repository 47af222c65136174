package com.purchasingpower.hsn.vector.impl;

import com.google.protobuf.Struct;
import com.google.protobuf.Value;
import com.purchasingpower.hsn.core.HsnDocument;
import com.purchasingpower.hsn.core.HsnMetadata;
import com.purchasingpower.hsn.core.RetrievedDocument;
import com.purchasingpower.hsn.exception.UpstreamFailureException;
import com.purchasingpower.hsn.util.CallContext;
import com.purchasingpower.hsn.util.ExternalCallLogger;
import com.purchasingpower.hsn.util.ServiceType;
import com.purchasingpower.hsn.vector.EmbeddingService;
import com.purchasingpower.hsn.vector.VectorStore;
import dev.langchain4j.data.embedding.Embedding;
import io.pinecone.clients.Pinecone;
import io.pinecone.unsigned_indices_model.QueryResponseWithUnsignedIndices;
import io.pinecone.unsigned_indices_model.ScoredVectorWithUnsignedIndices;
import io.pinecone.unsigned_indices_model.VectorWithUnsignedIndices;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Remote vector index on Pinecone. The index must already exist with the
 * embedding model's dimension and the cosine metric.
 *
 * <p>Document text is stored in the vector metadata under {@code text}, next to
 * the flat {@link HsnMetadata} fields.
 *
 * @since 1.0.0
 */
@Slf4j
public class PineconeVectorStore implements VectorStore {

    static final String TEXT_FIELD = "text";
    private static final int UPSERT_BATCH_SIZE = 100;

    private final Pinecone client;
    private final String indexName;
    private final String namespace;
    private final EmbeddingService embeddingService;

    public PineconeVectorStore(Pinecone client, String indexName, String namespace, EmbeddingService embeddingService) {
        this.client = client;
        this.indexName = indexName;
        this.namespace = namespace != null ? namespace : "";
        this.embeddingService = embeddingService;
        log.info("Initialized Pinecone vector store on index '{}'", indexName);
    }

    @Override
    public void initialize(List<HsnDocument> documents) {
        List<Embedding> embeddings = embeddingService.embedAll(
                documents.stream().map(HsnDocument::getText).toList());

        List<VectorWithUnsignedIndices> vectors = new ArrayList<>(documents.size());
        for (int i = 0; i < documents.size(); i++) {
            vectors.add(createVector(documents.get(i), embeddings.get(i)));
        }

        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.PINECONE, "Upsert", log);
        callCtx.logRequest("Upserting vectors", "Count", vectors.size(), "Index", indexName);
        try {
            for (int i = 0; i < vectors.size(); i += UPSERT_BATCH_SIZE) {
                int end = Math.min(i + UPSERT_BATCH_SIZE, vectors.size());
                client.getIndexConnection(indexName).upsert(vectors.subList(i, end), namespace);
                log.debug("Upserted batch {}-{}", i, end);
            }
            callCtx.logResponse("Upsert complete", "Vectors", vectors.size());
        } catch (Exception e) {
            callCtx.logError("Upsert failed", e);
            throw new UpstreamFailureException(ServiceType.PINECONE, "upsert failed", e);
        }
    }

    @Override
    public List<RetrievedDocument> query(String text, int topK) {
        List<Float> floats = embeddingService.embed(text).vectorAsList();

        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.PINECONE, "Query", log);
        callCtx.logRequest(ExternalCallLogger.truncate(text, 80), "TopK", topK);
        try {
            QueryResponseWithUnsignedIndices response = client.getIndexConnection(indexName)
                    .query(topK, floats, null, null, null, namespace, null, false, true);

            if (response.getMatchesList() == null || response.getMatchesList().isEmpty()) {
                callCtx.logResponse("No matches");
                return List.of();
            }

            List<RetrievedDocument> results = response.getMatchesList().stream()
                    .map(this::toRetrievedDocument)
                    .toList();
            callCtx.logResponse("Matches", "Count", results.size());
            return results;
        } catch (Exception e) {
            callCtx.logError("Query failed", e);
            throw new UpstreamFailureException(ServiceType.PINECONE, "query failed", e);
        }
    }

    @Override
    public Optional<RetrievedDocument> findById(String documentId) {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.PINECONE, "Fetch", log);
        callCtx.logRequest("Fetching vector", "Vector ID", documentId);
        try {
            var response = client.getIndexConnection(indexName).fetch(List.of(documentId), namespace);
            if (response == null || !response.getVectorsMap().containsKey(documentId)) {
                callCtx.logResponse("Vector not found");
                return Optional.empty();
            }
            var vector = response.getVectorsMap().get(documentId);
            callCtx.logResponse("Vector found");
            return Optional.of(toRetrievedDocument(documentId, 1.0, vector.getMetadata()));
        } catch (Exception e) {
            callCtx.logError("Fetch failed", e);
            throw new UpstreamFailureException(ServiceType.PINECONE, "fetch failed", e);
        }
    }

    private VectorWithUnsignedIndices createVector(HsnDocument document, Embedding embedding) {
        Struct.Builder metadataBuilder = Struct.newBuilder();
        metadataBuilder.putFields(TEXT_FIELD, Value.newBuilder().setStringValue(document.getText()).build());
        for (Map.Entry<String, String> entry : document.getMetadata().toMap().entrySet()) {
            metadataBuilder.putFields(entry.getKey(), Value.newBuilder().setStringValue(entry.getValue()).build());
        }

        return new VectorWithUnsignedIndices(
                document.getDocumentId(),
                embedding.vectorAsList(),
                metadataBuilder.build(),
                null
        );
    }

    private RetrievedDocument toRetrievedDocument(ScoredVectorWithUnsignedIndices match) {
        return toRetrievedDocument(match.getId(), match.getScore(), match.getMetadata());
    }

    private RetrievedDocument toRetrievedDocument(String id, double score, Struct metadata) {
        Map<String, String> fields = new HashMap<>();
        if (metadata != null) {
            metadata.getFieldsMap().forEach((key, value) -> fields.put(key, value.getStringValue()));
        }
        return RetrievedDocument.builder()
                .id(id)
                .text(fields.getOrDefault(TEXT_FIELD, ""))
                .metadata(HsnMetadata.fromMap(fields))
                .score(score)
                .build();
    }
}
