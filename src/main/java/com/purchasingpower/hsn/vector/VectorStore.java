package com.purchasingpower.hsn.vector;

import com.purchasingpower.hsn.core.HsnDocument;
import com.purchasingpower.hsn.core.RetrievedDocument;

import java.util.List;
import java.util.Optional;

/**
 * Similarity index over the processed HSN documents.
 *
 * <p>Backends are interchangeable: an embedded in-memory index and a remote
 * Pinecone index both satisfy this contract. Must be built from the same
 * document set as the graph.
 *
 * @since 1.0.0
 */
public interface VectorStore {

    /**
     * Embed and index a document set. Re-initializing with the same documents
     * leaves the index equivalent.
     */
    void initialize(List<HsnDocument> documents);

    /**
     * Top-k similarity search.
     *
     * @param text Free-text query
     * @param topK Maximum number of results
     * @return Documents ordered by descending score (cosine similarity)
     */
    List<RetrievedDocument> query(String text, int topK);

    /**
     * Exact lookup by document id ({@code hsn_<code>}).
     */
    Optional<RetrievedDocument> findById(String documentId);

    default Optional<RetrievedDocument> findByHsnCode(String hsnCode) {
        return findById(HsnDocument.documentIdFor(hsnCode));
    }
}
