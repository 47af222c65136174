package com.purchasingpower.hsn.vector;

import dev.langchain4j.data.embedding.Embedding;

import java.util.List;

/**
 * Text embedding used by the vector store and by similarity enrichment of the
 * graph.
 *
 * @since 1.0.0
 */
public interface EmbeddingService {

    /**
     * Embed one text, typically a user query.
     */
    Embedding embed(String text);

    /**
     * Embed many texts in one batch.
     *
     * @return One embedding per input, in input order
     */
    List<Embedding> embedAll(List<String> texts);
}
