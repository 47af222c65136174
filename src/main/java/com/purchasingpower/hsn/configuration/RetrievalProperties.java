package com.purchasingpower.hsn.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class RetrievalProperties {

    /**
     * {@code vector_only}, {@code rerank} or {@code graph_contextual}.
     */
    @NotBlank
    private String strategy = "graph_contextual";

    @Min(1)
    private int topK = 5;

    @Min(1)
    private int candidateMultiplier = 4;

    @Min(128)
    private int contextCacheSize = 256;

    /**
     * ONNX export of cross-encoder/ms-marco-MiniLM-L-6-v2. When either path is
     * blank, re-ranking falls back to embedding cosine similarity.
     */
    private String rerankerModelPath;

    private String rerankerTokenizerPath;
}
