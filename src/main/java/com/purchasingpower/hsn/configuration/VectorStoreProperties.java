package com.purchasingpower.hsn.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class VectorStoreProperties {

    /**
     * {@code in_memory} or {@code pinecone}.
     */
    @NotBlank
    private String backend = "in_memory";

    /**
     * Embed the processed documents into the store on startup.
     */
    private boolean initializeOnStartup = true;

    @Valid
    @NotNull
    private Embedding embedding = new Embedding();

    @Valid
    @NotNull
    private Pinecone pinecone = new Pinecone();

    @Data
    public static class Embedding {
        @NotBlank
        private String baseUrl = "http://localhost:11434";

        @NotBlank
        private String model = "nomic-embed-text";

        @Min(1)
        private int timeoutSeconds = 120;

        @Min(0)
        private int maxRetries = 3;
    }

    @Data
    public static class Pinecone {
        private String apiKey;
        private String indexName = "hsn-codes";
        private String namespace = "";
    }
}
