package com.purchasingpower.hsn.config;

import com.purchasingpower.hsn.configuration.HsnProperties;
import com.purchasingpower.hsn.configuration.VectorStoreProperties;
import com.purchasingpower.hsn.exception.ConfigurationException;
import com.purchasingpower.hsn.vector.EmbeddingService;
import com.purchasingpower.hsn.vector.VectorStore;
import com.purchasingpower.hsn.vector.impl.InMemoryVectorStore;
import com.purchasingpower.hsn.vector.impl.LangChain4jEmbeddingService;
import com.purchasingpower.hsn.vector.impl.PineconeVectorStore;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import io.pinecone.clients.Pinecone;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Embedding model and vector store backend ({@code hsn.vector-store.backend}).
 */
@Slf4j
@Configuration
public class VectorStoreConfig {

    static final List<String> SUPPORTED_BACKENDS = List.of("in_memory", "pinecone");

    @Bean
    @ConditionalOnMissingBean
    public EmbeddingModel embeddingModel(HsnProperties properties) {
        VectorStoreProperties.Embedding embedding = properties.getVectorStore().getEmbedding();
        log.info("🟣 Initializing Ollama embedding model");
        log.info("   - URL: {}", embedding.getBaseUrl());
        log.info("   - Model: {}", embedding.getModel());

        return OllamaEmbeddingModel.builder()
                .baseUrl(embedding.getBaseUrl())
                .modelName(embedding.getModel())
                .timeout(Duration.ofSeconds(embedding.getTimeoutSeconds()))
                .maxRetries(embedding.getMaxRetries())
                .logRequests(false)
                .logResponses(false)
                .build();
    }

    @Bean
    public EmbeddingService embeddingService(EmbeddingModel embeddingModel) {
        return new LangChain4jEmbeddingService(embeddingModel);
    }

    @Bean
    public VectorStore vectorStore(HsnProperties properties, EmbeddingService embeddingService) {
        VectorStoreProperties vectorStore = properties.getVectorStore();
        String backend = vectorStore.getBackend().toLowerCase(Locale.ROOT);
        log.info("🔵 Initializing vector store backend: {}", backend);

        return switch (backend) {
            case "in_memory", "chroma" -> new InMemoryVectorStore(embeddingService);
            case "pinecone" -> {
                VectorStoreProperties.Pinecone pinecone = vectorStore.getPinecone();
                if (pinecone.getApiKey() == null || pinecone.getApiKey().isBlank()) {
                    throw new ConfigurationException("hsn.vector-store.pinecone.api-key is required for the pinecone backend");
                }
                yield new PineconeVectorStore(
                        new Pinecone.Builder(pinecone.getApiKey()).build(),
                        pinecone.getIndexName(),
                        pinecone.getNamespace(),
                        embeddingService);
            }
            default -> throw ConfigurationException.unknownOption(
                    "hsn.vector-store.backend", vectorStore.getBackend(), SUPPORTED_BACKENDS);
        };
    }
}
