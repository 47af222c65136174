package com.purchasingpower.hsn.query;

import com.purchasingpower.hsn.core.QueryResponse;
import com.purchasingpower.hsn.core.ResponseType;
import com.purchasingpower.hsn.core.RetrievedDocument;
import com.purchasingpower.hsn.core.TopMatch;
import com.purchasingpower.hsn.exception.HsnClassifierException;
import com.purchasingpower.hsn.generation.GenerationBackend;
import com.purchasingpower.hsn.generation.PromptLibraryService;
import com.purchasingpower.hsn.retrieval.RetrievalStrategy;
import com.purchasingpower.hsn.vector.VectorStore;
import com.google.common.base.Stopwatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Retrieval and generation steps of a classification turn.
 *
 * <p>Each blocking call runs on the retrieval executor and is awaited before the
 * next one starts. Failures are rethrown unchanged.
 */
@Slf4j
@Service
public class ClassificationService {

    static final String PROMPT_NAME = "classification";
    static final double HIGH_CONFIDENCE_SCORE = 0.85;

    private final VectorStore vectorStore;
    private final RetrievalStrategy retrievalStrategy;
    private final GenerationBackend generationBackend;
    private final PromptLibraryService promptLibrary;
    private final Executor executor;

    public ClassificationService(VectorStore vectorStore,
                                 RetrievalStrategy retrievalStrategy,
                                 GenerationBackend generationBackend,
                                 PromptLibraryService promptLibrary,
                                 @Qualifier("retrievalExecutor") Executor executor) {
        this.vectorStore = vectorStore;
        this.retrievalStrategy = retrievalStrategy;
        this.generationBackend = generationBackend;
        this.promptLibrary = promptLibrary;
        this.executor = executor;
    }

    public List<RetrievedDocument> retrieve(String query) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        List<RetrievedDocument> documents = await(() -> retrievalStrategy.retrieve(query, vectorStore));
        log.info("Retrieved {} documents with '{}' strategy ({} ms)",
                documents.size(), retrievalStrategy.name(), stopwatch.elapsed().toMillis());
        return documents;
    }

    public Optional<RetrievedDocument> lookup(String hsnCode) {
        return await(() -> vectorStore.findByHsnCode(hsnCode));
    }

    /**
     * Generate the summary for the retrieved documents and assemble the
     * structured classification result.
     */
    public QueryResponse generate(String query, List<RetrievedDocument> documents) {
        String prompt = promptLibrary.render(PROMPT_NAME, Map.of("query", query, "documents", documents));

        Stopwatch stopwatch = Stopwatch.createStarted();
        String generated = await(() -> generationBackend.generate(prompt));
        log.info("Generated summary with '{}' backend ({} ms)", generationBackend.name(), stopwatch.elapsed().toMillis());

        double topScore = documents.isEmpty() ? 0.0 : documents.get(0).getScore();
        return QueryResponse.builder()
                .type(ResponseType.CLASSIFICATION_RESULT)
                .summary(generated)
                .topMatches(documents.stream().map(TopMatch::from).toList())
                .confidence(topScore > HIGH_CONFIDENCE_SCORE ? QueryResponse.CONFIDENCE_HIGH : QueryResponse.CONFIDENCE_MEDIUM)
                .tradePolicy(QueryResponse.TRADE_POLICY_FREE)
                .build();
    }

    private <T> T await(Supplier<T> call) {
        try {
            return CompletableFuture.supplyAsync(call, executor).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new HsnClassifierException("Retrieval call failed", e.getCause());
        }
    }
}
