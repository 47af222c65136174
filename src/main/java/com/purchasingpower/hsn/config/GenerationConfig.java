package com.purchasingpower.hsn.config;

import com.purchasingpower.hsn.configuration.GeneratorProperties;
import com.purchasingpower.hsn.configuration.HsnProperties;
import com.purchasingpower.hsn.exception.ConfigurationException;
import com.purchasingpower.hsn.generation.GenerationBackend;
import com.purchasingpower.hsn.generation.impl.MockGenerationBackend;
import com.purchasingpower.hsn.generation.impl.OllamaGenerationBackend;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Generation backend ({@code hsn.generator.backend}) and its circuit breaker.
 */
@Slf4j
@Configuration
public class GenerationConfig {

    static final List<String> SUPPORTED_BACKENDS = List.of("mock", "ollama");

    /**
     * Opens after {@code fail-max} consecutive failures and stays open for
     * {@code reset-timeout}.
     */
    @Bean
    public CircuitBreaker llmCircuitBreaker(HsnProperties properties) {
        GeneratorProperties.CircuitBreaker settings = properties.getGenerator().getCircuitBreaker();
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(settings.getFailMax())
                .minimumNumberOfCalls(settings.getFailMax())
                .failureRateThreshold(100.0f)
                .waitDurationInOpenState(settings.getResetTimeout())
                .permittedNumberOfCallsInHalfOpenState(1)
                .build();
        CircuitBreaker circuitBreaker = CircuitBreaker.of("llm", config);
        circuitBreaker.getEventPublisher().onStateTransition(event ->
                log.warn("LLM circuit breaker: {}", event.getStateTransition()));
        return circuitBreaker;
    }

    @Bean
    public GenerationBackend generationBackend(HsnProperties properties, CircuitBreaker llmCircuitBreaker) {
        GeneratorProperties generator = properties.getGenerator();
        String backend = generator.getBackend().toLowerCase(Locale.ROOT);

        return switch (backend) {
            case "mock" -> {
                log.info("🔴 Using mock generation backend");
                yield new MockGenerationBackend();
            }
            case "ollama" -> {
                log.info("🔴 Initializing Ollama generation backend");
                log.info("   - URL: {}", generator.getBaseUrl());
                log.info("   - Model: {}", generator.getModel());
                ChatLanguageModel model = OllamaChatModel.builder()
                        .baseUrl(generator.getBaseUrl())
                        .modelName(generator.getModel())
                        .temperature(generator.getTemperature())
                        .timeout(Duration.ofSeconds(generator.getTimeoutSeconds()))
                        .maxRetries(generator.getMaxRetries())
                        .logRequests(false)
                        .logResponses(false)
                        .build();
                yield new OllamaGenerationBackend(model, llmCircuitBreaker);
            }
            default -> throw ConfigurationException.unknownOption(
                    "hsn.generator.backend", generator.getBackend(), SUPPORTED_BACKENDS);
        };
    }
}
