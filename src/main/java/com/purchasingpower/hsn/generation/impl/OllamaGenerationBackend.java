package com.purchasingpower.hsn.generation.impl;

import com.purchasingpower.hsn.exception.UpstreamFailureException;
import com.purchasingpower.hsn.generation.GenerationBackend;
import com.purchasingpower.hsn.util.CallContext;
import com.purchasingpower.hsn.util.ExternalCallLogger;
import com.purchasingpower.hsn.util.ServiceType;
import dev.langchain4j.model.chat.ChatLanguageModel;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;

/**
 * Generation through a local Ollama model.
 *
 * <p>Transient errors are retried by the langchain4j client ({@code maxRetries}).
 * Repeated failures open the circuit breaker; while it is open every call
 * returns {@link #HIGH_LOAD_MESSAGE} without touching the model.
 */
@Slf4j
public class OllamaGenerationBackend implements GenerationBackend {

    public static final String HIGH_LOAD_MESSAGE =
            "The system is currently experiencing high load. Please try again later.";

    private final ChatLanguageModel chatModel;
    private final CircuitBreaker circuitBreaker;

    public OllamaGenerationBackend(ChatLanguageModel chatModel, CircuitBreaker circuitBreaker) {
        this.chatModel = chatModel;
        this.circuitBreaker = circuitBreaker;
    }

    @Override
    public String generate(String prompt) {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.LLM, "Generate", log);
        callCtx.logRequest(ExternalCallLogger.truncate(prompt, 200), "Prompt length", prompt.length());
        try {
            String text = circuitBreaker.executeSupplier(() -> chatModel.generate(prompt));
            callCtx.logResponse(ExternalCallLogger.truncate(text, 200), "Response length", text.length());
            return text;
        } catch (CallNotPermittedException e) {
            log.error("Circuit breaker '{}' is open for LLM calls", circuitBreaker.getName());
            return HIGH_LOAD_MESSAGE;
        } catch (RuntimeException e) {
            callCtx.logError(e.getMessage(), e);
            throw new UpstreamFailureException(ServiceType.LLM, "generation failed", e);
        }
    }

    @Override
    public String name() {
        return "ollama";
    }
}
