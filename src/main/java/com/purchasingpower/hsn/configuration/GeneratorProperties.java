package com.purchasingpower.hsn.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;

@Data
public class GeneratorProperties {

    /**
     * {@code mock} or {@code ollama}.
     */
    @NotBlank
    private String backend = "mock";

    @NotBlank
    private String baseUrl = "http://localhost:11434";

    @NotBlank
    private String model = "llama3.1:8b";

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private double temperature = 0.2;

    @Min(1)
    private int timeoutSeconds = 120;

    @Min(0)
    private int maxRetries = 2;

    @Valid
    @NotNull
    private CircuitBreaker circuitBreaker = new CircuitBreaker();

    @Data
    public static class CircuitBreaker {
        /**
         * Consecutive failures that open the circuit.
         */
        @Min(1)
        private int failMax = 5;

        @NotNull
        private Duration resetTimeout = Duration.ofSeconds(60);
    }
}
