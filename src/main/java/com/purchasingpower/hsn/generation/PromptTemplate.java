package com.purchasingpower.hsn.generation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Prompt template loaded from {@code classpath:prompts/*.yaml}.
 *
 * <pre>
 * name: classification
 * version: 1.0
 * systemPrompt: |
 *   You are an expert...
 * userPrompt: |
 *   User query: "{{{query}}}"
 * </pre>
 *
 * @see PromptLibraryService
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PromptTemplate {
    private String name;
    private String version;
    private String systemPrompt;
    private String userPrompt;
}
