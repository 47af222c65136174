package com.purchasingpower.hsn.generation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import com.purchasingpower.hsn.exception.ConfigurationException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads prompts from YAML files and renders them with Mustache.
 *
 * Usage:
 * String prompt = promptLibrary.render("classification", Map.of(
 *     "query", "natural rubber latex",
 *     "documents", documentViews
 * ));
 */
@Slf4j
@Service
public class PromptLibraryService {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final MustacheFactory mustacheFactory = new DefaultMustacheFactory();
    private final Map<String, PromptTemplate> templates = new ConcurrentHashMap<>();
    private final Map<String, Mustache> compiled = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadPrompts() {
        try {
            Resource[] resources = new PathMatchingResourcePatternResolver().getResources("classpath:prompts/*.yaml");
            for (Resource resource : resources) {
                try (InputStream in = resource.getInputStream()) {
                    register(yamlMapper.readValue(in, PromptTemplate.class));
                }
            }
            log.info("Loaded {} prompt templates", templates.size());
        } catch (IOException e) {
            log.error("Failed to load prompt templates", e);
            throw new ConfigurationException("Prompt library initialization failed", e);
        }
    }

    void register(PromptTemplate template) {
        templates.put(template.getName(), template);
        compiled.remove(template.getName());
        log.info("Loaded prompt template: {} (version: {})", template.getName(), template.getVersion());
    }

    /**
     * Render a prompt with variables.
     */
    public String render(String templateName, Map<String, Object> variables) {
        PromptTemplate template = templates.get(templateName);
        if (template == null) {
            throw new IllegalArgumentException("Prompt template not found: " + templateName);
        }

        Mustache mustache = compiled.computeIfAbsent(templateName, name -> mustacheFactory.compile(
                new StringReader(template.getSystemPrompt() + "\n\n" + template.getUserPrompt()), name));

        StringWriter writer = new StringWriter();
        mustache.execute(writer, variables);
        return writer.toString();
    }
}
