package com.purchasingpower.hsn.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.hsn.configuration.GraphProperties;
import com.purchasingpower.hsn.configuration.HsnProperties;
import com.purchasingpower.hsn.exception.ConfigurationException;
import com.purchasingpower.hsn.knowledge.GraphStore;
import com.purchasingpower.hsn.knowledge.export.GraphVisualizer;
import com.purchasingpower.hsn.knowledge.impl.InMemoryGraphStore;
import com.purchasingpower.hsn.knowledge.impl.Neo4jGraphStoreImpl;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Locale;

/**
 * Selects the graph backend from {@code hsn.graph.backend}.
 */
@Slf4j
@Configuration
public class GraphStoreConfig {

    static final List<String> SUPPORTED_BACKENDS = List.of("in_memory", "neo4j");

    @Bean(destroyMethod = "close")
    public GraphStore graphStore(HsnProperties properties) {
        GraphProperties graph = properties.getGraph();
        String backend = graph.getBackend().toLowerCase(Locale.ROOT);
        log.info("🟢 Initializing graph store backend: {}", backend);

        return switch (backend) {
            case "in_memory", "networkx" -> new InMemoryGraphStore();
            case "neo4j" -> new Neo4jGraphStoreImpl(
                    graph.getNeo4j().getUri(),
                    graph.getNeo4j().getUsername(),
                    graph.getNeo4j().getPassword());
            default -> throw ConfigurationException.unknownOption("hsn.graph.backend", graph.getBackend(), SUPPORTED_BACKENDS);
        };
    }

    @Bean
    public GraphVisualizer graphVisualizer(ObjectMapper objectMapper) {
        return new GraphVisualizer(objectMapper);
    }
}
