package com.purchasingpower.hsn.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class GraphProperties {

    /**
     * {@code in_memory} or {@code neo4j}.
     */
    @NotBlank
    private String backend = "in_memory";

    private boolean buildOnStartup = true;

    /**
     * Similarity enrichment embeds every code description; disable for large
     * taxonomies or when no embedding model is reachable.
     */
    private boolean similarityEnabled = false;

    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax(value = "1.0", inclusive = false)
    private double similarityThreshold = 0.85;

    private boolean exportEnabled = true;

    @NotBlank
    private String exportFile = "hsn_knowledge_graph.graphml";

    @NotBlank
    private String visualizationFile = "hsn_knowledge_graph.html";

    @Valid
    @NotNull
    private Neo4j neo4j = new Neo4j();

    @Data
    public static class Neo4j {
        private String uri = "bolt://localhost:7687";
        private String username = "neo4j";
        private String password = "";
    }
}
