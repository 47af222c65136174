package com.purchasingpower.hsn.retrieval;

import com.purchasingpower.hsn.exception.ConfigurationException;

import java.util.Arrays;

/**
 * Strategy names accepted by {@code hsn.retrieval.strategy}.
 */
public enum RetrievalStrategyType {
    VECTOR_ONLY("vector_only"),
    RERANK("rerank"),
    GRAPH_CONTEXTUAL("graph_contextual");

    private final String configName;

    RetrievalStrategyType(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    public static RetrievalStrategyType fromConfigName(String name) {
        return Arrays.stream(values())
                .filter(type -> type.configName.equalsIgnoreCase(name) || type.name().equalsIgnoreCase(name))
                .findFirst()
                .orElseThrow(() -> ConfigurationException.unknownOption(
                        "hsn.retrieval.strategy", name,
                        Arrays.stream(values()).map(RetrievalStrategyType::getConfigName).toList()));
    }
}
