package com.purchasingpower.hsn.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "hsn")
public class HsnProperties {

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private DataProperties data = new DataProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private GraphProperties graph = new GraphProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private VectorStoreProperties vectorStore = new VectorStoreProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private RetrievalProperties retrieval = new RetrievalProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private GeneratorProperties generator = new GeneratorProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private DialogueProperties dialogue = new DialogueProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private SessionProperties session = new SessionProperties();
}
