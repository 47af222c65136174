package com.purchasingpower.hsn.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class DataProperties {

    /**
     * JSON array of processed documents written by the ingestion pipeline.
     */
    @NotBlank
    private String processedFile = "data/processed/hsn_documents.json";

    @NotBlank
    private String outputDir = "output";
}
