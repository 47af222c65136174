package com.purchasingpower.hsn.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One processed taxonomy entry as produced by the ingestion pipeline.
 *
 * <p>The same document set feeds both the graph builder and the vector store,
 * which keeps the two code-id consistent.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class HsnDocument {

    public static final String ID_PREFIX = "hsn_";

    @JsonProperty("document_id")
    private String documentId;

    private String text;

    private HsnMetadata metadata;

    public static String documentIdFor(String hsnCode) {
        return ID_PREFIX + hsnCode;
    }
}
