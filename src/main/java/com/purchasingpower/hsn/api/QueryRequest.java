package com.purchasingpower.hsn.api;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request for the query endpoint.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {

    /**
     * Product description, 8-digit HSN code, or option number.
     */
    @NotBlank(message = "query is required")
    private String query;
}
