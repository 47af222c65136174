package com.purchasingpower.hsn.configuration;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class DialogueProperties {

    /**
     * Top-1/top-2 score gap below which the user is asked to choose.
     */
    @DecimalMin("0.0")
    private double disambiguationThreshold = 0.15;

    /**
     * Best score below which no result is returned.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double relevanceThreshold = 0.40;

    @Min(2)
    private int maxOptions = 3;
}
