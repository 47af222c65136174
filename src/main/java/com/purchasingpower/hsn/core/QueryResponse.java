package com.purchasingpower.hsn.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Structured answer to one user query.
 *
 * @since 1.0.0
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryResponse {

    public static final String CONFIDENCE_HIGH = "High";
    public static final String CONFIDENCE_MEDIUM = "Medium";
    public static final String CONFIDENCE_VERY_LOW = "Very Low";
    public static final String CONFIDENCE_USER_CONFIRMED = "Very High (User Confirmed)";
    public static final String TRADE_POLICY_FREE = "Free";

    ResponseType type;
    String summary;

    @Singular
    List<TopMatch> topMatches;

    @Singular
    List<DisambiguationOption> options;

    String confidence;
    String tradePolicy;

    /**
     * Set only on {@link ResponseType#NO_RESULT}.
     */
    NoResultReason noResultReason;

    public boolean isNoResult() {
        return type == ResponseType.NO_RESULT;
    }
}
