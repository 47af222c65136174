package com.purchasingpower.hsn.core;

import lombok.Builder;
import lombok.Value;

/**
 * One ranked candidate as shown to the user.
 */
@Value
@Builder
public class TopMatch {

    String hsnCode;
    String description;
    String fullContext;
    Double retrievalScore;
    String graphContext;
    HsnMetadata metadata;

    public static TopMatch from(RetrievedDocument document) {
        HsnMetadata metadata = document.getMetadata();
        return TopMatch.builder()
                .hsnCode(document.getHsnCode())
                .description(metadata != null ? metadata.getItemDescription() : null)
                .fullContext(document.getText())
                .retrievalScore(document.getScore())
                .graphContext(document.getGraphContext())
                .metadata(metadata)
                .build();
    }

    /**
     * A match confirmed by the user or looked up directly; carries no score.
     */
    public static TopMatch confirmed(String hsnCode, HsnMetadata metadata) {
        return TopMatch.builder()
                .hsnCode(hsnCode)
                .description(metadata != null ? metadata.getItemDescription() : null)
                .metadata(metadata)
                .build();
    }
}
