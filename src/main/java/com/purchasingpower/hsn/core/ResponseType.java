package com.purchasingpower.hsn.core;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of answer produced for one conversation turn.
 */
public enum ResponseType {
    CLASSIFICATION_RESULT("classification_result"),
    DISAMBIGUATION("disambiguation"),
    CLARIFICATION_PROMPT("clarification_prompt"),
    NO_RESULT("no_result"),
    INVALID_SELECTION("invalid_selection");

    private final String wireName;

    ResponseType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
