package com.purchasingpower.hsn.query;

/**
 * Query text with its classified intent. {@code hsnCode} is set only for
 * {@link QueryIntent#DIRECT_LOOKUP}.
 */
public record ParsedQuery(String text, QueryIntent intent, String hsnCode) {

    public static ParsedQuery of(String text, QueryIntent intent) {
        return new ParsedQuery(text, intent, null);
    }
}
