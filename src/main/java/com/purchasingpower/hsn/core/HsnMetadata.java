package com.purchasingpower.hsn.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flat taxonomy record attached to every document: the code, its three
 * ancestor ids and their descriptions.
 *
 * <p>Vector stores keep this as a flat string map (see {@link #toMap()} and
 * {@link #fromMap(Map)}).
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class HsnMetadata {

    public static final String HSN_CODE = "hsn_code";
    public static final String CHAPTER = "chapter";
    public static final String HEADING = "heading";
    public static final String SUBHEADING = "subheading";
    public static final String ITEM_DESCRIPTION = "item_description";
    public static final String CHAPTER_DESCRIPTION = "chapter_description";
    public static final String HEADING_DESCRIPTION = "heading_description";
    public static final String SUBHEADING_DESCRIPTION = "subheading_description";

    @JsonProperty(HSN_CODE)
    private String hsnCode;

    @JsonProperty(CHAPTER)
    private String chapter;

    @JsonProperty(HEADING)
    private String heading;

    @JsonProperty(SUBHEADING)
    private String subheading;

    @JsonProperty(ITEM_DESCRIPTION)
    private String itemDescription;

    @JsonProperty(CHAPTER_DESCRIPTION)
    private String chapterDescription;

    @JsonProperty(HEADING_DESCRIPTION)
    private String headingDescription;

    @JsonProperty(SUBHEADING_DESCRIPTION)
    private String subheadingDescription;

    public Map<String, String> toMap() {
        Map<String, String> map = new LinkedHashMap<>();
        put(map, HSN_CODE, hsnCode);
        put(map, CHAPTER, chapter);
        put(map, HEADING, heading);
        put(map, SUBHEADING, subheading);
        put(map, ITEM_DESCRIPTION, itemDescription);
        put(map, CHAPTER_DESCRIPTION, chapterDescription);
        put(map, HEADING_DESCRIPTION, headingDescription);
        put(map, SUBHEADING_DESCRIPTION, subheadingDescription);
        return map;
    }

    public static HsnMetadata fromMap(Map<String, ?> map) {
        return HsnMetadata.builder()
                .hsnCode(get(map, HSN_CODE))
                .chapter(get(map, CHAPTER))
                .heading(get(map, HEADING))
                .subheading(get(map, SUBHEADING))
                .itemDescription(get(map, ITEM_DESCRIPTION))
                .chapterDescription(get(map, CHAPTER_DESCRIPTION))
                .headingDescription(get(map, HEADING_DESCRIPTION))
                .subheadingDescription(get(map, SUBHEADING_DESCRIPTION))
                .build();
    }

    // Pinecone and the langchain4j metadata both reject null values
    private static void put(Map<String, String> map, String key, String value) {
        if (value != null) {
            map.put(key, value);
        }
    }

    private static String get(Map<String, ?> map, String key) {
        Object value = map.get(key);
        return value != null ? value.toString() : null;
    }
}
