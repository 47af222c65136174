package com.purchasingpower.hsn.core;

/**
 * Level of a node in the HSN taxonomy.
 *
 * <p>The id prefix is used to derive node ids from flat records, so the same
 * taxonomy entry always maps to the same node.
 *
 * @since 1.0.0
 */
public enum NodeLabel {
    CHAPTER("Chapter", "chap_"),
    HEADING("Heading", "head_"),
    SUBHEADING("Subheading", "sub_"),
    CODE("HSNCode", "code_");

    private final String displayName;
    private final String idPrefix;

    NodeLabel(String displayName, String idPrefix) {
        this.displayName = displayName;
        this.idPrefix = idPrefix;
    }

    /**
     * Label as written to the graph database and to exports.
     */
    public String getDisplayName() {
        return displayName;
    }

    public String nodeId(String taxonomyId) {
        return idPrefix + taxonomyId;
    }

    public static NodeLabel fromDisplayName(String displayName) {
        for (NodeLabel label : values()) {
            if (label.displayName.equalsIgnoreCase(displayName) || label.name().equalsIgnoreCase(displayName)) {
                return label;
            }
        }
        throw new IllegalArgumentException("Unknown node label: " + displayName);
    }
}
