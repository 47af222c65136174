package com.purchasingpower.hsn.core;

/**
 * A candidate offered to the user during disambiguation, referenced by its
 * 1-based {@code position}.
 */
public record DisambiguationOption(int position, RetrievedDocument document) {

    public String hsnCode() {
        return document.getHsnCode();
    }
}
