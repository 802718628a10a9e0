package com.tomlformatter.toml.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One element of an array together with the comments written around it.
 */
public final class ArrayElement {
    private final List<String> leadingComments;
    private final TomlValue value;
    private String trailingComment;

    public ArrayElement(List<String> leadingComments, TomlValue value) {
        this.leadingComments = Collections.unmodifiableList(new ArrayList<>(leadingComments));
        this.value = value;
    }

    /**
     * Comment lines written on their own lines just before the element.
     */
    public List<String> getLeadingComments() {
        return leadingComments;
    }

    public TomlValue getValue() {
        return value;
    }

    /**
     * Comment on the same line as the element, after its comma; may be null.
     */
    public String getTrailingComment() {
        return trailingComment;
    }

    public void setTrailingComment(String trailingComment) {
        this.trailingComment = trailingComment;
    }

    public boolean hasComments() {
        return !leadingComments.isEmpty() || trailingComment != null;
    }
}
