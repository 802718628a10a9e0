package com.tomlformatter.toml.model;

import com.tomlformatter.toml.UnsupportedConstructException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A TOML array. Element values are kept in source order and never reordered.
 */
public final class ArrayValue extends TomlValue {
    private final List<ArrayElement> elements;
    private final String openingComment;
    private final List<String> closingComments;
    private final boolean lineBreak;
    private final int line;

    public ArrayValue(List<ArrayElement> elements, String openingComment, List<String> closingComments,
                      boolean lineBreak, int line) {
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
        this.openingComment = openingComment;
        this.closingComments = Collections.unmodifiableList(new ArrayList<>(closingComments));
        this.lineBreak = lineBreak;
        this.line = line;
    }

    public List<ArrayElement> getElements() {
        return elements;
    }

    /**
     * Comment on the line of the opening bracket; may be null.
     */
    public String getOpeningComment() {
        return openingComment;
    }

    /**
     * Comment lines between the last element and the closing bracket.
     */
    public List<String> getClosingComments() {
        return closingComments;
    }

    /**
     * Source line of the opening bracket.
     */
    public int getLine() {
        return line;
    }

    /**
     * Whether this array itself (ignoring nested values) carries comments.
     */
    public boolean hasOwnComments() {
        return openingComment != null
                || !closingComments.isEmpty()
                || elements.stream().anyMatch(ArrayElement::hasComments);
    }

    @Override
    public String renderInline() {
        if (hasOwnComments()) {
            throw new UnsupportedConstructException(
                    "comments inside a nested array cannot be kept on a single line", line);
        }
        return elements.stream()
                .map(element -> element.getValue().renderInline())
                .collect(Collectors.joining(", ", "[", "]"));
    }

    @Override
    public boolean containsLineBreak() {
        return lineBreak || elements.stream().anyMatch(element -> element.getValue().containsLineBreak());
    }

    @Override
    public boolean containsComments() {
        return hasOwnComments() || elements.stream().anyMatch(element -> element.getValue().containsComments());
    }
}
