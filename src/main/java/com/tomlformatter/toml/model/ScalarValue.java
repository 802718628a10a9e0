package com.tomlformatter.toml.model;

/**
 * Strings, numbers, booleans and date-times. Kept as their exact source text.
 */
public final class ScalarValue extends TomlValue {
    private final String text;

    public ScalarValue(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }

    @Override
    public String renderInline() {
        return text;
    }

    @Override
    public boolean containsLineBreak() {
        return false;
    }

    @Override
    public boolean containsComments() {
        return false;
    }
}
