package com.tomlformatter.toml.model;

/**
 * Right-hand side of a key/value entry.
 */
public abstract class TomlValue {

    /**
     * Renders the value compactly on as few lines as its content allows.
     * Only multi-line string literals may still produce line breaks.
     *
     * @throws com.tomlformatter.toml.UnsupportedConstructException if the value carries
     *         comments that a compact rendering would drop
     */
    public abstract String renderInline();

    /**
     * Whether the source text of this value had a line break between tokens
     * (line breaks inside string literals do not count).
     */
    public abstract boolean containsLineBreak();

    public abstract boolean containsComments();
}
