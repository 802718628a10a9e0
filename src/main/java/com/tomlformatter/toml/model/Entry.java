package com.tomlformatter.toml.model;

/**
 * The smallest formatted unit of a TOML document: a key/value pair, a table or
 * array-of-tables header, a comment line or a blank line.
 *
 * <p>Value data (kind, key, value) is fixed at parse time. Formatting metadata
 * (leading whitespace, trailing comment spelling, laid-out value text) is
 * rewritten by the formatter.
 */
public final class Entry {
    private final EntryKind kind;
    private final TomlKey key;
    private final TomlValue value;
    private final int line;

    private String leadingWhitespace;
    private String comment;
    private String valueText;

    private Entry(EntryKind kind, TomlKey key, TomlValue value, String comment, String leadingWhitespace, int line) {
        this.kind = kind;
        this.key = key;
        this.value = value;
        this.comment = comment;
        this.leadingWhitespace = leadingWhitespace;
        this.line = line;
    }

    public static Entry keyValue(TomlKey key, TomlValue value, String comment, String leadingWhitespace, int line) {
        return new Entry(EntryKind.KEY_VALUE, key, value, comment, leadingWhitespace, line);
    }

    public static Entry tableHeader(TomlKey key, String comment, String leadingWhitespace, int line) {
        return new Entry(EntryKind.TABLE_HEADER, key, null, comment, leadingWhitespace, line);
    }

    public static Entry arrayOfTablesHeader(TomlKey key, String comment, String leadingWhitespace, int line) {
        return new Entry(EntryKind.ARRAY_OF_TABLES_HEADER, key, null, comment, leadingWhitespace, line);
    }

    public static Entry comment(String text, String leadingWhitespace, int line) {
        return new Entry(EntryKind.COMMENT, null, null, text, leadingWhitespace, line);
    }

    public static Entry blank(int line) {
        return new Entry(EntryKind.BLANK, null, null, null, "", line);
    }

    public EntryKind getKind() {
        return kind;
    }

    public TomlKey getKey() {
        return key;
    }

    public TomlValue getValue() {
        return value;
    }

    public int getLine() {
        return line;
    }

    public String getLeadingWhitespace() {
        return leadingWhitespace;
    }

    public void setLeadingWhitespace(String leadingWhitespace) {
        this.leadingWhitespace = leadingWhitespace;
    }

    /**
     * For comment entries the whole comment text; for other entries the trailing
     * comment, or null when there is none. Always starts with {@code #}.
     */
    public String getComment() {
        return comment;
    }

    public void setComment(String comment) {
        this.comment = comment;
    }

    /**
     * Overrides the compact rendering of the value, e.g. with a multiline array layout.
     */
    public void setValueText(String valueText) {
        this.valueText = valueText;
    }

    public String render() {
        switch (kind) {
            case BLANK:
                return "";
            case COMMENT:
                return leadingWhitespace + comment;
            case TABLE_HEADER:
                return leadingWhitespace + "[" + key.render() + "]" + _commentSuffix();
            case ARRAY_OF_TABLES_HEADER:
                return leadingWhitespace + "[[" + key.render() + "]]" + _commentSuffix();
            default:
                String text = valueText != null ? valueText : value.renderInline();
                return leadingWhitespace + key.render() + " = " + text + _commentSuffix();
        }
    }

    private String _commentSuffix() {
        return comment == null ? "" : " " + comment;
    }

    @Override
    public String toString() {
        return kind + "@" + line + ": " + render();
    }
}
