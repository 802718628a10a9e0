package com.tomlformatter.toml.model;

public enum EntryKind {
    KEY_VALUE,
    TABLE_HEADER,           // [name]
    ARRAY_OF_TABLES_HEADER, // [[name]]
    COMMENT,
    BLANK;

    public boolean isHeader() {
        return this == TABLE_HEADER || this == ARRAY_OF_TABLES_HEADER;
    }

    /**
     * Comments and blank lines carry no data.
     */
    public boolean isTrivia() {
        return this == COMMENT || this == BLANK;
    }
}
