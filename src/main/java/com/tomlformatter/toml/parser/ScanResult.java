package com.tomlformatter.toml.parser;

import com.tomlformatter.toml.model.Entry;

/**
 * Outcome of scanning a buffered fragment.
 */
public final class ScanResult {

    public enum Status {
        COMPLETE,   // exactly one entry, buffer fully consumed
        INCOMPLETE, // buffer ended inside an open array, inline table or multi-line string
        ERROR
    }

    private final Status status;
    private final Entry entry;
    private final String message;
    private final int line;
    private final int column;

    private ScanResult(Status status, Entry entry, String message, int line, int column) {
        this.status = status;
        this.entry = entry;
        this.message = message;
        this.line = line;
        this.column = column;
    }

    static ScanResult complete(Entry entry) {
        return new ScanResult(Status.COMPLETE, entry, null, 0, 0);
    }

    static ScanResult incomplete() {
        return new ScanResult(Status.INCOMPLETE, null, null, 0, 0);
    }

    static ScanResult error(String message, int line, int column) {
        return new ScanResult(Status.ERROR, null, message, line, column);
    }

    public Status getStatus() {
        return status;
    }

    public Entry getEntry() {
        return entry;
    }

    public String getMessage() {
        return message;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
