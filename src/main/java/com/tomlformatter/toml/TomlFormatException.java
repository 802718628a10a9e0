package com.tomlformatter.toml;

/**
 * Base class for every failure raised by the formatting engine.
 * Line and column are 1-based; 0 means the position is unknown.
 */
public class TomlFormatException extends RuntimeException {
    private final int line;
    private final int column;

    public TomlFormatException(String message) {
        this(message, 0, 0, null);
    }

    public TomlFormatException(String message, int line, int column) {
        this(message, line, column, null);
    }

    public TomlFormatException(String message, int line, int column, Throwable cause) {
        super(message, cause);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean hasPosition() {
        return line > 0;
    }
}
