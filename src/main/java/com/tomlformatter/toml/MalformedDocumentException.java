package com.tomlformatter.toml;

/**
 * The input never resolves to valid TOML syntax, even after buffering every remaining line.
 */
public class MalformedDocumentException extends TomlFormatException {

    public MalformedDocumentException(String message, int line, int column) {
        super(message + " (line " + line + ", column " + column + ")", line, column);
    }
}
