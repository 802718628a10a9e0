package com.tomlformatter.toml;

/**
 * The formatted text does not carry the same data as the input it was produced from.
 */
public class ContentMismatchException extends TomlFormatException {

    public ContentMismatchException(String message) {
        super(message);
    }
}
