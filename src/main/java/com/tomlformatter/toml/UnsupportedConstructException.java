package com.tomlformatter.toml;

/**
 * A value shape that the layout rules have no defined rendering for.
 */
public class UnsupportedConstructException extends TomlFormatException {
    private final String sectionName;

    public UnsupportedConstructException(String message, int line) {
        super(message, line, 0);
        this.sectionName = null;
    }

    private UnsupportedConstructException(String sectionName, UnsupportedConstructException cause) {
        super("Section " + _describe(sectionName) + ": " + cause.getMessage(), cause.getLine(), cause.getColumn(), cause);
        this.sectionName = sectionName;
    }

    /**
     * Returns a copy of this exception that names the section it was raised in.
     */
    public UnsupportedConstructException inSection(String sectionName) {
        return new UnsupportedConstructException(sectionName, this);
    }

    public String getSectionName() {
        return sectionName;
    }

    private static String _describe(String sectionName) {
        return sectionName == null || sectionName.isEmpty() ? "<top-level>" : "[" + sectionName + "]";
    }
}
