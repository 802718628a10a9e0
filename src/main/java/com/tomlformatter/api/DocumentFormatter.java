package com.tomlformatter.api;

import java.nio.file.Path;
import java.util.Map;

/**
 * Formats TOML documents held in files.
 */
public interface DocumentFormatter {
    FormatterResult formatFile(Path filePath, String content);
    Map<Path, FormatterResult> formatDirectory(Path directory);
}
