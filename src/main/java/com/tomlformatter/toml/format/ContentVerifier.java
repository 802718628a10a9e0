package com.tomlformatter.toml.format;

import com.tomlformatter.toml.ContentMismatchException;
import com.tomlformatter.toml.MalformedDocumentException;
import com.tomlformatter.util.LoggerUtil;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseError;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Compares the data of two TOML texts using tomlj.
 */
public class ContentVerifier {
    private static final Logger logger = LoggerUtil.getLogger(ContentVerifier.class);

    /**
     * Parses {@code text} with tomlj.
     *
     * @throws MalformedDocumentException positioned at the first error tomlj reports
     */
    public static TomlParseResult parse(String text) {
        TomlParseResult result = Toml.parse(text);
        if (result.hasErrors()) {
            TomlParseError first = result.errors().get(0);
            String message = result.errors().stream()
                    .map(TomlParseError::getMessage)
                    .collect(Collectors.joining("; "));
            throw new MalformedDocumentException(message,
                    first.position().line(), first.position().column());
        }
        return result;
    }

    /**
     * Verifies that {@code formatted} holds the same data as the already parsed input.
     *
     * @throws ContentMismatchException if the output does not parse or its data differs
     */
    public void verify(TomlParseResult original, String formatted) {
        TomlParseResult output = Toml.parse(formatted);
        if (output.hasErrors()) {
            throw new ContentMismatchException("formatted output is not valid TOML: "
                    + output.errors().get(0).toString());
        }

        Object expected = toPlain(original);
        Object actual = toPlain(output);
        if (!expected.equals(actual)) {
            logger.severe("Formatted data differs from input. Expected " + expected + " but got " + actual);
            throw new ContentMismatchException("formatted output changes the document's data");
        }
    }

    /**
     * Converts tomlj tables and arrays into plain maps and lists so that values compare
     * with {@code equals}. Table key order is irrelevant.
     */
    static Object toPlain(Object value) {
        if (value instanceof TomlTable) {
            return toPlain(((TomlTable) value).toMap());
        } else if (value instanceof TomlArray) {
            return toPlain(((TomlArray) value).toList());
        } else if (value instanceof Map) {
            Map<Object, Object> converted = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                converted.put(entry.getKey(), toPlain(entry.getValue()));
            }
            return converted;
        } else if (value instanceof List) {
            List<Object> converted = new ArrayList<>();
            for (Object element : (List<?>) value) {
                converted.add(toPlain(element));
            }
            return converted;
        }
        return value;
    }
}
