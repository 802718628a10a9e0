package com.tomlformatter.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.tomlformatter.toml.FormatterOptions;

/**
 * Configuration for the formatter, as loaded by {@link ConfigurationLoader}.
 */
public class FormatterConfig {
    public static final String LINE_LENGTH = "line_length";
    public static final String INDENTATION = "indentation";
    public static final String SECTION_ORDER_OVERRIDES = "section_order_overrides";
    public static final String LOG_LEVEL = "loglevel";
    public static final String EXCLUDE = "exclude";

    private final Map<String, Object> settings;

    public FormatterConfig(Map<String, Object> settings) {
        this.settings = Collections.unmodifiableMap(new LinkedHashMap<>(settings));
    }

    /**
     * Gets a copy of the settings map.
     */
    public Map<String, Object> getSettingsMap() {
        return new LinkedHashMap<>(settings);
    }

    @SuppressWarnings("unchecked")
    public <T> T getSetting(String key, T defaultValue) {
        Object value = settings.get(key);
        if (value == null) {
            return defaultValue;
        }

        if (defaultValue != null && !defaultValue.getClass().isInstance(value)) {
            if (defaultValue instanceof Integer && value instanceof Number) {
                return (T) Integer.valueOf(((Number) value).intValue());
            } else if (defaultValue instanceof String) {
                return (T) value.toString();
            }
            return defaultValue;
        }

        return (T) value;
    }

    public int getLineLength() {
        return getSetting(LINE_LENGTH, FormatterOptions.DEFAULT_LINE_LENGTH);
    }

    public int getIndentation() {
        return getSetting(INDENTATION, FormatterOptions.DEFAULT_INDENTATION);
    }

    public List<String> getSectionOrderOverrides() {
        return _getStringList(SECTION_ORDER_OVERRIDES);
    }

    public String getLogLevel() {
        return getSetting(LOG_LEVEL, "INFO");
    }

    public List<String> getExcludePatterns() {
        return _getStringList(EXCLUDE);
    }

    /**
     * Builds the options snapshot the formatting engine runs with.
     */
    public FormatterOptions toOptions() {
        return FormatterOptions.builder()
                .lineLength(getLineLength())
                .indentation(getIndentation())
                .sectionOrderOverrides(getSectionOrderOverrides())
                .build();
    }

    /**
     * Renders the configuration as the body of a {@code [tool.toml-formatter]} table.
     */
    public String toToml() {
        StringBuilder sb = new StringBuilder("[tool.toml-formatter]\n");
        for (Map.Entry<String, Object> entry : settings.entrySet()) {
            sb.append(entry.getKey()).append(" = ").append(_tomlValue(entry.getValue())).append('\n');
        }
        return sb.toString();
    }

    private List<String> _getStringList(String key) {
        Object value = settings.get(key);
        List<String> result = new ArrayList<>();
        if (value instanceof List) {
            for (Object element : (List<?>) value) {
                result.add(String.valueOf(element));
            }
        }
        return result;
    }

    private static String _tomlValue(Object value) {
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof List) {
            List<String> elements = new ArrayList<>();
            for (Object element : (List<?>) value) {
                elements.add(_tomlValue(element));
            }
            return "[" + String.join(", ", elements) + "]";
        }
        return _tomlString(String.valueOf(value));
    }

    /**
     * Literal strings keep regular expressions readable; anything a literal string
     * cannot hold falls back to an escaped basic string.
     */
    private static String _tomlString(String text) {
        boolean literalSafe = text.chars().noneMatch(c -> c == '\'' || c < 0x20 || c == 0x7f);
        if (literalSafe) {
            return "'" + text + "'";
        }
        StringBuilder sb = new StringBuilder("\"");
        for (char c : text.toCharArray()) {
            switch (c) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                default:
                    if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\u%04X", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
        return sb.append('"').toString();
    }

    @Override
    public String toString() {
        return "FormatterConfig" + settings;
    }
}
