package com.tomlformatter.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.tomlformatter.toml.FormatterOptions;
import com.tomlformatter.util.LoggerUtil;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Loads formatter configuration from YAML files or from the {@code [tool.toml-formatter]}
 * table of a {@code pyproject.toml}, with validation and fallback to defaults.
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerUtil.getLogger(ConfigurationLoader.class);
    private static final String DEFAULT_CONFIG_RESOURCE = "/config/default-config.yml";

    public static final String DEFAULT_CONFIG_FILE = ".tomlformatter.yml";
    public static final String PYPROJECT_FILE = "pyproject.toml";
    static final List<String> TOML_TABLE_PATH = List.of("tool", "toml-formatter");

    private static FormatterConfig _cachedDefaultConfig = null;

    /**
     * Picks the configuration file of {@code directory}: {@value #DEFAULT_CONFIG_FILE}, or
     * {@value #PYPROJECT_FILE} when only that one exists. Returns the YAML path when neither exists.
     */
    public static Path findConfig(Path directory) {
        Path yaml = directory.resolve(DEFAULT_CONFIG_FILE);
        Path pyproject = directory.resolve(PYPROJECT_FILE);
        if (!Files.exists(yaml) && Files.exists(pyproject)) {
            return pyproject;
        }
        return yaml;
    }

    /**
     * Loads configuration from a file with fallback to defaults. Files ending in
     * {@code .toml} are read with tomlj, anything else as YAML.
     */
    public static FormatterConfig loadConfig(Path configPath) {
        if (configPath == null) {
            logger.warning("No config path provided, using default configuration");
            return loadDefaultConfig();
        }

        if (!Files.exists(configPath)) {
            logger.fine("Configuration file not found: " + configPath + ", using default configuration");
            return loadDefaultConfig();
        }

        try {
            logger.info("Loading configuration from: " + configPath);

            Map<String, Object> config = _isToml(configPath) ? _readToml(configPath) : _readYaml(configPath);
            FormatterConfig formatterConfig = _createConfigFromMap(config);
            logger.info("Configuration loaded: " + formatterConfig);

            return formatterConfig;
        } catch (Exception e) {
            logger.log(Level.WARNING, "Error parsing configuration file: " + e.getMessage(), e);
            logger.info("Falling back to default configuration");
            return loadDefaultConfig();
        }
    }

    /**
     * Loads the embedded default configuration with caching.
     */
    public static synchronized FormatterConfig loadDefaultConfig() {
        if (_cachedDefaultConfig != null) {
            return _cachedDefaultConfig;
        }

        try (InputStream defaultConfigStream =
                     ConfigurationLoader.class.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {

            if (defaultConfigStream == null) {
                logger.severe("Default configuration resource not found: " + DEFAULT_CONFIG_RESOURCE);
                return _createEmptyConfig();
            }

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(defaultConfigStream, Map.class);

            _cachedDefaultConfig = _createConfigFromMap(config);
            logger.fine("Default configuration loaded successfully");

            return _cachedDefaultConfig;
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to load default configuration", e);
            return _createEmptyConfig();
        }
    }

    private static boolean _isToml(Path configPath) {
        return configPath.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".toml");
    }

    private static Map<String, Object> _readYaml(Path configPath) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        @SuppressWarnings("unchecked")
        Map<String, Object> config = mapper.readValue(configPath.toFile(), Map.class);
        return config == null ? new HashMap<>() : config;
    }

    /**
     * Reads the {@code [tool.toml-formatter]} table. A file without it yields an empty map.
     */
    private static Map<String, Object> _readToml(Path configPath) throws IOException {
        TomlParseResult result = Toml.parse(configPath);
        if (result.hasErrors()) {
            throw new IOException("Invalid TOML in " + configPath + ": " + result.errors().get(0));
        }

        TomlTable table = result.getTable(TOML_TABLE_PATH);
        if (table == null) {
            logger.fine("No [tool.toml-formatter] table in " + configPath);
            return new HashMap<>();
        }

        Map<String, Object> config = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : table.toMap().entrySet()) {
            Object value = entry.getValue();
            config.put(entry.getKey(), value instanceof TomlArray ? ((TomlArray) value).toList() : value);
        }
        return config;
    }

    /**
     * Creates a configuration from a parsed Map, with validation. Missing keys take
     * their default values; unknown keys are dropped.
     */
    private static FormatterConfig _createConfigFromMap(Map<String, Object> config) {
        Map<String, Object> settings = new LinkedHashMap<>();
        _ensureDefaults(settings);

        for (Map.Entry<String, Object> entry : config.entrySet()) {
            if (settings.containsKey(entry.getKey())) {
                settings.put(entry.getKey(), entry.getValue());
            } else {
                logger.warning("Unknown configuration key '" + entry.getKey() + "' ignored");
            }
        }

        _validateConfigurationValues(settings);

        return new FormatterConfig(settings);
    }

    /**
     * Replaces every invalid value with its default.
     */
    private static void _validateConfigurationValues(Map<String, Object> settings) {
        _validateIntMinimum(settings, FormatterConfig.LINE_LENGTH, 1, FormatterOptions.DEFAULT_LINE_LENGTH);
        _validateIntMinimum(settings, FormatterConfig.INDENTATION, 0, FormatterOptions.DEFAULT_INDENTATION);
        _validateStringList(settings, FormatterConfig.EXCLUDE);

        if (_validateStringList(settings, FormatterConfig.SECTION_ORDER_OVERRIDES)) {
            for (Object regex : (List<?>) settings.get(FormatterConfig.SECTION_ORDER_OVERRIDES)) {
                try {
                    Pattern.compile((String) regex);
                } catch (PatternSyntaxException e) {
                    logger.warning("Invalid regular expression '" + regex + "' in '"
                            + FormatterConfig.SECTION_ORDER_OVERRIDES + "': " + e.getDescription()
                            + ". Using default value.");
                    settings.put(FormatterConfig.SECTION_ORDER_OVERRIDES, new ArrayList<String>());
                    break;
                }
            }
        }

        Object logLevel = settings.get(FormatterConfig.LOG_LEVEL);
        try {
            LoggerUtil.toLevel(String.valueOf(logLevel));
            settings.put(FormatterConfig.LOG_LEVEL, String.valueOf(logLevel).toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            logger.warning("Configuration value '" + FormatterConfig.LOG_LEVEL + "' is not a known level ("
                    + logLevel + "). Using default value.");
            settings.put(FormatterConfig.LOG_LEVEL, "INFO");
        }
    }

    /**
     * Validates that an integer configuration value is at least {@code min}.
     */
    private static void _validateIntMinimum(Map<String, Object> settings, String key, int min, int defaultValue) {
        Object value = settings.get(key);
        boolean integral = value instanceof Integer || value instanceof Long;
        if (!integral) {
            logger.warning("Configuration value '" + key + "' must be an integer (" + value + "). Using default value.");
            settings.put(key, defaultValue);
        } else if (((Number) value).longValue() < min || ((Number) value).longValue() > Integer.MAX_VALUE) {
            logger.warning("Configuration value '" + key + "' must be at least " + min
                    + " (" + value + "). Using default value.");
            settings.put(key, defaultValue);
        } else {
            settings.put(key, ((Number) value).intValue());
        }
    }

    /**
     * Validates that a value is a list of strings; returns whether it was.
     */
    private static boolean _validateStringList(Map<String, Object> settings, String key) {
        Object value = settings.get(key);
        if (value instanceof List && ((List<?>) value).stream().allMatch(String.class::isInstance)) {
            settings.put(key, new ArrayList<>((List<?>) value));
            return true;
        }
        logger.warning("Configuration value '" + key + "' must be a list of strings. Using default value.");
        settings.put(key, new ArrayList<String>());
        return false;
    }

    /**
     * Creates an empty configuration with minimum defaults.
     */
    private static FormatterConfig _createEmptyConfig() {
        Map<String, Object> settings = new LinkedHashMap<>();
        _ensureDefaults(settings);
        return new FormatterConfig(settings);
    }

    /**
     * Defaults for every known key, in the order they are written out.
     */
    private static void _ensureDefaults(Map<String, Object> settings) {
        settings.putIfAbsent(FormatterConfig.LINE_LENGTH, FormatterOptions.DEFAULT_LINE_LENGTH);
        settings.putIfAbsent(FormatterConfig.INDENTATION, FormatterOptions.DEFAULT_INDENTATION);
        settings.putIfAbsent(FormatterConfig.SECTION_ORDER_OVERRIDES, new ArrayList<String>());
        settings.putIfAbsent(FormatterConfig.LOG_LEVEL, "INFO");
        settings.putIfAbsent(FormatterConfig.EXCLUDE, new ArrayList<String>());
    }

    /**
     * Saves configuration to a YAML file.
     */
    public static void saveConfig(FormatterConfig config, Path configPath) throws IOException {
        try {
            Path parent = configPath.getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.writeValue(configPath.toFile(), config.getSettingsMap());

            logger.info("Configuration saved successfully to: " + configPath);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to save configuration to: " + configPath, e);
            throw e;
        }
    }
}
