package com.tomlformatter.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.tomlformatter.toml.FormatterOptions;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void loadsEmbeddedDefaults() {
        FormatterConfig config = ConfigurationLoader.loadDefaultConfig();

        assertThat(config.getLineLength()).isEqualTo(FormatterOptions.DEFAULT_LINE_LENGTH);
        assertThat(config.getIndentation()).isEqualTo(FormatterOptions.DEFAULT_INDENTATION);
        assertThat(config.getSectionOrderOverrides()).isEmpty();
        assertThat(config.getLogLevel()).isEqualTo("INFO");
        assertThat(config.getExcludePatterns()).isEmpty();
    }

    @Test
    void fallsBackToDefaultsForMissingFile() {
        FormatterConfig config = ConfigurationLoader.loadConfig(tempDir.resolve("absent.yml"));

        assertThat(config.getSettingsMap()).isEqualTo(ConfigurationLoader.loadDefaultConfig().getSettingsMap());
    }

    @Test
    void readsYamlConfiguration() throws IOException {
        Path file = tempDir.resolve(".tomlformatter.yml");
        Files.writeString(file, "line_length: 120\n"
                + "indentation: 4\n"
                + "section_order_overrides:\n  - '^tool'\n  - project\n"
                + "loglevel: debug\n"
                + "exclude:\n  - 'vendor/**'\n");

        FormatterConfig config = ConfigurationLoader.loadConfig(file);

        assertThat(config.getLineLength()).isEqualTo(120);
        assertThat(config.getIndentation()).isEqualTo(4);
        assertThat(config.getSectionOrderOverrides()).containsExactly("^tool", "project");
        assertThat(config.getLogLevel()).isEqualTo("DEBUG");
        assertThat(config.getExcludePatterns()).containsExactly("vendor/**");

        FormatterOptions options = config.toOptions();
        assertThat(options.getLineLength()).isEqualTo(120);
        assertThat(options.getOverridePatterns()).hasSize(2);
    }

    @Test
    void readsToolTableOfPyproject() throws IOException {
        Path file = tempDir.resolve("pyproject.toml");
        Files.writeString(file, "[project]\nname = 'demo'\n\n"
                + "[tool.toml-formatter]\nline_length = 100\nsection_order_overrides = ['^build']\n");

        FormatterConfig config = ConfigurationLoader.loadConfig(file);

        assertThat(config.getLineLength()).isEqualTo(100);
        assertThat(config.getIndentation()).isEqualTo(FormatterOptions.DEFAULT_INDENTATION);
        assertThat(config.getSectionOrderOverrides()).containsExactly("^build");
    }

    @Test
    void usesDefaultsForPyprojectWithoutToolTable() throws IOException {
        Path file = tempDir.resolve("pyproject.toml");
        Files.writeString(file, "[project]\nname = 'demo'\n");

        assertThat(ConfigurationLoader.loadConfig(file).getLineLength())
                .isEqualTo(FormatterOptions.DEFAULT_LINE_LENGTH);
    }

    @Test
    void replacesInvalidValuesWithDefaults() throws IOException {
        Path file = tempDir.resolve("bad.yml");
        Files.writeString(file, "line_length: 0\n"
                + "indentation: many\n"
                + "section_order_overrides: ['(unclosed']\n"
                + "loglevel: LOUD\n"
                + "exclude: 7\n"
                + "colour: blue\n");

        FormatterConfig config = ConfigurationLoader.loadConfig(file);

        assertThat(config.getLineLength()).isEqualTo(FormatterOptions.DEFAULT_LINE_LENGTH);
        assertThat(config.getIndentation()).isEqualTo(FormatterOptions.DEFAULT_INDENTATION);
        assertThat(config.getSectionOrderOverrides()).isEmpty();
        assertThat(config.getLogLevel()).isEqualTo("INFO");
        assertThat(config.getExcludePatterns()).isEmpty();
        assertThat(config.getSettingsMap()).doesNotContainKey("colour");
    }

    @Test
    void fallsBackToDefaultsForUnparsableFile() throws IOException {
        Path file = tempDir.resolve("broken.toml");
        Files.writeString(file, "[tool.toml-formatter\nline_length = 3\n");

        assertThat(ConfigurationLoader.loadConfig(file).getLineLength())
                .isEqualTo(FormatterOptions.DEFAULT_LINE_LENGTH);
    }

    @Test
    void prefersYamlOverPyproject() throws IOException {
        assertThat(ConfigurationLoader.findConfig(tempDir).getFileName().toString())
                .isEqualTo(ConfigurationLoader.DEFAULT_CONFIG_FILE);

        Files.writeString(tempDir.resolve("pyproject.toml"), "");
        assertThat(ConfigurationLoader.findConfig(tempDir).getFileName().toString())
                .isEqualTo(ConfigurationLoader.PYPROJECT_FILE);

        Files.writeString(tempDir.resolve(".tomlformatter.yml"), "");
        assertThat(ConfigurationLoader.findConfig(tempDir).getFileName().toString())
                .isEqualTo(ConfigurationLoader.DEFAULT_CONFIG_FILE);
    }

    @Test
    void savedConfigurationLoadsBack() throws IOException {
        Path file = tempDir.resolve("nested/config.yml");
        FormatterConfig original = new FormatterConfig(ConfigurationLoader.loadDefaultConfig().getSettingsMap());

        ConfigurationLoader.saveConfig(original, file);

        assertThat(ConfigurationLoader.loadConfig(file).getSettingsMap()).isEqualTo(original.getSettingsMap());
    }

    @Test
    void rendersConfigurationAsToolTable() {
        FormatterConfig config = new FormatterConfig(Map.of(
                FormatterConfig.SECTION_ORDER_OVERRIDES, List.of("^a\\.b", "it's")));

        assertThat(config.toToml()).isEqualTo(
                "[tool.toml-formatter]\nsection_order_overrides = ['^a\\.b', \"it's\"]\n");
    }
}
