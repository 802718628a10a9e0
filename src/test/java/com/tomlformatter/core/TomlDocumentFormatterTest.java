package com.tomlformatter.core;

import static org.assertj.core.api.Assertions.assertThat;

import com.tomlformatter.api.FormatterResult;
import com.tomlformatter.api.error.FormatterError;
import com.tomlformatter.api.error.Severity;
import com.tomlformatter.config.ConfigurationLoader;
import com.tomlformatter.config.FormatterConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TomlDocumentFormatterTest {

    @TempDir
    Path tempDir;

    private final TomlDocumentFormatter formatter = new TomlDocumentFormatter(ConfigurationLoader.loadDefaultConfig());

    @AfterEach
    void closeFormatter() {
        formatter.close();
    }

    @Test
    void reportsChangedDocument() {
        FormatterResult result = formatter.formatFile(Path.of("a.toml"), "b = 1\na = 2\n");

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.isChanged()).isTrue();
        assertThat(result.getOriginalContent()).isEqualTo("b = 1\na = 2\n");
        assertThat(result.getFormattedContent()).isEqualTo("a = 2\nb = 1\n");
        assertThat(result.getErrors()).isEmpty();
    }

    @Test
    void reportsAlreadyFormattedDocumentAsUnchanged() {
        FormatterResult result = formatter.formatFile(Path.of("a.toml"), "a = 2\nb = 1\n");

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.isChanged()).isFalse();
    }

    @Test
    void turnsMalformedInputIntoFatalError() {
        FormatterResult result = formatter.formatFile(Path.of("bad.toml"), "a = 1\n= 2\n");

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.isChanged()).isFalse();
        assertThat(result.getFormattedContent()).isEqualTo("a = 1\n= 2\n");
        assertThat(result.getErrors()).singleElement().satisfies(error -> {
            assertThat(error.getSeverity()).isEqualTo(Severity.FATAL);
            assertThat(error.getLine()).isEqualTo(2);
            assertThat(error.getSuggestion()).isNotBlank();
        });
        assertThat(formatter.getErrorCount()).isEqualTo(1);
    }

    @Test
    void formatsEveryTomlFileOfDirectoryTree() throws IOException {
        Path nested = Files.createDirectories(tempDir.resolve("nested"));
        Path first = Files.writeString(tempDir.resolve("one.toml"), "b = 1\na = 2\n");
        Path second = Files.writeString(nested.resolve("two.toml"), "x = 1\n");
        Path broken = Files.writeString(nested.resolve("three.toml"), "x = [\n");
        Files.writeString(tempDir.resolve("notes.txt"), "not toml");

        Map<Path, FormatterResult> results = formatter.formatDirectory(tempDir, 2);

        assertThat(results).containsOnlyKeys(first, second, broken);
        assertThat(results.get(first).isChanged()).isTrue();
        assertThat(results.get(second).isChanged()).isFalse();
        assertThat(results.get(broken).isSuccessful()).isFalse();
        assertThat(formatter.getProcessedFileCount()).isEqualTo(3);
        assertThat(formatter.getSuccessCount()).isEqualTo(2);
        assertThat(formatter.getErrorCount()).isEqualTo(1);
        assertThat(Files.readString(first)).isEqualTo("b = 1\na = 2\n");
    }

    @Test
    void skipsHiddenAndExcludedFilesOfDirectoryTree() throws IOException {
        Path kept = Files.writeString(tempDir.resolve("keep.toml"), "a = 1\n");
        Files.writeString(tempDir.resolve(".hidden.toml"), "a = 1\n");
        Path hiddenDir = Files.createDirectories(tempDir.resolve(".venv"));
        Files.writeString(hiddenDir.resolve("lib.toml"), "a = 1\n");
        Path vendor = Files.createDirectories(tempDir.resolve("vendor"));
        Files.writeString(vendor.resolve("dep.toml"), "a = 1\n");

        FormatterConfig config = new FormatterConfig(Map.of(FormatterConfig.EXCLUDE, List.of("vendor/**")));
        try (TomlDocumentFormatter excluding = new TomlDocumentFormatter(config)) {
            assertThat(excluding.formatDirectory(tempDir, 1)).containsOnlyKeys(kept);
        }
    }

    @Test
    void findsHiddenFilesOnlyWhenAsked() throws IOException {
        Path kept = Files.writeString(tempDir.resolve("keep.toml"), "a = 1\n");
        Path hidden = Files.writeString(tempDir.resolve(".hidden.toml"), "a = 1\n");

        assertThat(TomlDocumentFormatter.findTomlFiles(tempDir, List.of(), false)).containsExactly(kept);
        assertThat(TomlDocumentFormatter.findTomlFiles(tempDir, List.of(), true)).containsExactly(hidden, kept);
    }

    @Test
    void reportsUnreadableFiles() {
        Path missing = tempDir.resolve("missing.toml");

        Map<Path, FormatterResult> results = formatter.formatFiles(List.of(missing), 1);

        FormatterError error = results.get(missing).getErrors().get(0);
        assertThat(error.getSeverity()).isEqualTo(Severity.FATAL);
        assertThat(error.getMessage()).startsWith("Failed to read file");
    }

    @Test
    void returnsNothingForMissingDirectory() {
        assertThat(formatter.formatDirectory(tempDir.resolve("nope"))).isEmpty();
    }
}
