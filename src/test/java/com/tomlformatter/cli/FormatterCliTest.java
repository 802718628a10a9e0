package com.tomlformatter.cli;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FormatterCliTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private Path configFile;

    @BeforeEach
    void writeConfig() throws IOException {
        configFile = tempDir.resolve("settings.yml");
        Files.writeString(configFile, "exclude:\n  - 'vendor/**'\n");
    }

    private int run(String... args) {
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        return new FormatterCli(out).run(args);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private String config() {
        return "--config=" + configFile;
    }

    @Test
    void checkFailsAndPrintsDiffForUnformattedFile() throws IOException {
        Path file = Files.writeString(tempDir.resolve("app.toml"), "b = 1\na = 2\n");

        int status = run("check", file.toString(), config(), "--no-color");

        assertThat(status).isEqualTo(FormatterCli.EXIT_FAILURE);
        assertThat(output()).contains("File needs formatting: " + file, "--- a/", "+++ b/", "@@");
        assertThat(Files.readString(file)).isEqualTo("b = 1\na = 2\n");
    }

    @Test
    void checkPassesForFormattedFiles() throws IOException {
        Files.writeString(tempDir.resolve("app.toml"), "a = 2\nb = 1\n");

        assertThat(run("check", tempDir.toString(), config(), "--no-color")).isEqualTo(FormatterCli.EXIT_OK);
        assertThat(output()).contains("Checked files: 1", "Files needing formatting: 0");
    }

    @Test
    void fixInplaceRewritesFiles() throws IOException {
        Path file = Files.writeString(tempDir.resolve("app.toml"), "b = 1\na = 2\n");

        int status = run("check", file.toString(), config(), "--fix-inplace", "--no-color");

        assertThat(status).isEqualTo(FormatterCli.EXIT_OK);
        assertThat(Files.readString(file)).isEqualTo("a = 2\nb = 1\n");
        assertThat(output()).contains("Formatted: " + file);
    }

    @Test
    void showFormattedPrintsResult() throws IOException {
        Path file = Files.writeString(tempDir.resolve("app.toml"), "[t]\nk = 1\n");

        run("check", file.toString(), config(), "--show-formatted", "--no-color");

        assertThat(output()).contains("[t]\n  k = 1\n");
    }

    @Test
    void skipsHiddenAndExcludedFilesInDirectories() throws IOException {
        Files.createDirectories(tempDir.resolve(".cache"));
        Files.createDirectories(tempDir.resolve("vendor"));
        Files.writeString(tempDir.resolve(".cache/state.toml"), "b = 1\na = 2\n");
        Files.writeString(tempDir.resolve("vendor/lib.toml"), "b = 1\na = 2\n");
        Files.writeString(tempDir.resolve("ok.toml"), "a = 1\n");

        assertThat(run("check", tempDir.toString(), config(), "--no-color")).isEqualTo(FormatterCli.EXIT_OK);
        assertThat(output()).contains("Found 1 files to check");

        buffer.reset();
        assertThat(run("check", tempDir.toString(), config(), "--include-hidden", "--no-color"))
                .isEqualTo(FormatterCli.EXIT_FAILURE);
        assertThat(output()).contains("Found 2 files to check", "state.toml");
    }

    @Test
    void reportsFilesThatCannotBeFormatted() throws IOException {
        Path file = Files.writeString(tempDir.resolve("broken.toml"), "a = [1,\n");

        int status = run("check", file.toString(), config(), "--no-color");

        assertThat(status).isEqualTo(FormatterCli.EXIT_FAILURE);
        assertThat(output()).contains("Failed to format: " + file, "FATAL", "Error Summary:");
    }

    @Test
    void rejectsMissingPaths() {
        assertThat(run("check", tempDir.resolve("nope.toml").toString(), config(), "--no-color"))
                .isEqualTo(FormatterCli.EXIT_FAILURE);
        assertThat(output()).contains("Path does not exist");

        buffer.reset();
        assertThat(run("check", config(), "--no-color")).isEqualTo(FormatterCli.EXIT_FAILURE);
        assertThat(output()).contains("Missing path argument");
    }

    @Test
    void configsPrintsFormattedToolTable() {
        int status = run("configs", "--config=" + tempDir.resolve("none.yml"), "--no-color");

        assertThat(status).isEqualTo(FormatterCli.EXIT_OK);
        assertThat(output()).isEqualTo("[tool.toml-formatter]\n"
                + "  exclude = []\n"
                + "  indentation = 2\n"
                + "  line_length = 90\n"
                + "  loglevel = 'INFO'\n"
                + "  section_order_overrides = []\n");
    }

    @Test
    void initWritesConfigurationOnceUnlessForced() throws IOException {
        Path target = tempDir.resolve("new.yml");

        assertThat(run("init", "--config=" + target, "--no-color")).isEqualTo(FormatterCli.EXIT_OK);
        assertThat(Files.readString(target)).contains("line_length: 90");

        assertThat(run("init", "--config=" + target, "--no-color")).isEqualTo(FormatterCli.EXIT_FAILURE);
        assertThat(run("init", "--config=" + target, "--force", "--no-color")).isEqualTo(FormatterCli.EXIT_OK);
    }

    @Test
    void printsVersionAndHelp() {
        assertThat(run("--version")).isEqualTo(FormatterCli.EXIT_OK);
        assertThat(output()).contains("TOML Formatter version");

        assertThat(run("-h", "--no-color")).isEqualTo(FormatterCli.EXIT_OK);
        assertThat(output()).contains("Usage:", "--fix-inplace");
    }

    @Test
    void rejectsUnknownCommands() {
        assertThat(run("reformat", "--no-color")).isEqualTo(FormatterCli.EXIT_FAILURE);
        assertThat(output()).contains("Unknown command: reformat");
        assertThat(run()).isEqualTo(FormatterCli.EXIT_FAILURE);
    }
}
