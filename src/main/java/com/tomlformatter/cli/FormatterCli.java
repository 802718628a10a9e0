package com.tomlformatter.cli;

import com.tomlformatter.api.FormatterResult;
import com.tomlformatter.api.error.FormatterError;
import com.tomlformatter.config.ConfigurationLoader;
import com.tomlformatter.config.FormatterConfig;
import com.tomlformatter.core.TomlDocumentFormatter;
import com.tomlformatter.toml.TomlFormatterEngine;
import com.tomlformatter.util.DiffRenderer;
import com.tomlformatter.util.ErrorFormatter;
import com.tomlformatter.util.LoggerUtil;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Command Line Interface for the TOML formatter.
 */
public class FormatterCli {
    private static final Logger logger = LoggerUtil.getLogger(FormatterCli.class);
    private static final String VERSION = "1.0.0";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final PrintStream out;
    private ErrorFormatter errorFormatter = new ErrorFormatter(false);

    public FormatterCli(PrintStream out) {
        this.out = out;
    }

    public static void main(String[] args) {
        int status;
        try {
            status = new FormatterCli(System.out).run(args);
        } finally {
            LoggerUtil.shutdown();
        }
        System.exit(status);
    }

    /**
     * Runs one command and returns the process exit status.
     */
    public int run(String[] args) {
        errorFormatter = new ErrorFormatter(!_hasOption(args, "--no-color"));
        if (args.length < 1) {
            _printUsage();
            return EXIT_FAILURE;
        }

        String logFile = _getOptionValue(args, "--log-file");
        if (logFile != null) {
            LoggerUtil.setLogFilePath(Paths.get(logFile));
        }

        try {
            String command = args[0];

            switch (command) {
                case "check":
                    return _checkFiles(args);
                case "configs":
                    return _printConfigs(args);
                case "init":
                    return _initializeConfig(args);
                case "--version":
                case "-v":
                    _printVersion();
                    return EXIT_OK;
                case "--help":
                case "-h":
                    _printUsage();
                    return EXIT_OK;
                default:
                    _printError("Unknown command: " + command);
                    _printUsage();
                    return EXIT_FAILURE;
            }
        } catch (Exception e) {
            _printError("Error: " + e.getMessage());
            logger.log(Level.SEVERE, "Unhandled exception", e);

            if (_hasOption(args, "--verbose")) {
                e.printStackTrace(out);
            } else {
                _printInfo("Use --verbose for stack trace");
            }
            return EXIT_FAILURE;
        }
    }

    private void _printVersion() {
        out.println("TOML Formatter version " + VERSION);
    }

    private void _printUsage() {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BOLD, "TOML Formatter CLI v" + VERSION));
        out.println("Usage:");
        out.println("  tomlformatter check <path>...       - Check TOML files and show the changes formatting makes");
        out.println("  tomlformatter configs               - Show the effective configuration");
        out.println("  tomlformatter init [--force]        - Initialize configuration file");
        out.println("  tomlformatter --help|-h             - Show this help");
        out.println("  tomlformatter --version|-v          - Show version information");
        out.println();
        out.println("Options:");
        out.println("  --fix-inplace                       - Write the formatted text back to the files");
        out.println("  --show-formatted                    - Print the formatted text of changed files");
        out.println("  --include-hidden                    - Also check hidden files and directories");
        out.println("  --config=<file>                     - Use specific config file (default: "
                + ConfigurationLoader.DEFAULT_CONFIG_FILE + " or " + ConfigurationLoader.PYPROJECT_FILE + ")");
        out.println("  --verbose                           - Show detailed output");
        out.println("  --no-color                          - Disable colored output");
        out.println("  --threads=<num>                     - Number of threads to use (default: available processors)");
        out.println("  --log-file=<file>                   - Write the log to this file");
        out.println("  --force                             - Force overwrite (with init command)");
    }

    private int _checkFiles(String[] args) throws IOException {
        List<String> targets = _positionalArguments(args);
        if (targets.isEmpty()) {
            _printError("Error: Missing path argument");
            _printUsage();
            return EXIT_FAILURE;
        }

        boolean verbose = _hasOption(args, "--verbose");
        boolean fixInplace = _hasOption(args, "--fix-inplace");
        boolean showFormatted = _hasOption(args, "--show-formatted");
        boolean includeHidden = _hasOption(args, "--include-hidden");
        int threads = _threadCount(args);

        FormatterConfig config = _loadConfig(args);

        List<Path> filesToCheck = new ArrayList<>();
        for (String target : targets) {
            Path path = Paths.get(target);
            if (!Files.exists(path)) {
                _printError("Error: Path does not exist: " + target);
                return EXIT_FAILURE;
            }
            filesToCheck.addAll(_findFiles(path, config.getExcludePatterns(), includeHidden));
        }
        _printInfo("Found " + filesToCheck.size() + " files to check");

        Instant start = Instant.now();
        Map<Path, FormatterResult> results;
        try (TomlDocumentFormatter formatter = new TomlDocumentFormatter(config)) {
            results = formatter.formatFiles(filesToCheck, threads);
        }

        DiffRenderer diffRenderer = new DiffRenderer(errorFormatter);
        Map<Path, List<FormatterError>> errorsByFile = new LinkedHashMap<>();
        int changedCount = 0;

        for (Path file : filesToCheck) {
            FormatterResult result = results.get(file);
            if (result == null) {
                _printError("No result for file: " + file);
                errorsByFile.put(file, List.of());
                continue;
            }

            if (!result.isSuccessful()) {
                _printError("Failed to format: " + file);
                result.getErrors().forEach(e -> _printError("  " + errorFormatter.formatError(e)));
                errorsByFile.put(file, result.getErrors());
                continue;
            }

            if (!result.isChanged()) {
                if (verbose) {
                    _printSuccess("  OK: " + file);
                }
                continue;
            }

            changedCount++;
            _printWarning("File needs formatting: " + file);
            out.print(diffRenderer.render(file.toString().replace('\\', '/'),
                    result.getOriginalContent(), result.getFormattedContent()));
            if (showFormatted) {
                out.print(result.getFormattedContent());
            }
            if (fixInplace) {
                Files.writeString(file, result.getFormattedContent(), StandardCharsets.UTF_8);
                _printSuccess("Formatted: " + file);
            }
        }

        Duration duration = Duration.between(start, Instant.now());

        out.println("\nCheck complete in " + _formatDuration(duration) + ":");
        out.println("  Checked files: " + filesToCheck.size());
        out.println("  Files " + (fixInplace ? "reformatted" : "needing formatting") + ": " + changedCount);
        out.println("  Files with processing errors: " + errorsByFile.size());

        if (!errorsByFile.isEmpty()) {
            out.println("\n" + errorFormatter.formatErrorSummary(errorsByFile));
        }

        boolean pendingChanges = changedCount > 0 && !fixInplace;
        return pendingChanges || !errorsByFile.isEmpty() ? EXIT_FAILURE : EXIT_OK;
    }

    /**
     * Prints the effective configuration as a {@code [tool.toml-formatter]} table,
     * formatted with that same configuration.
     */
    private int _printConfigs(String[] args) {
        FormatterConfig config = _loadConfig(args);
        out.print(TomlFormatterEngine.format(config.toToml(), config.toOptions()));
        return EXIT_OK;
    }

    private int _initializeConfig(String[] args) throws IOException {
        String configFile = _getOptionValue(args, "--config");
        Path configPath = Paths.get(configFile != null ? configFile : ConfigurationLoader.DEFAULT_CONFIG_FILE);
        boolean force = _hasOption(args, "--force");

        if (Files.exists(configPath) && !force) {
            _printWarning("Configuration file already exists: " + configPath);
            out.println("Use --force to overwrite it or specify a different path with --config");
            return EXIT_FAILURE;
        }

        FormatterConfig config = ConfigurationLoader.loadDefaultConfig();
        ConfigurationLoader.saveConfig(config, configPath);
        _printSuccess("Created configuration file: " + configPath);
        return EXIT_OK;
    }

    /**
     * Loads the configuration and applies its log level, unless {@code --verbose} asks for more.
     */
    private FormatterConfig _loadConfig(String[] args) {
        String configFile = _getOptionValue(args, "--config");
        Path configPath = configFile != null
                ? Paths.get(configFile)
                : ConfigurationLoader.findConfig(Paths.get("").toAbsolutePath());
        FormatterConfig config = ConfigurationLoader.loadConfig(configPath);

        if (_hasOption(args, "--verbose")) {
            LoggerUtil.setConsoleLevel(Level.FINE);
        } else {
            LoggerUtil.setConsoleLevel(LoggerUtil.toLevel(config.getLogLevel()));
        }
        return config;
    }

    private List<Path> _findFiles(Path path, List<String> excludePatterns, boolean includeHidden) throws IOException {
        try {
            return TomlDocumentFormatter.findTomlFiles(path, excludePatterns, includeHidden);
        } catch (IOException e) {
            _printError("Error scanning directory: " + e.getMessage());
            throw e;
        }
    }

    private int _threadCount(String[] args) {
        String threadsStr = _getOptionValue(args, "--threads");
        int threads = Runtime.getRuntime().availableProcessors();
        if (threadsStr != null) {
            try {
                threads = Integer.parseInt(threadsStr);
            } catch (NumberFormatException e) {
                _printWarning("Invalid thread count: " + threadsStr + ", using default");
            }
        }
        return Math.max(1, threads);
    }

    private static List<String> _positionalArguments(String[] args) {
        return Arrays.stream(args)
                .skip(1)
                .filter(arg -> !arg.startsWith("--"))
                .collect(Collectors.toList());
    }

    private static boolean _hasOption(String[] args, String option) {
        return Arrays.asList(args).contains(option);
    }

    private static String _getOptionValue(String[] args, String option) {
        String prefix = option + "=";
        return Arrays.stream(args)
                .filter(arg -> arg.startsWith(prefix))
                .map(arg -> arg.substring(prefix.length()))
                .findFirst()
                .orElse(null);
    }

    private static String _formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        long millis = duration.toMillis() % 1000;
        if (seconds < 60) {
            return String.format("%d.%03d seconds", seconds, millis);
        } else {
            long minutes = seconds / 60;
            seconds = seconds % 60;
            return String.format("%d min %d sec", minutes, seconds);
        }
    }

    private void _printSuccess(String message) {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_GREEN, message));
    }

    private void _printError(String message) {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_RED, message));
    }

    private void _printWarning(String message) {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_YELLOW, message));
    }

    private void _printInfo(String message) {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BLUE, message));
    }
}
