package com.tomlformatter.core;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.tomlformatter.api.DocumentFormatter;
import com.tomlformatter.api.FormatterResult;
import com.tomlformatter.api.error.FormatterError;
import com.tomlformatter.api.error.Severity;
import com.tomlformatter.config.FormatterConfig;
import com.tomlformatter.toml.ContentMismatchException;
import com.tomlformatter.toml.MalformedDocumentException;
import com.tomlformatter.toml.TomlFormatException;
import com.tomlformatter.toml.TomlFormatterEngine;
import com.tomlformatter.toml.UnsupportedConstructException;
import com.tomlformatter.util.LoggerUtil;

/**
 * Thread-safe service that runs the formatting engine over files and directories.
 * Engine failures never escape: they become failed results carrying a FATAL error.
 */
public class TomlDocumentFormatter implements DocumentFormatter, AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(TomlDocumentFormatter.class);

    private final TomlFormatterEngine engine;
    private final List<String> excludePatterns;

    private final AtomicInteger processedFileCount = new AtomicInteger(0);
    private final AtomicInteger successCount = new AtomicInteger(0);
    private final AtomicInteger errorCount = new AtomicInteger(0);

    /**
     * Creates a new formatter with the provided configuration.
     */
    public TomlDocumentFormatter(FormatterConfig config) {
        this.engine = new TomlFormatterEngine(config.toOptions());
        this.excludePatterns = config.getExcludePatterns();
        logger.fine("TOML formatter initialized with " + engine.getOptions());
    }

    /**
     * Formats the content of a single file.
     */
    @Override
    public FormatterResult formatFile(Path filePath, String content) {
        processedFileCount.incrementAndGet();
        try {
            String formatted = engine.format(content);
            successCount.incrementAndGet();
            logger.fine((formatted.equals(content) ? "Already formatted: " : "Formatted: ") + filePath);

            return FormatterResult.builder()
                    .successful(true)
                    .originalContent(content)
                    .formattedContent(formatted)
                    .build();
        } catch (TomlFormatException e) {
            errorCount.incrementAndGet();
            logger.warning("Failed to format " + filePath + ": " + e.getMessage());
            return _failed(content, new FormatterError(
                    Severity.FATAL, e.getMessage(), e.getLine(), e.getColumn(), _suggestionFor(e)));
        } catch (Exception e) {
            errorCount.incrementAndGet();
            logger.log(Level.SEVERE, "Unexpected error formatting file: " + filePath, e);
            return _failed(content, new FormatterError(
                    Severity.FATAL, "Unexpected error: " + e.getMessage(), 0, 0));
        }
    }

    /**
     * Formats every TOML file of a directory on one thread per available processor.
     */
    @Override
    public Map<Path, FormatterResult> formatDirectory(Path directory) {
        return formatDirectory(directory, Runtime.getRuntime().availableProcessors());
    }

    /**
     * Formats a directory with a specified thread count. Hidden files and directories and
     * files matching the configured exclude globs are skipped.
     */
    public Map<Path, FormatterResult> formatDirectory(Path directory, int threadCount) {
        if (!Files.isDirectory(directory)) {
            logger.warning("Path is not a directory: " + directory);
            return new ConcurrentHashMap<>();
        }

        try {
            List<Path> filesToProcess = findTomlFiles(directory, excludePatterns, false);
            logger.info("Found " + filesToProcess.size() + " TOML files in " + directory);
            return formatFiles(filesToProcess, threadCount);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Error scanning directory: " + directory, e);
            return new ConcurrentHashMap<>();
        }
    }

    /**
     * Lists the TOML files under {@code path} in sorted order; a regular file is returned as is.
     * Exclude globs match the path relative to {@code path} or the bare file name.
     */
    public static List<Path> findTomlFiles(Path path, List<String> excludePatterns, boolean includeHidden)
            throws IOException {
        if (Files.isRegularFile(path)) {
            return List.of(path);
        }

        List<PathMatcher> excludes = excludePatterns.stream()
                .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern))
                .collect(Collectors.toList());

        try (Stream<Path> paths = Files.walk(path)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(TomlDocumentFormatter::isTomlFile)
                    .filter(p -> includeHidden || !_isHidden(path.relativize(p)))
                    .filter(p -> !_isExcluded(path.relativize(p), excludes))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private static boolean _isHidden(Path relativePath) {
        for (Path part : relativePath) {
            if (part.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }

    private static boolean _isExcluded(Path relativePath, List<PathMatcher> excludes) {
        for (PathMatcher matcher : excludes) {
            if (matcher.matches(relativePath) || matcher.matches(relativePath.getFileName())) {
                logger.fine("Excluded: " + relativePath);
                return true;
            }
        }
        return false;
    }

    /**
     * Reads and formats the given files on a fixed thread pool. Files are not written back.
     */
    public Map<Path, FormatterResult> formatFiles(List<Path> files, int threadCount) {
        ConcurrentHashMap<Path, FormatterResult> results = new ConcurrentHashMap<>();
        if (files.isEmpty()) {
            return results;
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, threadCount));
        try {
            for (Path file : files) {
                executor.submit(() -> results.put(file, _readAndFormat(file)));
            }
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(30, TimeUnit.MINUTES)) {
                    logger.warning("Timeout waiting for file processing to complete");
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                logger.log(Level.WARNING, "Processing interrupted", e);
                Thread.currentThread().interrupt();
                executor.shutdownNow();
            }
        }

        logger.info("Processed " + results.size() + " files");
        return results;
    }

    private FormatterResult _readAndFormat(Path file) {
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            return formatFile(file, content);
        } catch (IOException e) {
            errorCount.incrementAndGet();
            logger.log(Level.WARNING, "Failed to read file: " + file, e);
            return _failed(null, new FormatterError(
                    Severity.FATAL, "Failed to read file: " + e.getMessage(), 0, 0));
        }
    }

    private static FormatterResult _failed(String content, FormatterError error) {
        return FormatterResult.builder()
                .successful(false)
                .originalContent(content)
                .formattedContent(content)
                .addError(error)
                .build();
    }

    private static String _suggestionFor(TomlFormatException e) {
        if (e instanceof MalformedDocumentException) {
            return "Fix the TOML syntax error before formatting";
        } else if (e instanceof UnsupportedConstructException) {
            return "Move comments out of nested arrays and inline tables";
        } else if (e instanceof ContentMismatchException) {
            return "Please report this document; the file was left unchanged";
        }
        return null;
    }

    public static boolean isTomlFile(Path path) {
        Path fileName = path.getFileName();
        return fileName != null && fileName.toString().endsWith(".toml");
    }

    /**
     * Gets the number of files processed.
     */
    public int getProcessedFileCount() {
        return processedFileCount.get();
    }

    /**
     * Gets the number of successfully formatted files.
     */
    public int getSuccessCount() {
        return successCount.get();
    }

    /**
     * Gets the number of files with formatting errors.
     */
    public int getErrorCount() {
        return errorCount.get();
    }

    @Override
    public void close() {
        logger.info("Closing formatter: processed=" + processedFileCount.get() +
                ", success=" + successCount.get() + ", errors=" + errorCount.get());
    }
}
