package com.tomlformatter.toml.parser;

import com.tomlformatter.toml.MalformedDocumentException;
import com.tomlformatter.toml.model.Entry;
import com.tomlformatter.util.LoggerUtil;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * Turns raw lines into atomic entries. Lines are buffered until the buffer scans as
 * one complete entry, so an entry may span any number of physical lines
 * (multi-line arrays and strings).
 *
 * <pre>
 *   EMPTY/COMPLETE --line--> COMPLETE   buffer holds one whole entry, emitted
 *   EMPTY/COMPLETE --line--> BUFFERING  buffer ends inside an open construct
 *   BUFFERING      --line--> COMPLETE | BUFFERING | FAILED
 *   any            --line--> FAILED     syntax error, MalformedDocumentException
 * </pre>
 *
 * Instances are single-use and not thread-safe.
 */
public class EntryParser {
    private static final Logger logger = LoggerUtil.getLogger(EntryParser.class);

    public enum State {
        EMPTY,
        BUFFERING,
        COMPLETE,
        FAILED
    }

    private final List<Entry> entries = new ArrayList<>();
    private final StringBuilder buffer = new StringBuilder();
    private State state = State.EMPTY;
    private int lineNumber;
    private int bufferStartLine;

    /**
     * Parses a whole document into entries.
     *
     * @throws MalformedDocumentException if a line can never complete an entry
     */
    public static List<Entry> parse(String text) {
        EntryParser parser = new EntryParser();
        List<String> lines = splitLines(text);
        for (String line : lines) {
            parser.accept(line);
        }
        List<Entry> entries = parser.finish();
        logger.fine("Parsed " + entries.size() + " entries from " + lines.size() + " lines");
        return entries;
    }

    /**
     * Splits on line feeds, dropping a carriage return before each one. A trailing
     * line feed yields a final empty line.
     */
    static List<String> splitLines(String text) {
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\n", -1)) {
            lines.add(line.endsWith("\r") ? line.substring(0, line.length() - 1) : line);
        }
        return lines;
    }

    /**
     * Feeds the next physical line (without its line break).
     */
    public State accept(String line) {
        if (state == State.FAILED) {
            throw new IllegalStateException("Parser already failed at line " + bufferStartLine);
        }
        lineNumber++;
        if (buffer.length() == 0) {
            bufferStartLine = lineNumber;
        }
        buffer.append(line).append('\n');

        ScanResult result = FragmentScanner.scan(buffer.toString(), bufferStartLine);
        switch (result.getStatus()) {
            case COMPLETE:
                entries.add(result.getEntry());
                buffer.setLength(0);
                state = State.COMPLETE;
                break;
            case INCOMPLETE:
                state = State.BUFFERING;
                break;
            default:
                state = State.FAILED;
                throw new MalformedDocumentException(result.getMessage(), result.getLine(), result.getColumn());
        }
        return state;
    }

    /**
     * Ends the input and returns every entry in source order.
     *
     * @throws MalformedDocumentException if an entry is still open
     */
    public List<Entry> finish() {
        if (state == State.BUFFERING) {
            state = State.FAILED;
            throw new MalformedDocumentException("Truncated document: entry is never closed", bufferStartLine, 1);
        }
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public State getState() {
        return state;
    }
}
