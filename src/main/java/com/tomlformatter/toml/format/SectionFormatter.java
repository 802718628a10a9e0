package com.tomlformatter.toml.format;

import com.tomlformatter.toml.FormatterOptions;
import com.tomlformatter.toml.UnsupportedConstructException;
import com.tomlformatter.toml.model.ArrayValue;
import com.tomlformatter.toml.model.Entry;
import com.tomlformatter.toml.model.EntryKind;
import com.tomlformatter.toml.model.Section;
import com.tomlformatter.util.LoggerUtil;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * Formats one section in place: blank lines, key order and indentation.
 */
public class SectionFormatter {
    private static final Logger logger = LoggerUtil.getLogger(SectionFormatter.class);

    static final Comparator<Entry> BY_KEY =
            Comparator.comparing(entry -> entry.getKey().sortKey().toLowerCase(Locale.ROOT));

    private final EntryMutator mutator;
    private final ArrayLayoutEngine layoutEngine;

    public SectionFormatter(FormatterOptions options) {
        this.mutator = new EntryMutator(options.getIndentation());
        this.layoutEngine = new ArrayLayoutEngine(options, mutator);
    }

    /**
     * Formats {@code section}. Comment-only sections get blank-line normalization only,
     * so their comments keep the indentation their authors gave them.
     *
     * @throws UnsupportedConstructException naming the section if a value cannot be laid out
     */
    public void format(Section section) {
        List<Entry> entries = removeConsecutiveBlanks(section.getEntries());
        entries = trimBlanks(entries);
        if (section.isCommentOnly()) {
            section.setEntries(entries);
            return;
        }

        section.setEntries(sortKeys(entries));
        try {
            _indent(section.getEntries());
        } catch (UnsupportedConstructException e) {
            throw e.inSection(section.getName());
        }
        logger.fine("Formatted section [" + section.getName() + "] with " + section.getEntries().size() + " entries");
    }

    static List<Entry> removeConsecutiveBlanks(List<Entry> entries) {
        List<Entry> result = new ArrayList<>();
        for (Entry entry : entries) {
            boolean previousBlank = !result.isEmpty() && result.get(result.size() - 1).getKind() == EntryKind.BLANK;
            if (entry.getKind() == EntryKind.BLANK && previousBlank) {
                continue;
            }
            result.add(entry);
        }
        return result;
    }

    /**
     * Drops leading and trailing blanks and ends the section with exactly one blank.
     */
    static List<Entry> trimBlanks(List<Entry> entries) {
        int first = 0;
        int last = entries.size() - 1;
        while (first <= last && entries.get(first).getKind() == EntryKind.BLANK) {
            first++;
        }
        while (last >= first && entries.get(last).getKind() == EntryKind.BLANK) {
            last--;
        }
        List<Entry> result = new ArrayList<>(entries.subList(first, last + 1));
        int line = result.isEmpty() ? 0 : result.get(result.size() - 1).getLine() + 1;
        result.add(Entry.blank(line));
        return result;
    }

    /**
     * Sorts each run of consecutive key/value entries. Comments, blank lines and
     * headers end a run and keep their position.
     */
    static List<Entry> sortKeys(List<Entry> entries) {
        List<Entry> result = new ArrayList<>();
        List<Entry> block = new ArrayList<>();
        for (Entry entry : entries) {
            if (entry.getKind() == EntryKind.KEY_VALUE) {
                block.add(entry);
                continue;
            }
            _flush(block, result);
            result.add(entry);
        }
        _flush(block, result);
        return result;
    }

    private static void _flush(List<Entry> block, List<Entry> result) {
        block.sort(BY_KEY);
        result.addAll(block);
        block.clear();
    }

    private void _indent(List<Entry> entries) {
        int level = 0;
        for (Entry entry : entries) {
            level = _indentEntry(entry, level);
        }
    }

    /**
     * Formats one entry at {@code level} and returns the level for the entries after it.
     */
    private int _indentEntry(Entry entry, int level) {
        if (entry.getKind() == EntryKind.BLANK) {
            return level;
        }
        mutator.indent(entry, level);
        mutator.normalizeTrailingComment(entry);
        if (entry.getValue() instanceof ArrayValue) {
            layoutEngine.layout(entry, level);
        } else if (entry.getValue() != null) {
            entry.setValueText(entry.getValue().renderInline());
        }
        return entry.getKind().isHeader() ? level + 1 : level;
    }
}
