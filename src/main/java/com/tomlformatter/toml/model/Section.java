package com.tomlformatter.toml.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A contiguous run of entries under one structural header, or the implicit top
 * level. A section made only of comments and blank lines is a separator.
 */
public final class Section {
    private final List<Entry> entries;

    public Section(List<Entry> entries) {
        this.entries = new ArrayList<>(entries);
    }

    public List<Entry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    /**
     * Replaces the entries after the formatter has normalized or reordered them.
     */
    public void setEntries(List<Entry> newEntries) {
        entries.clear();
        entries.addAll(newEntries);
    }

    /**
     * The rendered key of the section header, {@code ""} for the top level and for
     * comment-only sections.
     */
    public String getName() {
        Entry header = _getHeader();
        return header == null ? "" : header.getKey().render();
    }

    /**
     * Decoded key path of the header; empty for the top level.
     */
    public List<String> getPath() {
        Entry header = _getHeader();
        return header == null ? List.of() : header.getKey().path();
    }

    public boolean isCommentOnly() {
        return entries.stream().allMatch(entry -> entry.getKind().isTrivia());
    }

    public boolean isArrayOfTables() {
        Entry header = _getHeader();
        return header != null && header.getKind() == EntryKind.ARRAY_OF_TABLES_HEADER;
    }

    public boolean isTopLevel() {
        return !isCommentOnly() && _getHeader() == null;
    }

    private Entry _getHeader() {
        for (Entry entry : entries) {
            if (entry.getKind().isHeader()) {
                return entry;
            }
        }
        return null;
    }

    public String render() {
        return entries.stream().map(Entry::render).collect(Collectors.joining("\n"));
    }

    @Override
    public String toString() {
        return "Section[" + getName() + ", " + entries.size() + " entries" + (isCommentOnly() ? ", comment" : "") + "]";
    }
}
