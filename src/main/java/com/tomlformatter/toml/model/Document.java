package com.tomlformatter.toml.model;

import com.tomlformatter.toml.FormatterOptions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Ordered sections of one TOML document plus the options it is formatted with.
 */
public final class Document {
    private final List<Section> sections;
    private final FormatterOptions options;

    public Document(List<Section> sections, FormatterOptions options) {
        this.sections = new ArrayList<>(sections);
        this.options = options;
    }

    public List<Section> getSections() {
        return Collections.unmodifiableList(sections);
    }

    public FormatterOptions getOptions() {
        return options;
    }

    /**
     * Puts the sections in a new order. The new order must be a permutation of the current one.
     */
    public void reorder(List<Section> newOrder) {
        Map<Section, Boolean> current = new IdentityHashMap<>();
        sections.forEach(section -> current.put(section, Boolean.TRUE));
        if (newOrder.size() != sections.size() || !newOrder.stream().allMatch(current::containsKey)) {
            throw new IllegalArgumentException("new section order is not a permutation of the document's sections");
        }
        sections.clear();
        sections.addAll(newOrder);
    }

    /**
     * Sections are separated by exactly one blank line: each section ends with its own
     * blank entry and sections are joined by a line break.
     */
    public String render() {
        return sections.stream().map(Section::render).collect(Collectors.joining("\n"));
    }
}
