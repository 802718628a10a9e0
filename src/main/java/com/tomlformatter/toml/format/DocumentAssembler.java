package com.tomlformatter.toml.format;

import com.tomlformatter.toml.model.Document;
import com.tomlformatter.toml.model.Section;
import com.tomlformatter.util.LoggerUtil;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Orders the sections of a document and serializes it.
 *
 * <p>Order: the top-level section first, then the sections matched by each override
 * pattern in pattern order, then the remaining sections sorted by name within the
 * blocks delimited by comment-only sections. Override patterns are anchored at the
 * start of the section name only ({@link java.util.regex.Matcher#lookingAt()}).
 *
 * <p>Sub-tables of an array-of-tables element ({@code [fruit.physical]} after
 * {@code [[fruit]]}) move together with that element, since they belong to it.
 */
public class DocumentAssembler {
    private static final Logger logger = LoggerUtil.getLogger(DocumentAssembler.class);

    private static final Comparator<Unit> BY_NAME =
            Comparator.comparing(unit -> unit.name().strip().toLowerCase(Locale.ROOT));

    /**
     * Reorders the document's sections and returns its text.
     */
    public String assemble(Document document) {
        List<Section> ordered = order(document.getSections(), document.getOptions().getOverridePatterns());
        document.reorder(ordered);
        return document.render();
    }

    public List<Section> order(List<Section> sections, List<Pattern> overrides) {
        List<Unit> remaining = _group(sections);
        List<Unit> ordered = new ArrayList<>();

        for (Unit unit : remaining) {
            if (unit.lead().isTopLevel()) {
                ordered.add(unit);
                remaining.remove(unit);
                break;
            }
        }

        for (Pattern pattern : overrides) {
            List<Unit> matched = remaining.stream()
                    .filter(unit -> !unit.isSeparator())
                    .filter(unit -> pattern.matcher(unit.name()).lookingAt())
                    .sorted(BY_NAME)
                    .collect(Collectors.toList());
            if (!matched.isEmpty()) {
                logger.fine("Override '" + pattern.pattern() + "' placed " + matched.size() + " sections");
            }
            remaining.removeAll(matched);
            ordered.addAll(matched);
        }

        List<Unit> block = new ArrayList<>();
        for (Unit unit : remaining) {
            if (unit.isSeparator()) {
                block.sort(BY_NAME);
                ordered.addAll(block);
                block.clear();
                ordered.add(unit);
            } else {
                block.add(unit);
            }
        }
        block.sort(BY_NAME);
        ordered.addAll(block);

        List<Section> result = new ArrayList<>();
        ordered.forEach(unit -> result.addAll(unit.sections));
        return result;
    }

    /**
     * Builds ordering units in source order. A section whose path extends the path of
     * an earlier array-of-tables section joins the unit of the latest such element;
     * comment-only sections directly between the two join it as well.
     */
    private static List<Unit> _group(List<Section> sections) {
        List<Unit> units = new ArrayList<>();
        Map<List<String>, Unit> latestElements = new HashMap<>();
        List<Section> pendingSeparators = new ArrayList<>();
        Unit previous = null;

        for (Section section : sections) {
            if (section.isCommentOnly()) {
                pendingSeparators.add(section);
                continue;
            }
            Unit owner = _findOwner(section.getPath(), latestElements);
            if (owner != null && owner == previous) {
                owner.sections.addAll(pendingSeparators);
                pendingSeparators.clear();
            }
            pendingSeparators.forEach(separator -> units.add(new Unit(separator)));
            pendingSeparators.clear();

            if (owner != null) {
                owner.sections.add(section);
                if (section.isArrayOfTables()) {
                    latestElements.put(section.getPath(), owner);
                }
                previous = owner;
                continue;
            }

            Unit unit = new Unit(section);
            units.add(unit);
            if (section.isArrayOfTables()) {
                latestElements.put(section.getPath(), unit);
            }
            previous = unit;
        }
        pendingSeparators.forEach(separator -> units.add(new Unit(separator)));
        return units;
    }

    /**
     * The unit of the array-of-tables element with the longest path that is a strict
     * prefix of {@code path}, or null.
     */
    private static Unit _findOwner(List<String> path, Map<List<String>, Unit> latestElements) {
        for (int length = path.size() - 1; length > 0; length--) {
            Unit owner = latestElements.get(path.subList(0, length));
            if (owner != null) {
                return owner;
            }
        }
        return null;
    }

    private static final class Unit {
        private final List<Section> sections = new ArrayList<>();

        Unit(Section lead) {
            sections.add(lead);
        }

        Section lead() {
            return sections.get(0);
        }

        String name() {
            return lead().getName();
        }

        boolean isSeparator() {
            return lead().isCommentOnly();
        }
    }
}
