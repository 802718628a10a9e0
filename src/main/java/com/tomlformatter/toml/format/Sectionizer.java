package com.tomlformatter.toml.format;

import com.tomlformatter.toml.model.Entry;
import com.tomlformatter.toml.model.EntryKind;
import com.tomlformatter.toml.model.Section;
import com.tomlformatter.util.LoggerUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Groups the flat entry sequence into sections at structural headers.
 */
public class Sectionizer {
    private static final Logger logger = LoggerUtil.getLogger(Sectionizer.class);

    /**
     * Splits entries into sections.
     * <ul>
     *   <li>A section starts at every {@code [table]} and {@code [[array]]} header.</li>
     *   <li>Comment lines directly above a header (no blank line in between) move
     *       into the header's section.</li>
     *   <li>The trailing run of comments and blank lines of every section becomes a
     *       comment-only section of its own; runs of blank lines alone are dropped.</li>
     * </ul>
     */
    public List<Section> split(List<Entry> entries) {
        List<List<Entry>> groups = new ArrayList<>();
        List<Entry> current = new ArrayList<>();

        for (Entry entry : entries) {
            if (!entry.getKind().isHeader()) {
                current.add(entry);
                continue;
            }
            int attachedFrom = current.size();
            while (attachedFrom > 0 && current.get(attachedFrom - 1).getKind() == EntryKind.COMMENT) {
                attachedFrom--;
            }
            List<Entry> next = new ArrayList<>(current.subList(attachedFrom, current.size()));
            List<Entry> previous = new ArrayList<>(current.subList(0, attachedFrom));
            if (!previous.isEmpty()) {
                groups.add(previous);
            }
            next.add(entry);
            current = next;
        }
        if (!current.isEmpty()) {
            groups.add(current);
        }

        List<Section> sections = new ArrayList<>();
        for (List<Entry> group : groups) {
            int contentEnd = group.size();
            while (contentEnd > 0 && group.get(contentEnd - 1).getKind().isTrivia()) {
                contentEnd--;
            }
            _addUnlessBlank(sections, group.subList(0, contentEnd));
            _addUnlessBlank(sections, group.subList(contentEnd, group.size()));
        }

        logger.fine("Split " + entries.size() + " entries into " + sections.size() + " sections");
        return sections;
    }

    private static void _addUnlessBlank(List<Section> sections, List<Entry> entries) {
        boolean allBlank = entries.stream().allMatch(entry -> entry.getKind() == EntryKind.BLANK);
        if (!allBlank) {
            sections.add(new Section(entries));
        }
    }
}
