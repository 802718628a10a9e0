package com.tomlformatter.toml.format;

import com.tomlformatter.toml.model.Entry;
import com.tomlformatter.toml.model.EntryKind;

/**
 * Rewrites the cosmetic parts of a single entry in place.
 */
public class EntryMutator {
    private final int indentation;

    public EntryMutator(int indentation) {
        this.indentation = indentation;
    }

    /**
     * Sets the leading whitespace to {@code level * indentation} spaces.
     * Blank entries stay empty.
     */
    public void indent(Entry entry, int level) {
        if (entry.getKind() == EntryKind.BLANK) {
            return;
        }
        entry.setLeadingWhitespace(indentString(level));
    }

    /**
     * Normalizes a trailing comment to {@code # text}. A comment whose text starts with
     * a second {@code #} is kept as written. Comment entries are left untouched.
     */
    public void normalizeTrailingComment(Entry entry) {
        if (entry.getKind().isTrivia() || entry.getComment() == null) {
            return;
        }
        entry.setComment(normalizeComment(entry.getComment()));
    }

    static String normalizeComment(String comment) {
        String text = comment.substring(1);
        if (text.startsWith("#")) {
            return comment;
        }
        text = text.strip();
        return text.isEmpty() ? "#" : "# " + text;
    }

    public String indentString(int level) {
        return " ".repeat(level * indentation);
    }
}
