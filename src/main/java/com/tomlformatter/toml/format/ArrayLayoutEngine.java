package com.tomlformatter.toml.format;

import com.tomlformatter.toml.FormatterOptions;
import com.tomlformatter.toml.UnsupportedConstructException;
import com.tomlformatter.toml.model.ArrayElement;
import com.tomlformatter.toml.model.ArrayValue;
import com.tomlformatter.toml.model.Entry;

/**
 * Decides between the inline and the multiline rendering of array-valued entries.
 *
 * <p>An array written over several lines stays multiline. A single-line array stays
 * inline unless its full line (indentation, key, value and trailing comment) is longer
 * than the configured line length. Multiline arrays put one element per line, one level
 * deeper than the key, each followed by a comma; the closing bracket lines up with
 * the key.
 */
public class ArrayLayoutEngine {
    private final int lineLength;
    private final EntryMutator mutator;

    public ArrayLayoutEngine(FormatterOptions options, EntryMutator mutator) {
        this.lineLength = options.getLineLength();
        this.mutator = mutator;
    }

    /**
     * Lays out the array value of {@code entry}, whose key sits at {@code level}.
     *
     * @throws UnsupportedConstructException if an element nests a value carrying comments
     */
    public void layout(Entry entry, int level) {
        ArrayValue array = (ArrayValue) entry.getValue();
        for (ArrayElement element : array.getElements()) {
            if (element.getValue().containsComments()) {
                throw new UnsupportedConstructException(
                        "comments inside a value nested in array '" + entry.getKey().render()
                                + "' have no defined layout", array.getLine());
            }
        }

        if (!array.containsLineBreak()) {
            String inline = array.renderInline();
            entry.setValueText(inline);
            if (_fits(entry.render())) {
                return;
            }
        }
        entry.setValueText(renderMultiline(array, level));
    }

    String renderMultiline(ArrayValue array, int level) {
        String elementIndent = mutator.indentString(level + 1);
        StringBuilder sb = new StringBuilder("[");
        if (array.getOpeningComment() != null) {
            sb.append(' ').append(array.getOpeningComment());
        }
        sb.append('\n');

        for (ArrayElement element : array.getElements()) {
            for (String comment : element.getLeadingComments()) {
                sb.append(elementIndent).append(comment).append('\n');
            }
            sb.append(elementIndent).append(element.getValue().renderInline()).append(',');
            if (element.getTrailingComment() != null) {
                sb.append(' ').append(element.getTrailingComment());
            }
            sb.append('\n');
        }
        for (String comment : array.getClosingComments()) {
            sb.append(elementIndent).append(comment).append('\n');
        }

        sb.append(mutator.indentString(level)).append(']');
        return sb.toString();
    }

    private boolean _fits(String rendered) {
        for (String line : rendered.split("\n", -1)) {
            String trimmed = line.stripTrailing();
            if (trimmed.codePointCount(0, trimmed.length()) > lineLength) {
                return false;
            }
        }
        return true;
    }
}
