package com.tomlformatter.toml.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tomlformatter.toml.FormatterOptions;
import java.util.List;
import org.junit.jupiter.api.Test;

class DocumentTest {

    private static Section commentSection(String text) {
        return new Section(List.of(Entry.comment(text, "", 1), Entry.blank(2)));
    }

    @Test
    void reorderAcceptsPermutations() {
        Section first = commentSection("# one");
        Section second = commentSection("# two");
        Document document = new Document(List.of(first, second), FormatterOptions.defaults());

        document.reorder(List.of(second, first));

        assertThat(document.getSections()).containsExactly(second, first);
        assertThat(document.render()).isEqualTo("# two\n\n# one\n");
    }

    @Test
    void reorderRejectsForeignOrMissingSections() {
        Section first = commentSection("# one");
        Document document = new Document(List.of(first), FormatterOptions.defaults());

        assertThatThrownBy(() -> document.reorder(List.of(commentSection("# other"))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> document.reorder(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void emptyDocumentRendersEmpty() {
        assertThat(new Document(List.of(), FormatterOptions.defaults()).render()).isEmpty();
    }
}
