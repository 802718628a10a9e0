package com.tomlformatter.toml.format;

import static org.assertj.core.api.Assertions.assertThat;

import com.tomlformatter.toml.FormatterOptions;
import com.tomlformatter.toml.model.Document;
import com.tomlformatter.toml.model.Section;
import com.tomlformatter.toml.parser.EntryParser;
import java.util.List;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;

class DocumentAssemblerTest {

    private final DocumentAssembler assembler = new DocumentAssembler();

    private List<Section> order(String text, String... overrides) {
        List<Section> sections = new Sectionizer().split(EntryParser.parse(text));
        List<Pattern> patterns = FormatterOptions.builder()
                .sectionOrderOverrides(List.of(overrides))
                .build()
                .getOverridePatterns();
        return assembler.order(sections, patterns);
    }

    @Test
    void putsTopLevelFirstAndSortsTablesIgnoringCase() {
        List<Section> ordered = order("top = 1\n[zoo]\n[Beta]\n[alpha]\n");

        assertThat(ordered).extracting(Section::getName).containsExactly("", "alpha", "Beta", "zoo");
    }

    @Test
    void placesOverrideMatchesRightAfterTopLevel() {
        String text = "top = 1\n[bar]\n[barfoo]\n[foobar]\n[foo]\n[alpha]\n";

        assertThat(order(text, "^foo")).extracting(Section::getName)
                .containsExactly("", "foo", "foobar", "alpha", "bar", "barfoo");
        assertThat(order(text, "foo")).extracting(Section::getName)
                .containsExactly("", "foo", "foobar", "alpha", "bar", "barfoo");
    }

    @Test
    void appliesOverridesInPatternOrder() {
        String text = "[a]\n[b]\n[c]\n";

        assertThat(order(text, "c", "b")).extracting(Section::getName).containsExactly("c", "b", "a");
    }

    @Test
    void neverSortsAcrossCommentSeparators() {
        List<Section> ordered = order("[d]\n[c]\n\n# manual order\n\n[b]\n[a]\n");

        assertThat(ordered).extracting(Section::getName).containsExactly("c", "d", "", "a", "b");
        assertThat(ordered.get(2).isCommentOnly()).isTrue();
    }

    @Test
    void keepsSubTablesWithTheirArrayElement() {
        String text = "[[fruit]]\nname = 'b'\n[fruit.physical]\ncolor = 'red'\n[[fruit]]\nname = 'a'\n[apple]\n";

        List<Section> ordered = order(text);

        assertThat(ordered).extracting(Section::getName)
                .containsExactly("apple", "fruit", "fruit.physical", "fruit");
        assertThat(ordered.get(1).render()).contains("'b'");
        assertThat(ordered.get(3).render()).contains("'a'");
    }

    @Test
    void keepsCommentsBetweenArrayElementAndSubTableInTheUnit() {
        String text = "[[bin]]\nname = 'x'\n\n# details\n\n[bin.opts]\nfast = true\n[alpha]\n";

        List<Section> ordered = order(text);

        assertThat(ordered).extracting(Section::getName).containsExactly("alpha", "bin", "", "bin.opts");
    }

    @Test
    void assemblesSectionsSeparatedByOneBlankLine() {
        FormatterOptions options = FormatterOptions.defaults();
        List<Section> sections = new Sectionizer().split(EntryParser.parse("[b]\nx = 1\n[a]\ny = 2\n"));
        SectionFormatter formatter = new SectionFormatter(options);
        sections.forEach(formatter::format);

        String text = assembler.assemble(new Document(sections, options));

        assertThat(text).isEqualTo("[a]\n  y = 2\n\n[b]\n  x = 1\n");
    }
}
