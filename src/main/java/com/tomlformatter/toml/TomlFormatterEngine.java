package com.tomlformatter.toml;

import com.tomlformatter.toml.format.ContentVerifier;
import com.tomlformatter.toml.format.DocumentAssembler;
import com.tomlformatter.toml.format.SectionFormatter;
import com.tomlformatter.toml.format.Sectionizer;
import com.tomlformatter.toml.model.Document;
import com.tomlformatter.toml.model.Entry;
import com.tomlformatter.toml.model.Section;
import com.tomlformatter.toml.parser.EntryParser;
import com.tomlformatter.util.LoggerUtil;
import org.tomlj.TomlParseResult;

import java.util.List;
import java.util.logging.Logger;

/**
 * Formats TOML text into the canonical style.
 *
 * <p>The pipeline is: whole-document validation, entry parsing, sectioning, per-section
 * formatting, cross-section ordering and finally a data comparison between input and
 * output. The engine keeps no state between calls and may be shared across threads.
 */
public class TomlFormatterEngine {
    private static final Logger logger = LoggerUtil.getLogger(TomlFormatterEngine.class);

    private final FormatterOptions options;
    private final Sectionizer sectionizer = new Sectionizer();
    private final SectionFormatter sectionFormatter;
    private final DocumentAssembler assembler = new DocumentAssembler();
    private final ContentVerifier verifier = new ContentVerifier();

    public TomlFormatterEngine(FormatterOptions options) {
        this.options = options;
        this.sectionFormatter = new SectionFormatter(options);
    }

    public static String format(String raw, FormatterOptions options) {
        return new TomlFormatterEngine(options).format(raw);
    }

    /**
     * Formats {@code raw}.
     *
     * @throws MalformedDocumentException if {@code raw} is not valid TOML
     * @throws UnsupportedConstructException if a value has no defined layout
     * @throws ContentMismatchException if the result would not carry the input's data
     */
    public String format(String raw) {
        TomlParseResult original = ContentVerifier.parse(raw);

        List<Entry> entries = EntryParser.parse(raw);
        List<Section> sections = sectionizer.split(entries);
        Document document = new Document(sections, options);
        for (Section section : document.getSections()) {
            sectionFormatter.format(section);
        }
        String formatted = assembler.assemble(document);

        verifier.verify(original, formatted);
        logger.fine("Formatted document: " + sections.size() + " sections, "
                + raw.length() + " -> " + formatted.length() + " characters");
        return formatted;
    }

    public FormatterOptions getOptions() {
        return options;
    }
}
