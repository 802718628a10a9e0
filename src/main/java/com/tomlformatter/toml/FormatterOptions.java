package com.tomlformatter.toml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Immutable snapshot of the options that drive one formatting run.
 */
public final class FormatterOptions {
    public static final int DEFAULT_LINE_LENGTH = 90;
    public static final int DEFAULT_INDENTATION = 2;

    private final int lineLength;
    private final int indentation;
    private final List<String> sectionOrderOverrides;
    private final List<Pattern> overridePatterns;

    private FormatterOptions(Builder builder) {
        if (builder.lineLength <= 0) {
            throw new IllegalArgumentException("line length must be positive, got " + builder.lineLength);
        }
        if (builder.indentation < 0) {
            throw new IllegalArgumentException("indentation must not be negative, got " + builder.indentation);
        }
        this.lineLength = builder.lineLength;
        this.indentation = builder.indentation;
        this.sectionOrderOverrides = Collections.unmodifiableList(new ArrayList<>(builder.sectionOrderOverrides));

        List<Pattern> patterns = new ArrayList<>();
        for (String regex : sectionOrderOverrides) {
            // PatternSyntaxException is an IllegalArgumentException
            patterns.add(Pattern.compile(regex));
        }
        this.overridePatterns = Collections.unmodifiableList(patterns);
    }

    public static FormatterOptions defaults() {
        return builder().build();
    }

    public int getLineLength() {
        return lineLength;
    }

    public int getIndentation() {
        return indentation;
    }

    public List<String> getSectionOrderOverrides() {
        return sectionOrderOverrides;
    }

    /**
     * Compiled form of {@link #getSectionOrderOverrides()}, in the same order.
     */
    public List<Pattern> getOverridePatterns() {
        return overridePatterns;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "FormatterOptions{lineLength=" + lineLength
                + ", indentation=" + indentation
                + ", sectionOrderOverrides=" + sectionOrderOverrides + "}";
    }

    public static class Builder {
        private int lineLength = DEFAULT_LINE_LENGTH;
        private int indentation = DEFAULT_INDENTATION;
        private List<String> sectionOrderOverrides = new ArrayList<>();

        public Builder lineLength(int lineLength) {
            this.lineLength = lineLength;
            return this;
        }

        public Builder indentation(int indentation) {
            this.indentation = indentation;
            return this;
        }

        public Builder sectionOrderOverrides(List<String> overrides) {
            this.sectionOrderOverrides = new ArrayList<>(overrides);
            return this;
        }

        public Builder addSectionOrderOverride(String regex) {
            this.sectionOrderOverrides.add(regex);
            return this;
        }

        public FormatterOptions build() {
            return new FormatterOptions(this);
        }
    }
}
