package com.tomlformatter.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.tomlformatter.api.error.FormatterError;

/**
 * Result of formatting one document.
 */
public class FormatterResult {
    private final boolean successful;
    private final String originalContent;
    private final String formattedContent;
    private final List<FormatterError> errors;

    private FormatterResult(Builder builder) {
        this.successful = builder.successful;
        this.originalContent = builder.originalContent;
        this.formattedContent = builder.formattedContent;
        this.errors = Collections.unmodifiableList(new ArrayList<>(builder.errors));
    }

    public boolean isSuccessful() {
        return successful;
    }

    public String getOriginalContent() {
        return originalContent;
    }

    /**
     * The formatted text; for a failed result the original text (or null if it could not be read).
     */
    public String getFormattedContent() {
        return formattedContent;
    }

    public List<FormatterError> getErrors() {
        return errors;
    }

    /**
     * Whether formatting produced text different from the input.
     */
    public boolean isChanged() {
        return successful && !Objects.equals(originalContent, formattedContent);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean successful;
        private String originalContent;
        private String formattedContent;
        private final List<FormatterError> errors = new ArrayList<>();

        public Builder successful(boolean successful) {
            this.successful = successful;
            return this;
        }

        public Builder originalContent(String originalContent) {
            this.originalContent = originalContent;
            return this;
        }

        public Builder formattedContent(String formattedContent) {
            this.formattedContent = formattedContent;
            return this;
        }

        public Builder addError(FormatterError error) {
            this.errors.add(error);
            return this;
        }

        public FormatterResult build() {
            return new FormatterResult(this);
        }
    }
}
