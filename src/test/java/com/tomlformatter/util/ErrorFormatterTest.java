package com.tomlformatter.util;

import static org.assertj.core.api.Assertions.assertThat;

import com.tomlformatter.api.error.FormatterError;
import com.tomlformatter.api.error.Severity;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ErrorFormatterTest {

    private final ErrorFormatter formatter = new ErrorFormatter(false);

    @Test
    void formatsErrorWithPositionAndSuggestion() {
        FormatterError error = new FormatterError(Severity.FATAL, "unexpected '='", 3, 7, "Fix the syntax");

        assertThat(formatter.formatError(error))
                .isEqualTo("FATAL: unexpected '=' (line 3, column 7)\n  Suggestion: Fix the syntax");
    }

    @Test
    void omitsUnknownPosition() {
        assertThat(formatter.formatError(new FormatterError(Severity.WARNING, "odd", 0, 0)))
                .isEqualTo("WARNING: odd");
    }

    @Test
    void summarizesErrorsPerFile() {
        Map<Path, List<FormatterError>> errors = new LinkedHashMap<>();
        errors.put(Path.of("a.toml"), List.of(new FormatterError(Severity.FATAL, "x", 1, 1)));
        errors.put(Path.of("b.toml"), List.of(
                new FormatterError(Severity.ERROR, "y", 1, 1),
                new FormatterError(Severity.WARNING, "z", 2, 1)));

        String summary = formatter.formatErrorSummary(errors);

        assertThat(summary).contains("a.toml: 1 fatal\n", "b.toml: 1 errors, 1 warnings\n",
                "Total: 1 fatal, 1 errors, 1 warnings");
    }
}
