package com.tomlformatter.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class DiffRendererTest {

    private final DiffRenderer renderer = new DiffRenderer(new ErrorFormatter(false));

    @Test
    void rendersUnifiedDiffWithFileHeaders() {
        String diff = renderer.render("conf/app.toml", "x = 1\ny = 2\n", "x = 1\ny = 3\n");

        assertThat(diff).startsWith("--- a/conf/app.toml\n+++ b/conf/app.toml\n");
        assertThat(diff).contains("@@ -1,2 +1,2 @@\n", " x = 1\n", "-y = 2\n", "+y = 3\n");
    }

    @Test
    void rendersNothingForEqualTexts() {
        assertThat(renderer.render("a.toml", "a = 1\n", "a = 1\n")).isEmpty();
    }

    @Test
    void colorsAddedAndRemovedLines() {
        DiffRenderer colored = new DiffRenderer(new ErrorFormatter(true));

        String diff = colored.render("a.toml", "a = 1\n", "a = 2\n");

        assertThat(diff).contains(ErrorFormatter.ANSI_RED + "-a = 1" + ErrorFormatter.ANSI_RESET);
        assertThat(diff).contains(ErrorFormatter.ANSI_GREEN + "+a = 2" + ErrorFormatter.ANSI_RESET);
    }
}
