package com.phillippitts.enginecoordinator.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void truncateHandlesNullAndLimits() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.truncate("abc", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("abcdef", 3)).isEqualTo("abc");
        assertThat(LogSanitizer.truncate("ab", 3)).isEqualTo("ab");
    }

    @Test
    void previewFlattensWhitespace() {
        assertThat(LogSanitizer.preview("line one\n\tline two  ")).isEqualTo("line one line two");
        assertThat(LogSanitizer.preview(null)).isEmpty();
    }

    @Test
    void previewCutsLongPromptsWithEllipsis() {
        String prompt = "x".repeat(200);

        String preview = LogSanitizer.preview(prompt);

        assertThat(preview).hasSize(83).endsWith("...");
    }
}
