package com.phillippitts.multishot.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void truncateHandlesNullAndLimits() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.truncate("hello", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("hello", 10)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("hello world", 5)).isEqualTo("hello");
    }

    @Test
    void previewCollapsesWhitespaceAndMarksCut() {
        assertThat(LogSanitizer.preview("  line one\n\n  line\ttwo ", 100)).isEqualTo("line one line two");
        assertThat(LogSanitizer.preview("abcdefghij", 4)).isEqualTo("abcd...");
        assertThat(LogSanitizer.preview(null, 4)).isEmpty();
    }
}
