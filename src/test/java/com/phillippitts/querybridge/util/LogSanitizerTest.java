package com.phillippitts.querybridge.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void truncateHandlesNullAndNonPositiveMax() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.truncate("hello", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("hello", -1)).isEmpty();
    }

    @Test
    void truncateKeepsShortStrings() {
        assertThat(LogSanitizer.truncate("hello", 5)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("hello world", 5)).isEqualTo("hello");
    }

    @Test
    void previewFlattensLineBreaks() {
        assertThat(LogSanitizer.preview("line one\r\nline two", 100)).isEqualTo("line one  line two");
        assertThat(LogSanitizer.preview("a\nbcdef", 3)).isEqualTo("a b");
    }
}
