package com.phillippitts.tunemerge.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void shouldReturnEmptyStringForNull() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.queryPreview(null)).isEmpty();
    }

    @Test
    void shouldReturnEmptyStringForNonPositiveMax() {
        assertThat(LogSanitizer.truncate("hello world", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("hello world", -1)).isEmpty();
    }

    @Test
    void shouldTruncateWhenLongerThanMax() {
        assertThat(LogSanitizer.truncate("hello world", 5)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("hello", 5)).isEqualTo("hello");
    }

    @Test
    void shortQueryIsKeptAsIs() {
        assertThat(LogSanitizer.queryPreview("abbey road")).isEqualTo("abbey road");
    }

    @Test
    void longQueryIsCutWithEllipsis() {
        String preview = LogSanitizer.queryPreview("a".repeat(200));

        assertThat(preview).hasSize(LogSanitizer.QUERY_PREVIEW_MAX + 3);
        assertThat(preview).endsWith("...");
    }

    @Test
    void lineBreaksAreFlattened() {
        assertThat(LogSanitizer.queryPreview("abbey\r\nroad\tlive")).isEqualTo("abbey road live");
    }
}
