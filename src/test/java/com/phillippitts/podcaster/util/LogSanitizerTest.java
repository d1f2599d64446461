package com.phillippitts.podcaster.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void shouldReturnEmptyStringForNull() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.preview(null, 10)).isEmpty();
    }

    @Test
    void shouldReturnEmptyStringForNonPositiveMax() {
        assertThat(LogSanitizer.truncate("hello world", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("hello world", -1)).isEmpty();
    }

    @Test
    void shouldReturnFullStringWhenShorterOrEqualToMax() {
        assertThat(LogSanitizer.truncate("hello", 10)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("12345", 5)).isEqualTo("12345");
    }

    @Test
    void shouldTruncateWhenLongerThanMax() {
        assertThat(LogSanitizer.truncate("hello world", 5)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("a".repeat(10000), 100)).hasSize(100);
    }

    @Test
    void previewAddsEllipsisOnlyWhenCut() {
        assertThat(LogSanitizer.preview("hello world", 5)).isEqualTo("hello...");
        assertThat(LogSanitizer.preview("hello", 5)).isEqualTo("hello");
    }

    @Test
    void fileSafeReplacesPathCharacters() {
        assertThat(LogSanitizer.fileSafe("../etc/passwd")).isEqualTo("___etc_passwd");
        assertThat(LogSanitizer.fileSafe("abc-123_X")).isEqualTo("abc-123_X");
        assertThat(LogSanitizer.fileSafe(null)).isEqualTo("job");
        assertThat(LogSanitizer.fileSafe("  ")).isEqualTo("job");
    }
}
