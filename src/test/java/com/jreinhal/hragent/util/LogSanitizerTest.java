package com.jreinhal.hragent.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LogSanitizerTest {

    @Test
    @DisplayName("Line breaks and control characters are removed")
    void sanitize() {
        assertThat(LogSanitizer.sanitize("line1\r\nINFO forged\u0007")).isEqualTo("line1 INFO forged");
        assertThat(LogSanitizer.sanitize(null)).isEmpty();
    }

    @Test
    @DisplayName("Query summary hides the question text")
    void querySummary() {
        String summary = LogSanitizer.querySummary("What is my severance?");

        assertThat(summary).startsWith("[len=21,id=").doesNotContain("severance");
        assertThat(LogSanitizer.querySummary(null)).isEqualTo("[len=0,id=none]");
    }

    @Test
    @DisplayName("Preview cuts long values")
    void preview() {
        assertThat(LogSanitizer.preview("abcdefghij", 4)).isEqualTo("abcd...");
        assertThat(LogSanitizer.preview("abc", 4)).isEqualTo("abc");
    }
}
