package com.phillippitts.edgekeeper.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void shouldReturnEmptyStringForNull() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.stripControl(null)).isEmpty();
    }

    @Test
    void shouldReturnEmptyStringForNonPositiveMax() {
        assertThat(LogSanitizer.truncate("worker output", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("worker output", -5)).isEmpty();
    }

    @Test
    void shouldReturnFullStringWhenShortEnough() {
        assertThat(LogSanitizer.truncate("ready", 10)).isEqualTo("ready");
        assertThat(LogSanitizer.truncate("ready", 5)).isEqualTo("ready");
    }

    @Test
    void shouldTruncateWhenLongerThanMax() {
        assertThat(LogSanitizer.truncate("sensor reading 42", 6)).isEqualTo("sensor");
        assertThat(LogSanitizer.truncate("x".repeat(10_000), 500)).hasSize(500);
    }

    @Test
    void shouldReplaceControlCharactersButKeepTabs() {
        assertThat(LogSanitizer.stripControl("a\tb")).isEqualTo("a\tb");
        assertThat(LogSanitizer.stripControl("fake\r\n2024 ERROR forged")).isEqualTo("fake??2024 ERROR forged");
        assertThat(LogSanitizer.stripControl("\u001b[31mred")).isEqualTo("?[31mred");
    }
}
