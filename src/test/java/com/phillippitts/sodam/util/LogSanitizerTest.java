package com.phillippitts.sodam.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void truncateHandlesNullsAndLimits() {
        assertThat(LogSanitizer.truncate(null, 5)).isEmpty();
        assertThat(LogSanitizer.truncate("abc", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("abcdef", 3)).isEqualTo("abc");
        assertThat(LogSanitizer.truncate("ab", 3)).isEqualTo("ab");
    }

    @Test
    void maskTokenKeepsLastFourCharacters() {
        assertThat(LogSanitizer.maskToken(null)).isEqualTo("<none>");
        assertThat(LogSanitizer.maskToken("abc")).isEqualTo("****");
        assertThat(LogSanitizer.maskToken("secret-token-1234")).isEqualTo("****1234");
    }
}
