package com.cfoPilot.aiCfo.gateway.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InputSanitizerTest {

    @Test
    void replacesControlCharactersAndCollapsesWhitespace() {
        assertThat(InputSanitizer.sanitize("Cut\u0000burn\n\n by   10%\t")).isEqualTo("Cut burn by 10%");
    }

    @Test
    void nullAndBlankBecomeEmpty() {
        assertThat(InputSanitizer.sanitize(null)).isEmpty();
        assertThat(InputSanitizer.sanitize(" \r\n ")).isEmpty();
    }

    @Test
    void truncatesLongGoals() {
        String sanitized = InputSanitizer.sanitize("a".repeat(InputSanitizer.MAX_GOAL_LENGTH + 40));

        assertThat(sanitized).hasSize(InputSanitizer.MAX_GOAL_LENGTH);
    }

    @Test
    void masksIdsForLogs() {
        assertThat(IdMasker.mask("3f2a9c1e-8b4d")).isEqualTo("3f****4d");
        assertThat(IdMasker.mask("abc")).isEqualTo("****");
    }
}
