package io.tessera.coordination.logging;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class LogSanitizerTest {

    @Test
    void sanitize_replacesLineBreaks() {
        assertThat(LogSanitizer.sanitize("loop2\r\nINFO forged entry"))
                .doesNotContain("\n")
                .doesNotContain("\r")
                .contains("forged entry");
    }

    @Test
    void sanitize_replacesControlCharacters() {
        assertThat(LogSanitizer.sanitize("a\u0007b\tc")).isEqualTo("a b c");
    }

    @Test
    void sanitize_keepsPrintableText() {
        assertThat(LogSanitizer.sanitize("sig-abc 0.95 (pass)")).isEqualTo("sig-abc 0.95 (pass)");
    }

    @Test
    void sanitize_rendersNullAsText() {
        assertThat(LogSanitizer.sanitize(null)).isEqualTo("null");
    }
}
