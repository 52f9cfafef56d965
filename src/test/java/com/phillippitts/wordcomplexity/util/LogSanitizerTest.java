package com.phillippitts.wordcomplexity.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void returnsEmptyForNull() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.phonemes(null, 10)).isEmpty();
    }

    @Test
    void leavesShortStringsUntouched() {
        assertThat(LogSanitizer.truncate("alaska", 10)).isEqualTo("alaska");
    }

    @Test
    void truncatesWithEllipsis() {
        assertThat(LogSanitizer.truncate("crisscrossing", 8)).isEqualTo("criss...");
    }

    @Test
    void flattensLineBreaks() {
        assertThat(LogSanitizer.truncate("a\r\nb", 10)).isEqualTo("a  b");
    }

    @Test
    void veryShortLimitCutsWithoutEllipsis() {
        assertThat(LogSanitizer.truncate("alaska", 2)).isEqualTo("al");
        assertThat(LogSanitizer.truncate("alaska", 0)).isEmpty();
    }

    @Test
    void joinsPhonemesWithSpaces() {
        assertThat(LogSanitizer.phonemes(List.of("K", "AE1", "T"), 80)).isEqualTo("K AE1 T");
        assertThat(LogSanitizer.phonemes(List.of("K", "R", "IH1", "S", "K", "R", "AO2"), 10)).isEqualTo("K R IH1...");
    }
}
