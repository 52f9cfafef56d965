package com.phillippitts.wordcomplexity.service.analysis;

import java.util.List;

/**
 * Result of analysing many words. Failing words or transcriptions are reported, never fatal.
 */
public record BatchReport(
        List<WordReport> words,
        int analysed,
        int failed
) {

    public BatchReport {
        words = List.copyOf(words);
    }

    public static BatchReport of(List<WordReport> words) {
        int analysed = words.stream().mapToInt(w -> w.pronunciations().size()).sum();
        int failed = words.stream().mapToInt(w -> w.failures().size()).sum();
        return new BatchReport(words, analysed, failed);
    }
}
