package com.phillippitts.wordcomplexity.service.analysis;

import java.util.List;

/**
 * Analyses of every transcription of one word.
 */
public record WordReport(
        String word,
        List<PronunciationAnalysis> pronunciations,
        List<AnalysisFailure> failures
) {

    public WordReport {
        pronunciations = List.copyOf(pronunciations);
        failures = List.copyOf(failures);
    }
}
