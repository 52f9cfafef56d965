package com.phillippitts.wordcomplexity.service.analysis;

import java.util.List;

/**
 * A transcription that could not be analysed.
 *
 * @param word      headword, or null for ad-hoc phoneme input
 * @param phonemes  the offending transcription (empty when the word itself was missing)
 * @param errorKind simple name of the exception class
 * @param message   exception message
 */
public record AnalysisFailure(
        String word,
        List<String> phonemes,
        String errorKind,
        String message
) {

    public AnalysisFailure {
        phonemes = phonemes == null ? List.of() : List.copyOf(phonemes);
    }
}
