package com.phillippitts.wordcomplexity.service.analysis;

import com.phillippitts.wordcomplexity.service.scoring.ComplexityReport;

import java.util.List;

/**
 * Syllabification and WCM of one transcription.
 *
 * @param phonemes       input ARPAbet symbols
 * @param syllabified    rendering with stress digits, e.g. {@code AH0.L-AE1-S.K-AH0}
 * @param destressed     rendering without stress digits, e.g. {@code AH.L-AE-S.K-AH}
 * @param syllableCount  number of syllables
 * @param complexity     WCM score and breakdown
 */
public record PronunciationAnalysis(
        List<String> phonemes,
        String syllabified,
        String destressed,
        int syllableCount,
        ComplexityReport complexity
) {

    public PronunciationAnalysis {
        phonemes = List.copyOf(phonemes);
    }

    public int wcm() {
        return complexity.score();
    }
}
