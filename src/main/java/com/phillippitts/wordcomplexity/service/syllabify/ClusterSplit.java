package com.phillippitts.wordcomplexity.service.syllabify;

import com.phillippitts.wordcomplexity.domain.Phoneme;

import java.util.List;
import java.util.Objects;

/**
 * Division of a medial consonant run.
 *
 * @param coda  consonants closing the preceding syllable
 * @param onset consonants opening the following syllable
 * @param rule  name of the split rule that decided
 */
public record ClusterSplit(
        List<Phoneme> coda,
        List<Phoneme> onset,
        String rule
) {

    public static final String EMPTY_RUN = "empty-run";

    public ClusterSplit {
        coda = List.copyOf(coda);
        onset = List.copyOf(onset);
        Objects.requireNonNull(rule, "rule");
    }

    public static ClusterSplit empty() {
        return new ClusterSplit(List.of(), List.of(), EMPTY_RUN);
    }
}
