package com.phillippitts.wordcomplexity.service.syllabify;

import com.phillippitts.wordcomplexity.domain.Phoneme;

import java.util.List;
import java.util.Objects;

/**
 * Maximal consonant run between two consecutive nuclei.
 *
 * @param precedingNucleus vowel closing the run on the left
 * @param consonants       consonants of the run in order (possibly empty)
 * @param followingNucleus vowel closing the run on the right
 */
public record ConsonantCluster(
        Phoneme precedingNucleus,
        List<Phoneme> consonants,
        Phoneme followingNucleus
) {

    public ConsonantCluster {
        Objects.requireNonNull(precedingNucleus, "precedingNucleus");
        Objects.requireNonNull(followingNucleus, "followingNucleus");
        consonants = List.copyOf(consonants);
    }

    public int size() {
        return consonants.size();
    }

    public boolean isEmpty() {
        return consonants.isEmpty();
    }

    public List<String> symbols() {
        return consonants.stream().map(Phoneme::symbol).toList();
    }

    /**
     * Splits the run so that the last {@code onsetLength} consonants open the next syllable.
     */
    public ClusterSplit splitAt(int onsetLength, String rule) {
        if (onsetLength < 0 || onsetLength > consonants.size()) {
            throw new IllegalArgumentException("onsetLength " + onsetLength + " outside [0," + consonants.size() + "]");
        }
        int boundary = consonants.size() - onsetLength;
        return new ClusterSplit(consonants.subList(0, boundary), consonants.subList(boundary, consonants.size()), rule);
    }
}
