package com.phillippitts.wordcomplexity.service.syllabify;

import com.phillippitts.wordcomplexity.domain.Phoneme;
import com.phillippitts.wordcomplexity.domain.Pronunciation;

import java.util.List;

/**
 * Provisional partition of a pronunciation around its vowel nuclei.
 *
 * @param pronunciation    the scanned pronunciation
 * @param nucleusPositions indices of the vowels, ascending
 * @param leadingOnset     consonants before the first nucleus
 * @param medialClusters   one run per gap between consecutive nuclei
 * @param trailingCoda     consonants after the last nucleus
 */
public record NucleusScan(
        Pronunciation pronunciation,
        List<Integer> nucleusPositions,
        List<Phoneme> leadingOnset,
        List<ConsonantCluster> medialClusters,
        List<Phoneme> trailingCoda
) {

    public NucleusScan {
        nucleusPositions = List.copyOf(nucleusPositions);
        leadingOnset = List.copyOf(leadingOnset);
        medialClusters = List.copyOf(medialClusters);
        trailingCoda = List.copyOf(trailingCoda);
        if (medialClusters.size() != nucleusPositions.size() - 1) {
            throw new IllegalArgumentException("Expected " + (nucleusPositions.size() - 1)
                    + " medial clusters, got " + medialClusters.size());
        }
    }

    public int nucleusCount() {
        return nucleusPositions.size();
    }

    public Phoneme nucleus(int index) {
        return pronunciation.get(nucleusPositions.get(index));
    }
}
