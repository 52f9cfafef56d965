package com.phillippitts.wordcomplexity.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One syllable: consonant onset, a single vowel nucleus, consonant coda.
 *
 * @param onset   0+ consonants preceding the nucleus
 * @param nucleus exactly one vowel
 * @param coda    0+ consonants following the nucleus
 */
public record Syllable(
        List<Phoneme> onset,
        Phoneme nucleus,
        List<Phoneme> coda
) {

    public Syllable {
        Objects.requireNonNull(onset, "onset");
        Objects.requireNonNull(nucleus, "nucleus");
        Objects.requireNonNull(coda, "coda");
        if (!nucleus.isVowel()) {
            throw new IllegalArgumentException("Nucleus must be a vowel, got: " + nucleus);
        }
        requireConsonants(onset, "onset");
        requireConsonants(coda, "coda");
        onset = List.copyOf(onset);
        coda = List.copyOf(coda);
    }

    private static void requireConsonants(List<Phoneme> part, String name) {
        for (Phoneme p : part) {
            if (!p.isConsonant()) {
                throw new IllegalArgumentException("Syllable " + name + " must hold consonants only, got: " + p);
            }
        }
    }

    /** Onset, nucleus and coda in order. */
    public List<Phoneme> phonemes() {
        List<Phoneme> all = new ArrayList<>(onset.size() + 1 + coda.size());
        all.addAll(onset);
        all.add(nucleus);
        all.addAll(coda);
        return List.copyOf(all);
    }

    /** Onset followed by coda; the consonants the sound-class criteria look at. */
    public List<Phoneme> consonants() {
        List<Phoneme> all = new ArrayList<>(onset.size() + coda.size());
        all.addAll(onset);
        all.addAll(coda);
        return List.copyOf(all);
    }

    public boolean hasOnsetCluster() {
        return onset.size() > 1;
    }

    public boolean hasCodaCluster() {
        return coda.size() > 1;
    }
}
