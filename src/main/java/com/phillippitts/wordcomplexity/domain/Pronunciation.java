package com.phillippitts.wordcomplexity.domain;

import java.util.List;
import java.util.Objects;

/**
 * Ordered phoneme sequence for one transcription of a word.
 *
 * <p>Vowel presence is not checked here; the nucleus scanner rejects vowel-less input
 * with {@link com.phillippitts.wordcomplexity.exception.NoNucleusFoundException}.
 *
 * @param phonemes phonemes in spoken order (copied)
 */
public record Pronunciation(List<Phoneme> phonemes) {

    public Pronunciation {
        Objects.requireNonNull(phonemes, "phonemes");
        phonemes = List.copyOf(phonemes);
    }

    public static Pronunciation of(Phoneme... phonemes) {
        return new Pronunciation(List.of(phonemes));
    }

    public int size() {
        return phonemes.size();
    }

    public Phoneme get(int index) {
        return phonemes.get(index);
    }

    /** ARPAbet symbols, stress digits included. */
    public List<String> symbols() {
        return phonemes.stream().map(Phoneme::symbol).toList();
    }

    @Override
    public String toString() {
        return String.join(" ", symbols());
    }
}
