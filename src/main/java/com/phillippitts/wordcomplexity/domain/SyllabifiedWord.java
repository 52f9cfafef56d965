package com.phillippitts.wordcomplexity.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Result of syllabification: the syllables of one pronunciation, in order.
 *
 * <p>Instances returned by the engine always satisfy conservation: concatenating every
 * syllable's onset, nucleus and coda reproduces {@link #pronunciation()} exactly.
 *
 * @param pronunciation the source pronunciation
 * @param syllables     syllables in spoken order (at least one)
 */
public record SyllabifiedWord(
        Pronunciation pronunciation,
        List<Syllable> syllables
) {

    public SyllabifiedWord {
        Objects.requireNonNull(pronunciation, "pronunciation");
        Objects.requireNonNull(syllables, "syllables");
        if (syllables.isEmpty()) {
            throw new IllegalArgumentException("A syllabified word needs at least one syllable");
        }
        syllables = List.copyOf(syllables);
    }

    public int syllableCount() {
        return syllables.size();
    }

    public Syllable last() {
        return syllables.get(syllables.size() - 1);
    }

    /** All phonemes of all syllables, flattened in order. */
    public List<Phoneme> phonemes() {
        List<Phoneme> all = new ArrayList<>();
        for (Syllable syllable : syllables) {
            all.addAll(syllable.phonemes());
        }
        return List.copyOf(all);
    }
}
