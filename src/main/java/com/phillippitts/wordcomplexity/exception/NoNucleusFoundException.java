package com.phillippitts.wordcomplexity.exception;

import java.util.List;

/**
 * Thrown when a pronunciation contains no vowel, so no syllable nucleus exists.
 */
public class NoNucleusFoundException extends WordComplexityException {

    private final List<String> phonemes;

    public NoNucleusFoundException(List<String> phonemes) {
        super("No vowel nucleus in pronunciation " + phonemes);
        this.phonemes = List.copyOf(phonemes);
    }

    public List<String> getPhonemes() {
        return phonemes;
    }
}
