package com.phillippitts.wordcomplexity.exception;

/**
 * Thrown when the pronunciation dictionary has no entry for a word.
 */
public class WordNotFoundException extends WordComplexityException {

    private final String word;

    public WordNotFoundException(String word) {
        super("Word not found in pronunciation dictionary: " + word);
        this.word = word;
    }

    public String getWord() {
        return word;
    }
}
