package com.phillippitts.wordcomplexity.service.dictionary;

import java.util.List;

/**
 * Source of ARPAbet transcriptions for words.
 *
 * <p>Lookups are case-insensitive. Implementations are read-only after construction and
 * safe for concurrent use.
 */
public interface PronunciationDictionary {

    /**
     * @param word word to look up
     * @return every transcription of the word, in dictionary order (never empty)
     * @throws com.phillippitts.wordcomplexity.exception.WordNotFoundException if absent
     */
    List<List<String>> pronunciationsFor(String word);

    boolean contains(String word);

    /** All headwords, lower case, in dictionary order. */
    List<String> words();

    int size();
}
