package com.phillippitts.wordcomplexity.service.dictionary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Picks distinct random headwords from a dictionary.
 *
 * <p>The {@link Random} is shared; sampling is synchronized so concurrent callers do not
 * interleave shuffles.
 */
public class WordSampler {

    private final PronunciationDictionary dictionary;
    private final Random random;

    public WordSampler(PronunciationDictionary dictionary, Random random) {
        this.dictionary = Objects.requireNonNull(dictionary);
        this.random = Objects.requireNonNull(random);
    }

    /**
     * @param count number of distinct words
     * @return words in random order
     * @throws IllegalArgumentException if count is negative or exceeds the dictionary size
     */
    public synchronized List<String> sample(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0, got: " + count);
        }
        if (count > dictionary.size()) {
            throw new IllegalArgumentException("Requested " + count
                    + " words but the dictionary only has " + dictionary.size());
        }
        List<String> words = new ArrayList<>(dictionary.words());
        Collections.shuffle(words, random);
        return List.copyOf(words.subList(0, count));
    }
}
