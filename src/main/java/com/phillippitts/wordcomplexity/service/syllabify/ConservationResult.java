package com.phillippitts.wordcomplexity.service.syllabify;

import com.phillippitts.wordcomplexity.exception.ConservationViolationException;

import java.util.List;

/**
 * Outcome of comparing assembled syllables against their source pronunciation.
 *
 * @param intact           true when the syllables reproduce the pronunciation exactly
 * @param firstMismatch    index of the first differing phoneme, or -1 when intact
 * @param expected         source symbols
 * @param actual           flattened syllable symbols
 */
public record ConservationResult(
        boolean intact,
        int firstMismatch,
        List<String> expected,
        List<String> actual
) {

    public ConservationResult {
        expected = List.copyOf(expected);
        actual = List.copyOf(actual);
    }

    public static ConservationResult compare(List<String> expected, List<String> actual) {
        int shared = Math.min(expected.size(), actual.size());
        for (int i = 0; i < shared; i++) {
            if (!expected.get(i).equals(actual.get(i))) {
                return new ConservationResult(false, i, expected, actual);
            }
        }
        if (expected.size() != actual.size()) {
            return new ConservationResult(false, shared, expected, actual);
        }
        return new ConservationResult(true, -1, expected, actual);
    }

    /**
     * @throws ConservationViolationException if the comparison found a mismatch
     */
    public void orElseThrow() {
        if (!intact) {
            throw new ConservationViolationException(expected, actual);
        }
    }
}
