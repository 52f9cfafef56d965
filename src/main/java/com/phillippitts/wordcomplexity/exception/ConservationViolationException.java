package com.phillippitts.wordcomplexity.exception;

import java.util.List;

/**
 * Thrown when assembled syllables do not reproduce the input pronunciation.
 * Always a defect in rule resolution, never an acceptable result.
 */
public class ConservationViolationException extends WordComplexityException {

    private final List<String> expected;
    private final List<String> actual;

    public ConservationViolationException(List<String> expected, List<String> actual) {
        super("Syllables do not reproduce the pronunciation: expected " + expected + ", assembled " + actual);
        this.expected = List.copyOf(expected);
        this.actual = List.copyOf(actual);
    }

    public List<String> getExpected() {
        return expected;
    }

    public List<String> getActual() {
        return actual;
    }
}
