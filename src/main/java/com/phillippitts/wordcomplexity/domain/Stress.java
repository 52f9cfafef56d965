package com.phillippitts.wordcomplexity.domain;

/**
 * Lexical stress level carried by a vowel, encoded in ARPAbet as a trailing digit.
 */
public enum Stress {
    UNSTRESSED('0'),
    PRIMARY('1'),
    SECONDARY('2');

    private final char digit;

    Stress(char digit) {
        this.digit = digit;
    }

    public char digit() {
        return digit;
    }
}
