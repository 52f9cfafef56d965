package com.phillippitts.wordcomplexity.domain;

/** Broad category of an ARPAbet phoneme. */
public enum PhonemeCategory {
    VOWEL,
    CONSONANT
}
