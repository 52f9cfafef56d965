package com.phillippitts.wordcomplexity.service.scoring;

/** WCM parameter groups. */
public enum CriterionCategory {
    WORD_PATTERN,
    SYLLABLE_STRUCTURE,
    SOUND_CLASS
}
