package com.phillippitts.wordcomplexity.service.scoring;

import com.phillippitts.wordcomplexity.domain.Pronunciation;
import com.phillippitts.wordcomplexity.domain.SyllabifiedWord;

/**
 * Counts how often a complexity criterion holds for a word: 0 or 1 for yes/no
 * properties, a count for per-syllable or per-consonant properties. Never negative.
 */
@FunctionalInterface
public interface CriterionEvaluator {

    int occurrences(SyllabifiedWord word, Pronunciation pronunciation);
}
