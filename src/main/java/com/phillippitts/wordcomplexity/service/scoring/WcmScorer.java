package com.phillippitts.wordcomplexity.service.scoring;

import com.phillippitts.wordcomplexity.domain.Pronunciation;
import com.phillippitts.wordcomplexity.domain.SyllabifiedWord;
import com.phillippitts.wordcomplexity.service.syllabify.ConservationCheck;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Computes the Word Complexity Measure: the sum, over a criterion table, of
 * {@code weight × occurrences}. Adding a criterion means adding a table entry; the
 * summation never changes.
 *
 * <p>Words are re-checked for conservation before scoring, so a syllabification that
 * does not match its pronunciation is rejected rather than scored.
 */
public class WcmScorer {

    private final List<ComplexityCriterion> criteria;
    private final ConservationCheck conservationCheck;

    public WcmScorer(List<ComplexityCriterion> criteria, ConservationCheck conservationCheck) {
        this.criteria = List.copyOf(Objects.requireNonNull(criteria, "criteria"));
        this.conservationCheck = Objects.requireNonNull(conservationCheck, "conservationCheck");
    }

    public int score(SyllabifiedWord word) {
        return score(word, word.pronunciation());
    }

    /**
     * @param word          syllabified word
     * @param pronunciation the pronunciation the word was built from
     * @return non-negative WCM score
     * @throws com.phillippitts.wordcomplexity.exception.ConservationViolationException
     *         if the syllables do not reproduce {@code pronunciation}
     */
    public int score(SyllabifiedWord word, Pronunciation pronunciation) {
        return breakdown(word, pronunciation).score();
    }

    public ComplexityReport breakdown(SyllabifiedWord word) {
        return breakdown(word, word.pronunciation());
    }

    public ComplexityReport breakdown(SyllabifiedWord word, Pronunciation pronunciation) {
        conservationCheck.verify(pronunciation, word.syllables()).orElseThrow();

        int total = 0;
        List<CriterionScore> contributions = new ArrayList<>();
        for (ComplexityCriterion criterion : criteria) {
            CriterionScore score = criterion.evaluate(word, pronunciation);
            if (score.occurrences() > 0) {
                contributions.add(score);
                total += score.points();
            }
        }
        return new ComplexityReport(total, contributions);
    }

    public List<ComplexityCriterion> criteria() {
        return criteria;
    }
}
