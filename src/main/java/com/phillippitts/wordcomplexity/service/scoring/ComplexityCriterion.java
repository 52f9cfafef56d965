package com.phillippitts.wordcomplexity.service.scoring;

import com.phillippitts.wordcomplexity.domain.Pronunciation;
import com.phillippitts.wordcomplexity.domain.SyllabifiedWord;

import java.util.Objects;

/**
 * Named, weighted complexity criterion.
 *
 * @param name      stable identifier used in configuration and reports
 * @param category  WCM parameter group
 * @param weight    points per occurrence (non-negative)
 * @param evaluator occurrence counter
 */
public record ComplexityCriterion(
        String name,
        CriterionCategory category,
        int weight,
        CriterionEvaluator evaluator
) {

    public ComplexityCriterion {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(evaluator, "evaluator");
        if (weight < 0) {
            throw new IllegalArgumentException("Criterion " + name + " weight must be >= 0, got: " + weight);
        }
    }

    public ComplexityCriterion withWeight(int newWeight) {
        return new ComplexityCriterion(name, category, newWeight, evaluator);
    }

    public CriterionScore evaluate(SyllabifiedWord word, Pronunciation pronunciation) {
        int occurrences = evaluator.occurrences(word, pronunciation);
        if (occurrences < 0) {
            throw new IllegalStateException("Criterion " + name + " returned negative occurrences: " + occurrences);
        }
        return new CriterionScore(name, category, weight, occurrences);
    }
}
