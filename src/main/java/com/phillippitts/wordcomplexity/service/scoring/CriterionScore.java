package com.phillippitts.wordcomplexity.service.scoring;

/**
 * Contribution of one criterion to a word's score.
 */
public record CriterionScore(
        String name,
        CriterionCategory category,
        int weight,
        int occurrences
) {

    public int points() {
        return weight * occurrences;
    }
}
