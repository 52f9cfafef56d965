package com.phillippitts.wordcomplexity.service.scoring;

import java.util.List;

/**
 * WCM score with its per-criterion breakdown. Criteria that never held are omitted.
 *
 * @param score         sum of all contributions
 * @param contributions criteria with at least one occurrence, in table order
 */
public record ComplexityReport(
        int score,
        List<CriterionScore> contributions
) {

    public ComplexityReport {
        contributions = List.copyOf(contributions);
    }
}
