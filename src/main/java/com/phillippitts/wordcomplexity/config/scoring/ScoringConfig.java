package com.phillippitts.wordcomplexity.config.scoring;

import com.phillippitts.wordcomplexity.config.properties.WcmProperties;
import com.phillippitts.wordcomplexity.service.scoring.ComplexityCriterion;
import com.phillippitts.wordcomplexity.service.scoring.WcmCriteria;
import com.phillippitts.wordcomplexity.service.scoring.WcmScorer;
import com.phillippitts.wordcomplexity.service.syllabify.ConservationCheck;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds the WCM criterion table from the standard criteria plus {@code wcm.*} overrides.
 */
@Configuration
public class ScoringConfig {

    @Bean
    public WcmScorer wcmScorer(WcmProperties props, ConservationCheck conservationCheck) {
        return new WcmScorer(criteria(props), conservationCheck);
    }

    /**
     * @throws IllegalArgumentException if an override or disabled entry names an unknown criterion
     */
    static List<ComplexityCriterion> criteria(WcmProperties props) {
        List<ComplexityCriterion> standard = WcmCriteria.standard();
        Set<String> known = standard.stream().map(ComplexityCriterion::name).collect(Collectors.toSet());
        for (String name : props.getWeights().keySet()) {
            requireKnown(known, name, "wcm.weights");
        }
        for (String name : props.getDisabled()) {
            requireKnown(known, name, "wcm.disabled");
        }

        List<ComplexityCriterion> criteria = new ArrayList<>();
        for (ComplexityCriterion criterion : standard) {
            if (props.getDisabled().contains(criterion.name())) {
                continue;
            }
            Integer weight = props.getWeights().get(criterion.name());
            criteria.add(weight == null ? criterion : criterion.withWeight(weight));
        }
        return List.copyOf(criteria);
    }

    private static void requireKnown(Set<String> known, String name, String property) {
        if (!known.contains(name)) {
            throw new IllegalArgumentException("Unknown WCM criterion in " + property + ": " + name
                    + " (known: " + known.stream().sorted().toList() + ")");
        }
    }
}
