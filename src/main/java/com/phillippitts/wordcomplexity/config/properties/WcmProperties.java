package com.phillippitts.wordcomplexity.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

import java.util.List;
import java.util.Map;

/**
 * Overrides for the WCM criterion table.
 */
@ConfigurationProperties(prefix = "wcm")
public class WcmProperties {

    /** Per-criterion weight overrides keyed by criterion name, e.g. {@code wcm.weights.dorsal=2}. */
    private final Map<String, Integer> weights;

    /** Criterion names excluded from scoring. */
    private final List<String> disabled;

    @ConstructorBinding
    public WcmProperties(Map<String, Integer> weights, List<String> disabled) {
        this.weights = weights == null ? Map.of() : Map.copyOf(weights);
        this.disabled = disabled == null ? List.of() : List.copyOf(disabled);
        this.weights.forEach((name, weight) -> {
            if (weight == null || weight < 0) {
                throw new IllegalArgumentException("wcm.weights." + name + " must be >= 0");
            }
        });
    }

    public Map<String, Integer> getWeights() {
        return weights;
    }

    public List<String> getDisabled() {
        return disabled;
    }
}
