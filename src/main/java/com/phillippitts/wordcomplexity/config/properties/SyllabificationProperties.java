package com.phillippitts.wordcomplexity.config.properties;

import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Typed properties for the cluster split rules.
 */
@Validated
@ConfigurationProperties(prefix = "syllabification")
public class SyllabificationProperties {

    public enum Rule { LAX_VOWEL, MAXIMAL_ONSET }

    /** Split rules in evaluation order; the first rule that applies wins. */
    @NotEmpty
    private final List<Rule> rules;

    /** Master switch for the lax-vowel (Alaska) rule even when listed in {@link #rules}. */
    private final boolean laxVowelRule;

    @ConstructorBinding
    public SyllabificationProperties(List<Rule> rules, Boolean laxVowelRule) {
        this.rules = rules == null || rules.isEmpty()
                ? List.of(Rule.LAX_VOWEL, Rule.MAXIMAL_ONSET)
                : List.copyOf(rules);
        this.laxVowelRule = laxVowelRule == null ? true : laxVowelRule;
        if (!this.rules.contains(Rule.MAXIMAL_ONSET)) {
            throw new IllegalArgumentException("syllabification.rules must include MAXIMAL_ONSET");
        }
    }

    public List<Rule> getRules() {
        return rules;
    }

    public boolean isLaxVowelRule() {
        return laxVowelRule;
    }
}
