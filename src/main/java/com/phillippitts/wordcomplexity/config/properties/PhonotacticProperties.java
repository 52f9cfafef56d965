package com.phillippitts.wordcomplexity.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

import java.util.List;

/**
 * Optional replacement for the built-in English phonotactic table.
 *
 * <p>Leave both lists empty to use the default table. Onsets are written as
 * space-separated consonants, e.g. {@code syllabification.phonotactics.onsets[0]=S T R}.
 */
@ConfigurationProperties(prefix = "syllabification.phonotactics")
public class PhonotacticProperties {

    private final List<String> onsets;
    private final List<String> codaConsonants;

    @ConstructorBinding
    public PhonotacticProperties(List<String> onsets, List<String> codaConsonants) {
        this.onsets = onsets == null ? List.of() : List.copyOf(onsets);
        this.codaConsonants = codaConsonants == null ? List.of() : List.copyOf(codaConsonants);
        if (this.onsets.isEmpty() != this.codaConsonants.isEmpty()) {
            throw new IllegalArgumentException(
                    "syllabification.phonotactics.onsets and coda-consonants must be set together");
        }
    }

    public boolean isCustom() {
        return !onsets.isEmpty();
    }

    public List<String> getOnsets() {
        return onsets;
    }

    public List<String> getCodaConsonants() {
        return codaConsonants;
    }
}
