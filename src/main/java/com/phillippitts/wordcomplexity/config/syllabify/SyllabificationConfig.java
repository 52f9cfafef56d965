package com.phillippitts.wordcomplexity.config.syllabify;

import com.phillippitts.wordcomplexity.config.properties.PhonotacticProperties;
import com.phillippitts.wordcomplexity.config.properties.SyllabificationProperties;
import com.phillippitts.wordcomplexity.service.syllabify.ClusterResolver;
import com.phillippitts.wordcomplexity.service.syllabify.PhonotacticTable;
import com.phillippitts.wordcomplexity.service.syllabify.rule.LaxVowelCodaRule;
import com.phillippitts.wordcomplexity.service.syllabify.rule.MaximalOnsetRule;
import com.phillippitts.wordcomplexity.service.syllabify.rule.SplitRule;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Wires the phonotactic table and the ordered split rule list into a {@link ClusterResolver}.
 */
@Configuration
public class SyllabificationConfig {

    private static final Logger LOG = LogManager.getLogger(SyllabificationConfig.class);

    @Bean
    public PhonotacticTable phonotacticTable(PhonotacticProperties props) {
        if (!props.isCustom()) {
            return PhonotacticTable.english();
        }
        PhonotacticTable table = PhonotacticTable.of(props.getOnsets(), props.getCodaConsonants());
        LOG.info("Using custom phonotactic table: {} onset(s), {} coda consonant(s)",
                table.onsets().size(), table.codaConsonants().size());
        return table;
    }

    @Bean
    public ClusterResolver clusterResolver(SyllabificationProperties props, PhonotacticTable table) {
        ClusterResolver resolver = new ClusterResolver(splitRules(props), table);
        LOG.info("Cluster split rules: {}", resolver.ruleNames());
        return resolver;
    }

    static List<SplitRule> splitRules(SyllabificationProperties props) {
        List<SplitRule> rules = new ArrayList<>();
        for (SyllabificationProperties.Rule rule : props.getRules()) {
            switch (rule) {
                case LAX_VOWEL -> {
                    if (props.isLaxVowelRule()) {
                        rules.add(new LaxVowelCodaRule());
                    }
                }
                case MAXIMAL_ONSET -> rules.add(new MaximalOnsetRule());
            }
        }
        return rules;
    }
}
