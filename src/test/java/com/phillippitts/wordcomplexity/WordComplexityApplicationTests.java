package com.phillippitts.wordcomplexity;

import com.phillippitts.wordcomplexity.service.analysis.WordAnalysisService;
import com.phillippitts.wordcomplexity.service.syllabify.ClusterResolver;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "dictionary.sample-seed=42")
class WordComplexityApplicationTests {

    @Autowired
    private WordAnalysisService analysisService;

    @Autowired
    private ClusterResolver clusterResolver;

    @Test
    void contextLoads() {
        assertThat(clusterResolver.ruleNames()).containsExactly("lax-vowel", "maximal-onset");
    }

    @Test
    void analysesBundledDictionaryWord() {
        assertThat(analysisService.analyzeWord("crisscross").pronunciations())
                .singleElement()
                .satisfies(a -> assertThat(a.syllabified()).isEqualTo("K-R-IH1.S-K-R-AO2-S"));
    }
}
