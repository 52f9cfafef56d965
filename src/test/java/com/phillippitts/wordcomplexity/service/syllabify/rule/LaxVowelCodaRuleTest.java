package com.phillippitts.wordcomplexity.service.syllabify.rule;

import com.phillippitts.wordcomplexity.domain.Phoneme;
import com.phillippitts.wordcomplexity.service.phoneme.PhonemeClassifier;
import com.phillippitts.wordcomplexity.service.syllabify.ClusterSplit;
import com.phillippitts.wordcomplexity.service.syllabify.ConsonantCluster;
import com.phillippitts.wordcomplexity.service.syllabify.PhonotacticTable;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class LaxVowelCodaRuleTest {

    private final PhonemeClassifier classifier = new PhonemeClassifier();
    private final PhonotacticTable table = PhonotacticTable.english();
    private final LaxVowelCodaRule rule = new LaxVowelCodaRule();

    private ConsonantCluster cluster(String before, String run, String after) {
        return new ConsonantCluster(classifier.classify(before),
                Arrays.stream(run.split(" ")).map(classifier::classify).toList(),
                classifier.classify(after));
    }

    @Test
    void stressedLaxVowelKeepsSingleConsonant() {
        Optional<ClusterSplit> split = rule.apply(cluster("AH1", "T", "ER0"), table);

        assertThat(split).isPresent();
        assertThat(split.get().coda()).extracting(Phoneme::symbol).containsExactly("T");
        assertThat(split.get().onset()).isEmpty();
        assertThat(split.get().rule()).isEqualTo(LaxVowelCodaRule.NAME);
    }

    @Test
    void secondaryStressCounts() {
        assertThat(rule.apply(cluster("IH2", "N", "OW0"), table)).isPresent();
    }

    @Test
    void unstressedLaxVowelDoesNotApply() {
        assertThat(rule.apply(cluster("IH0", "S", "IY1"), table)).isEmpty();
    }

    @Test
    void tenseVowelDoesNotApply() {
        assertThat(rule.apply(cluster("IY1", "T", "ER0"), table)).isEmpty();
    }

    @Test
    void multiConsonantRunDoesNotApply() {
        assertThat(rule.apply(cluster("AE1", "S K", "AH0"), table)).isEmpty();
    }

    @Test
    void illegalCodaConsonantDoesNotApply() {
        assertThat(rule.apply(cluster("EH1", "HH", "OW0"), table)).isEmpty();
    }

    @Test
    void nameIsStable() {
        assertThat(rule.name()).isEqualTo("lax-vowel");
    }
}
