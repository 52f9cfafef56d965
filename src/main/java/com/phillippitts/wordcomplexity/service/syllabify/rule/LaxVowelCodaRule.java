package com.phillippitts.wordcomplexity.service.syllabify.rule;

import com.phillippitts.wordcomplexity.service.syllabify.ClusterSplit;
import com.phillippitts.wordcomplexity.service.syllabify.ConsonantCluster;
import com.phillippitts.wordcomplexity.service.syllabify.PhonotacticTable;

import java.util.Optional;

/**
 * Stressed lax vowels cannot end a syllable: a single intervocalic consonant after one
 * closes the lax vowel's syllable instead of opening the next (the "Alaska rule").
 *
 * <p>Example: {@code B AH1 T ER0} splits as {@code B-AH1-T.ER0}.
 */
public final class LaxVowelCodaRule implements SplitRule {

    public static final String NAME = "lax-vowel";

    @Override
    public Optional<ClusterSplit> apply(ConsonantCluster cluster, PhonotacticTable table) {
        if (cluster.size() != 1 || !cluster.precedingNucleus().isStressedLax()) {
            return Optional.empty();
        }
        if (!table.isLegalCoda(cluster.consonants())) {
            return Optional.empty();
        }
        return Optional.of(cluster.splitAt(0, NAME));
    }

    @Override
    public String name() {
        return NAME;
    }
}
