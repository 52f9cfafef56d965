package com.phillippitts.wordcomplexity.service.syllabify.rule;

import com.phillippitts.wordcomplexity.domain.Phoneme;
import com.phillippitts.wordcomplexity.service.syllabify.ClusterSplit;
import com.phillippitts.wordcomplexity.service.syllabify.ConsonantCluster;
import com.phillippitts.wordcomplexity.service.syllabify.PhonotacticTable;

import java.util.List;
import java.util.Optional;

/**
 * Maximal Onset Principle: the following syllable takes the longest suffix of the run
 * that is a legal onset, provided the remaining prefix is a legal coda.
 *
 * <p>Onset lengths are tried from {@code min(run length, longest table onset)} down to 1,
 * so a three-consonant run falls back from a three- to a two- to a one-consonant onset.
 * Giving the whole run to the preceding coda with an empty onset is the last resort
 * ({@code B-IH0.L-AO1-NG.IH0-NG}).
 */
public final class MaximalOnsetRule implements SplitRule {

    public static final String NAME = "maximal-onset";

    @Override
    public Optional<ClusterSplit> apply(ConsonantCluster cluster, PhonotacticTable table) {
        List<Phoneme> consonants = cluster.consonants();
        int longest = Math.min(consonants.size(), table.maxOnsetLength());
        for (int onsetLength = longest; onsetLength >= 0; onsetLength--) {
            int boundary = consonants.size() - onsetLength;
            List<Phoneme> onset = consonants.subList(boundary, consonants.size());
            if ((onset.isEmpty() || table.isLegalOnset(onset))
                    && table.isLegalCoda(consonants.subList(0, boundary))) {
                return Optional.of(cluster.splitAt(onsetLength, NAME));
            }
        }
        return Optional.empty();
    }

    @Override
    public String name() {
        return NAME;
    }
}
