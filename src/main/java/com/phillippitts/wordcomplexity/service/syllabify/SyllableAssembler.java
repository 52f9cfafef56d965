package com.phillippitts.wordcomplexity.service.syllabify;

import com.phillippitts.wordcomplexity.domain.Phoneme;
import com.phillippitts.wordcomplexity.domain.Syllable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Combines nuclei with the leading run, the resolved medial splits and the trailing run
 * into ordered syllables.
 */
@Component
public class SyllableAssembler {

    /**
     * @param scan   nuclei and consonant runs
     * @param splits one split per medial cluster, in order
     * @return syllables in spoken order
     */
    public List<Syllable> assemble(NucleusScan scan, List<ClusterSplit> splits) {
        if (splits.size() != scan.medialClusters().size()) {
            throw new IllegalArgumentException("Expected " + scan.medialClusters().size()
                    + " splits, got " + splits.size());
        }
        int last = scan.nucleusCount() - 1;
        List<Syllable> syllables = new ArrayList<>(scan.nucleusCount());
        for (int i = 0; i <= last; i++) {
            List<Phoneme> onset = i == 0 ? scan.leadingOnset() : splits.get(i - 1).onset();
            List<Phoneme> coda = i == last ? scan.trailingCoda() : splits.get(i).coda();
            syllables.add(new Syllable(onset, scan.nucleus(i), coda));
        }
        return List.copyOf(syllables);
    }
}
