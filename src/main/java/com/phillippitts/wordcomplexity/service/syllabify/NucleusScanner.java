package com.phillippitts.wordcomplexity.service.syllabify;

import com.phillippitts.wordcomplexity.domain.Phoneme;
import com.phillippitts.wordcomplexity.domain.Pronunciation;
import com.phillippitts.wordcomplexity.exception.NoNucleusFoundException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Locates vowel nuclei and the consonant runs around them in one left-to-right pass.
 */
@Component
public class NucleusScanner {

    /**
     * @param pronunciation classified phonemes
     * @return nuclei positions plus leading, medial and trailing consonant runs
     * @throws NoNucleusFoundException if the pronunciation contains no vowel
     */
    public NucleusScan scan(Pronunciation pronunciation) {
        List<Integer> positions = new ArrayList<>();
        List<Phoneme> leading = List.of();
        List<ConsonantCluster> medial = new ArrayList<>();
        List<Phoneme> run = new ArrayList<>();

        for (int i = 0; i < pronunciation.size(); i++) {
            Phoneme phoneme = pronunciation.get(i);
            if (phoneme.isConsonant()) {
                run.add(phoneme);
                continue;
            }
            if (positions.isEmpty()) {
                leading = List.copyOf(run);
            } else {
                Phoneme previous = pronunciation.get(positions.get(positions.size() - 1));
                medial.add(new ConsonantCluster(previous, run, phoneme));
            }
            positions.add(i);
            run = new ArrayList<>();
        }

        if (positions.isEmpty()) {
            throw new NoNucleusFoundException(pronunciation.symbols());
        }
        return new NucleusScan(pronunciation, positions, leading, medial, run);
    }
}
