package com.phillippitts.wordcomplexity.service.syllabify;

import com.phillippitts.wordcomplexity.domain.Pronunciation;
import com.phillippitts.wordcomplexity.domain.Syllable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Verifies that syllables concatenate back to their pronunciation: same phonemes, same
 * order, same stress digits. Runs on every syllabification and before every score.
 */
@Component
public class ConservationCheck {

    public ConservationResult verify(Pronunciation pronunciation, List<Syllable> syllables) {
        List<String> actual = new ArrayList<>(pronunciation.size());
        for (Syllable syllable : syllables) {
            syllable.phonemes().forEach(p -> actual.add(p.symbol()));
        }
        return ConservationResult.compare(pronunciation.symbols(), actual);
    }
}
