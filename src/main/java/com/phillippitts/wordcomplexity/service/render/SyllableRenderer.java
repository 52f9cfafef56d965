package com.phillippitts.wordcomplexity.service.render;

import com.phillippitts.wordcomplexity.domain.Phoneme;
import com.phillippitts.wordcomplexity.domain.Syllable;
import com.phillippitts.wordcomplexity.domain.SyllabifiedWord;
import org.springframework.stereotype.Component;

import java.util.StringJoiner;

/**
 * Formats syllabified words as {@code K-R-IH1.S-K-R-AO2.S-IH0-NG}: phonemes within a
 * syllable joined by {@value #PHONEME_SEPARATOR}, syllables by {@value #SYLLABLE_SEPARATOR}.
 */
@Component
public class SyllableRenderer {

    public static final String PHONEME_SEPARATOR = "-";
    public static final String SYLLABLE_SEPARATOR = ".";

    public String render(SyllabifiedWord word) {
        return render(word, false);
    }

    /**
     * @param word     syllabified word
     * @param destress when true, vowels are written without their stress digit
     * @return display string
     */
    public String render(SyllabifiedWord word, boolean destress) {
        StringJoiner syllables = new StringJoiner(SYLLABLE_SEPARATOR);
        for (Syllable syllable : word.syllables()) {
            StringJoiner phonemes = new StringJoiner(PHONEME_SEPARATOR);
            for (Phoneme phoneme : syllable.phonemes()) {
                phonemes.add(destress ? phoneme.base() : phoneme.symbol());
            }
            syllables.add(phonemes.toString());
        }
        return syllables.toString();
    }
}
