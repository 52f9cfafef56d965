package com.phillippitts.wordcomplexity.service.phoneme;

import com.phillippitts.wordcomplexity.domain.Phoneme;
import com.phillippitts.wordcomplexity.domain.Pronunciation;
import com.phillippitts.wordcomplexity.domain.Stress;
import com.phillippitts.wordcomplexity.exception.UnknownPhonemeException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Classifies ARPAbet symbols into {@link Phoneme} values.
 *
 * <p>Rules:
 * <ul>
 *   <li>Vowels must end in a stress digit: 0 (unstressed), 1 (primary), 2 (secondary)</li>
 *   <li>Consonants must not carry a digit</li>
 *   <li>Symbols are case-sensitive (CMUdict uses upper case)</li>
 * </ul>
 *
 * <p>All valid phonemes are built once at construction; classification is a map lookup,
 * so the classifier is stateless and thread-safe.
 */
@Component
public class PhonemeClassifier {

    private final Map<String, Phoneme> phonemesBySymbol;

    public PhonemeClassifier() {
        Map<String, Phoneme> bySymbol = new HashMap<>();
        for (String consonant : PhonemeInventory.CONSONANTS) {
            bySymbol.put(consonant, Phoneme.consonant(consonant));
        }
        for (String vowel : PhonemeInventory.VOWELS) {
            boolean lax = PhonemeInventory.LAX_VOWELS.contains(vowel);
            for (Stress stress : Stress.values()) {
                Phoneme phoneme = Phoneme.vowel(vowel, stress, lax);
                bySymbol.put(phoneme.symbol(), phoneme);
            }
        }
        this.phonemesBySymbol = Collections.unmodifiableMap(bySymbol);
    }

    /**
     * Classifies a single ARPAbet symbol.
     *
     * @param symbol symbol such as "K" or "IH1"
     * @return the phoneme
     * @throws UnknownPhonemeException if the symbol is not a valid ARPAbet phoneme
     */
    public Phoneme classify(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new UnknownPhonemeException(String.valueOf(symbol), "blank symbol");
        }
        Phoneme phoneme = phonemesBySymbol.get(symbol);
        if (phoneme != null) {
            return phoneme;
        }
        throw new UnknownPhonemeException(symbol, diagnose(symbol));
    }

    /**
     * Classifies every symbol of a transcription.
     *
     * @param symbols ARPAbet symbols in order
     * @return pronunciation holding the classified phonemes
     * @throws UnknownPhonemeException on the first invalid symbol
     */
    public Pronunciation classifyAll(List<String> symbols) {
        Objects.requireNonNull(symbols, "symbols");
        List<Phoneme> phonemes = new ArrayList<>(symbols.size());
        for (String symbol : symbols) {
            phonemes.add(classify(symbol));
        }
        return new Pronunciation(phonemes);
    }

    private static String diagnose(String symbol) {
        if (PhonemeInventory.VOWELS.contains(symbol)) {
            return "vowel is missing its stress digit";
        }
        char last = symbol.charAt(symbol.length() - 1);
        String base = symbol.substring(0, symbol.length() - 1);
        if (Character.isDigit(last)) {
            if (PhonemeInventory.CONSONANTS.contains(base)) {
                return "consonants carry no stress digit";
            }
            if (PhonemeInventory.VOWELS.contains(base)) {
                return "stress digit must be 0, 1 or 2";
            }
        }
        return "not in the ARPAbet inventory";
    }
}
