package com.phillippitts.wordcomplexity.service.syllabify;

import com.phillippitts.wordcomplexity.domain.Phoneme;
import com.phillippitts.wordcomplexity.service.phoneme.PhonemeInventory;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Legal word-internal onsets and coda consonants. Pure data: split rules consult it,
 * and replacing it changes syllabification without touching any rule.
 *
 * @param onsets         legal onset sequences (consonant bases, in order)
 * @param codaConsonants consonants allowed to close a syllable
 */
public record PhonotacticTable(
        Set<List<String>> onsets,
        Set<String> codaConsonants
) {

    private static final List<String> ENGLISH_TWO_CONSONANT_ONSETS = List.of(
            "P R", "T R", "K R", "B R", "D R", "G R", "F R", "TH R", "SH R",
            "P L", "K L", "B L", "G L", "F L", "S L",
            "K W", "G W", "S W", "T W", "D W",
            "HH Y", "P Y", "B Y", "K Y", "F Y", "M Y", "V Y");

    // s+stop pairs split medially (mis.take) but lead a legal three-consonant onset (ex.tra)
    private static final List<String> ENGLISH_THREE_CONSONANT_ONSETS = List.of(
            "S T R", "S K R", "S K L", "S P R", "S P L", "S K W", "T R W");

    public PhonotacticTable {
        Objects.requireNonNull(onsets, "onsets");
        Objects.requireNonNull(codaConsonants, "codaConsonants");
        for (List<String> onset : onsets) {
            if (onset.isEmpty()) {
                throw new IllegalArgumentException("Onset table entries must not be empty");
            }
            onset.forEach(symbol -> requireConsonant(symbol, "onset " + onset));
        }
        codaConsonants.forEach(symbol -> requireConsonant(symbol, "coda consonants"));
        onsets = onsets.stream().map(List::copyOf).collect(Collectors.toUnmodifiableSet());
        codaConsonants = Set.copyOf(codaConsonants);
    }

    /**
     * Default English table: every consonant but NG as a single onset, the common
     * two- and three-consonant onsets, and every consonant but HH, W, Y in codas.
     */
    public static PhonotacticTable english() {
        Set<String> singles = new LinkedHashSet<>(PhonemeInventory.CONSONANTS);
        singles.remove("NG");

        Set<String> codas = new LinkedHashSet<>(PhonemeInventory.CONSONANTS);
        codas.removeAll(Set.of("HH", "W", "Y"));

        Set<String> onsets = new LinkedHashSet<>(singles);
        onsets.addAll(ENGLISH_TWO_CONSONANT_ONSETS);
        onsets.addAll(ENGLISH_THREE_CONSONANT_ONSETS);
        return of(onsets, codas);
    }

    /**
     * Builds a table from space-separated onset strings such as {@code "S T R"}.
     *
     * @throws IllegalArgumentException if an entry names something other than a consonant
     */
    public static PhonotacticTable of(Collection<String> onsets, Collection<String> codaConsonants) {
        Set<List<String>> parsed = onsets.stream()
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> Arrays.asList(s.split("\\s+")))
                .collect(Collectors.toCollection(LinkedHashSet::new));
        Set<String> codas = codaConsonants.stream()
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
        return new PhonotacticTable(parsed, codas);
    }

    public boolean isLegalOnset(List<Phoneme> consonants) {
        return onsets.contains(bases(consonants));
    }

    /** True when every consonant may appear in a coda. An empty coda is legal. */
    public boolean isLegalCoda(List<Phoneme> consonants) {
        for (Phoneme consonant : consonants) {
            if (!codaConsonants.contains(consonant.base())) {
                return false;
            }
        }
        return true;
    }

    public int maxOnsetLength() {
        return onsets.stream().mapToInt(List::size).max().orElse(0);
    }

    private static List<String> bases(List<Phoneme> phonemes) {
        return phonemes.stream().map(Phoneme::base).toList();
    }

    private static void requireConsonant(String symbol, String where) {
        if (!PhonemeInventory.CONSONANTS.contains(symbol)) {
            throw new IllegalArgumentException("Phonotactic table " + where + " contains non-consonant: " + symbol);
        }
    }
}
