package com.phillippitts.wordcomplexity.domain;

import java.util.Objects;

/**
 * Immutable ARPAbet phoneme: a base symbol plus, for vowels only, a stress level.
 *
 * @param base     symbol without stress digit (e.g. "IH", "K")
 * @param category vowel or consonant
 * @param stress   stress level for vowels; null for consonants
 * @param lax      true when the base is a lax vowel (IH, EH, AE, AH, UH)
 */
public record Phoneme(
        String base,
        PhonemeCategory category,
        Stress stress,
        boolean lax
) {

    public Phoneme {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(category, "category");
        if (category == PhonemeCategory.VOWEL && stress == null) {
            throw new IllegalArgumentException("Vowel " + base + " requires a stress level");
        }
        if (category == PhonemeCategory.CONSONANT && stress != null) {
            throw new IllegalArgumentException("Consonant " + base + " cannot carry stress");
        }
        if (category == PhonemeCategory.CONSONANT && lax) {
            throw new IllegalArgumentException("Consonant " + base + " cannot be lax");
        }
    }

    public static Phoneme consonant(String base) {
        return new Phoneme(base, PhonemeCategory.CONSONANT, null, false);
    }

    public static Phoneme vowel(String base, Stress stress, boolean lax) {
        return new Phoneme(base, PhonemeCategory.VOWEL, stress, lax);
    }

    public boolean isVowel() {
        return category == PhonemeCategory.VOWEL;
    }

    public boolean isConsonant() {
        return category == PhonemeCategory.CONSONANT;
    }

    /**
     * Lax vowel carrying primary or secondary stress. Such a vowel needs a closing
     * consonant in its own syllable.
     */
    public boolean isStressedLax() {
        return lax && (stress == Stress.PRIMARY || stress == Stress.SECONDARY);
    }

    /** ARPAbet symbol including the stress digit for vowels (e.g. "IH1"). */
    public String symbol() {
        return stress == null ? base : base + stress.digit();
    }

    @Override
    public String toString() {
        return symbol();
    }
}
