package com.phillippitts.wordcomplexity.service.phoneme;

import java.util.Set;

/**
 * ARPAbet inventory and the phonetic classes the syllabifier and scorer refer to.
 * Symbols here are stress-free bases.
 */
public final class PhonemeInventory {

    public static final Set<String> VOWELS = Set.of(
            "AA", "AE", "AH", "AO", "AW", "AY", "EH", "ER",
            "EY", "IH", "IY", "OW", "OY", "UH", "UW");

    /** Lax (short, checked) vowels. */
    public static final Set<String> LAX_VOWELS = Set.of("IH", "EH", "AE", "AH", "UH");

    public static final Set<String> CONSONANTS = Set.of(
            "B", "CH", "D", "DH", "F", "G", "HH", "JH", "K", "L", "M", "N",
            "NG", "P", "R", "S", "SH", "T", "TH", "V", "W", "Y", "Z", "ZH");

    /** Velar (dorsal) consonants. */
    public static final Set<String> DORSALS = Set.of("K", "G", "NG");

    public static final Set<String> LIQUIDS = Set.of("L", "R");

    public static final Set<String> VOICED_FRICATIVES_AFFRICATES = Set.of("V", "DH", "Z", "ZH");

    // JH is not counted
    public static final Set<String> FRICATIVES_AFFRICATES = Set.of(
            "F", "TH", "S", "SH", "CH", "V", "DH", "Z", "ZH");

    private PhonemeInventory() {}
}
