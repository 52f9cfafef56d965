package com.phillippitts.wordcomplexity.service.scoring;

import com.phillippitts.wordcomplexity.domain.Phoneme;
import com.phillippitts.wordcomplexity.domain.Stress;
import com.phillippitts.wordcomplexity.domain.Syllable;
import com.phillippitts.wordcomplexity.domain.SyllabifiedWord;
import com.phillippitts.wordcomplexity.service.phoneme.PhonemeInventory;

import java.util.List;
import java.util.Set;

/**
 * Word Complexity Measure criteria (Stoel-Gammon 2010, Clinical Linguistics and
 * Phonetics 24(4-5): 271-282), each worth one point per occurrence.
 *
 * <p>Word patterns: more than two syllables; primary stress on a non-initial syllable.
 * Syllable structures: word-final consonant; each onset cluster; each coda cluster.
 * Sound classes, per onset or coda consonant: dorsal; liquid; fricative or affricate;
 * voiced fricative or affricate (these score in both of the last two classes).
 */
public final class WcmCriteria {

    public static final String POLYSYLLABIC = "polysyllabic";
    public static final String NON_INITIAL_STRESS = "non-initial-stress";
    public static final String WORD_FINAL_CONSONANT = "word-final-consonant";
    public static final String ONSET_CLUSTER = "onset-cluster";
    public static final String CODA_CLUSTER = "coda-cluster";
    public static final String DORSAL = "dorsal";
    public static final String LIQUID = "liquid";
    public static final String FRICATIVE_AFFRICATE = "fricative-affricate";
    public static final String VOICED_FRICATIVE_AFFRICATE = "voiced-fricative-affricate";

    private WcmCriteria() {}

    public static List<ComplexityCriterion> standard() {
        return List.of(
                new ComplexityCriterion(POLYSYLLABIC, CriterionCategory.WORD_PATTERN, 1,
                        (word, pron) -> word.syllableCount() > 2 ? 1 : 0),
                new ComplexityCriterion(NON_INITIAL_STRESS, CriterionCategory.WORD_PATTERN, 1,
                        (word, pron) -> hasNonInitialPrimaryStress(word) ? 1 : 0),
                new ComplexityCriterion(WORD_FINAL_CONSONANT, CriterionCategory.SYLLABLE_STRUCTURE, 1,
                        (word, pron) -> word.last().coda().isEmpty() ? 0 : 1),
                new ComplexityCriterion(ONSET_CLUSTER, CriterionCategory.SYLLABLE_STRUCTURE, 1,
                        (word, pron) -> (int) word.syllables().stream().filter(Syllable::hasOnsetCluster).count()),
                new ComplexityCriterion(CODA_CLUSTER, CriterionCategory.SYLLABLE_STRUCTURE, 1,
                        (word, pron) -> (int) word.syllables().stream().filter(Syllable::hasCodaCluster).count()),
                soundClass(DORSAL, PhonemeInventory.DORSALS),
                soundClass(LIQUID, PhonemeInventory.LIQUIDS),
                soundClass(FRICATIVE_AFFRICATE, PhonemeInventory.FRICATIVES_AFFRICATES),
                soundClass(VOICED_FRICATIVE_AFFRICATE, PhonemeInventory.VOICED_FRICATIVES_AFFRICATES));
    }

    private static ComplexityCriterion soundClass(String name, Set<String> members) {
        return new ComplexityCriterion(name, CriterionCategory.SOUND_CLASS, 1,
                (word, pron) -> countConsonantsIn(word, members));
    }

    private static boolean hasNonInitialPrimaryStress(SyllabifiedWord word) {
        List<Syllable> syllables = word.syllables();
        for (int i = 1; i < syllables.size(); i++) {
            if (syllables.get(i).nucleus().stress() == Stress.PRIMARY) {
                return true;
            }
        }
        return false;
    }

    private static int countConsonantsIn(SyllabifiedWord word, Set<String> members) {
        int count = 0;
        for (Syllable syllable : word.syllables()) {
            for (Phoneme consonant : syllable.consonants()) {
                if (members.contains(consonant.base())) {
                    count++;
                }
            }
        }
        return count;
    }
}
