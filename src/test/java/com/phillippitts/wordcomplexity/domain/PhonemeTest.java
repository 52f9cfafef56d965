package com.phillippitts.wordcomplexity.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PhonemeTest {

    @Test
    void vowelSymbolIncludesStressDigit() {
        Phoneme ih = Phoneme.vowel("IH", Stress.PRIMARY, true);

        assertThat(ih.symbol()).isEqualTo("IH1");
        assertThat(ih.toString()).isEqualTo("IH1");
        assertThat(ih.isVowel()).isTrue();
        assertThat(ih.isConsonant()).isFalse();
    }

    @Test
    void consonantSymbolHasNoDigit() {
        Phoneme k = Phoneme.consonant("K");

        assertThat(k.symbol()).isEqualTo("K");
        assertThat(k.stress()).isNull();
        assertThat(k.isConsonant()).isTrue();
    }

    @Test
    void stressedLaxRequiresPrimaryOrSecondaryStress() {
        assertThat(Phoneme.vowel("AE", Stress.PRIMARY, true).isStressedLax()).isTrue();
        assertThat(Phoneme.vowel("AE", Stress.SECONDARY, true).isStressedLax()).isTrue();
        assertThat(Phoneme.vowel("AE", Stress.UNSTRESSED, true).isStressedLax()).isFalse();
        assertThat(Phoneme.vowel("IY", Stress.PRIMARY, false).isStressedLax()).isFalse();
        assertThat(Phoneme.consonant("T").isStressedLax()).isFalse();
    }

    @Test
    void rejectsVowelWithoutStress() {
        assertThatThrownBy(() -> new Phoneme("AA", PhonemeCategory.VOWEL, null, false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("requires a stress level");
    }

    @Test
    void rejectsConsonantWithStressOrLaxness() {
        assertThatThrownBy(() -> new Phoneme("K", PhonemeCategory.CONSONANT, Stress.PRIMARY, false))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Phoneme("K", PhonemeCategory.CONSONANT, null, true))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
