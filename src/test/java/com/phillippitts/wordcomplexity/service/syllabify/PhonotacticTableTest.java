package com.phillippitts.wordcomplexity.service.syllabify;

import com.phillippitts.wordcomplexity.domain.Phoneme;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PhonotacticTableTest {

    private final PhonotacticTable english = PhonotacticTable.english();

    private static List<Phoneme> consonants(String... bases) {
        return Arrays.stream(bases).map(Phoneme::consonant).toList();
    }

    @Test
    void englishAcceptsCommonOnsets() {
        assertThat(english.isLegalOnset(consonants("K", "R"))).isTrue();
        assertThat(english.isLegalOnset(consonants("S", "K", "R"))).isTrue();
        assertThat(english.isLegalOnset(consonants("P", "Y"))).isTrue();
        assertThat(english.isLegalOnset(consonants("T"))).isTrue();
    }

    @Test
    void englishRejectsNgOnsetAndMedialSStopPairs() {
        assertThat(english.isLegalOnset(consonants("NG"))).isFalse();
        assertThat(english.isLegalOnset(consonants("S", "K"))).isFalse();
        assertThat(english.isLegalOnset(consonants("S", "T"))).isFalse();
        assertThat(english.isLegalOnset(consonants("T", "L"))).isFalse();
        assertThat(english.isLegalOnset(List.of())).isFalse();
    }

    @Test
    void codasExcludeGlidesAndHh() {
        assertThat(english.isLegalCoda(consonants("N", "D"))).isTrue();
        assertThat(english.isLegalCoda(consonants("HH"))).isFalse();
        assertThat(english.isLegalCoda(consonants("W"))).isFalse();
        assertThat(english.isLegalCoda(consonants("Y"))).isFalse();
        assertThat(english.isLegalCoda(List.of())).isTrue();
    }

    @Test
    void englishLongestOnsetIsThree() {
        assertThat(english.maxOnsetLength()).isEqualTo(3);
    }

    @Test
    void customTableParsesSpaceSeparatedOnsets() {
        PhonotacticTable table = PhonotacticTable.of(List.of("T", " S T ", ""), List.of("S", "T"));

        assertThat(table.onsets()).containsExactlyInAnyOrder(List.of("T"), List.of("S", "T"));
        assertThat(table.isLegalOnset(consonants("S", "T"))).isTrue();
        assertThat(table.maxOnsetLength()).isEqualTo(2);
        assertThat(table.codaConsonants()).containsExactlyInAnyOrder("S", "T");
    }

    @Test
    void rejectsVowelOrUnknownSymbols() {
        assertThatThrownBy(() -> PhonotacticTable.of(List.of("AA"), List.of("T")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("AA");
        assertThatThrownBy(() -> PhonotacticTable.of(List.of("T"), List.of("QQ")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("QQ");
    }

    @Test
    void emptyTableHasNoOnsets() {
        PhonotacticTable table = PhonotacticTable.of(List.of(), List.of());

        assertThat(table.maxOnsetLength()).isZero();
    }
}
