package com.phillippitts.wordcomplexity.domain;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SyllableTest {

    private static final Phoneme S = Phoneme.consonant("S");
    private static final Phoneme K = Phoneme.consonant("K");
    private static final Phoneme R = Phoneme.consonant("R");
    private static final Phoneme AO2 = Phoneme.vowel("AO", Stress.SECONDARY, false);

    @Test
    void phonemesAreOnsetNucleusCodaInOrder() {
        Syllable syllable = new Syllable(List.of(S, K, R), AO2, List.of(S));

        assertThat(syllable.phonemes()).extracting(Phoneme::symbol)
                .containsExactly("S", "K", "R", "AO2", "S");
        assertThat(syllable.consonants()).extracting(Phoneme::symbol)
                .containsExactly("S", "K", "R", "S");
    }

    @Test
    void reportsClustersOnlyForTwoOrMoreConsonants() {
        Syllable cluster = new Syllable(List.of(K, R), AO2, List.of(S, K));
        Syllable single = new Syllable(List.of(K), AO2, List.of(S));
        Syllable open = new Syllable(List.of(), AO2, List.of());

        assertThat(cluster.hasOnsetCluster()).isTrue();
        assertThat(cluster.hasCodaCluster()).isTrue();
        assertThat(single.hasOnsetCluster()).isFalse();
        assertThat(single.hasCodaCluster()).isFalse();
        assertThat(open.phonemes()).containsExactly(AO2);
    }

    @Test
    void rejectsConsonantNucleus() {
        assertThatThrownBy(() -> new Syllable(List.of(), K, List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Nucleus must be a vowel");
    }

    @Test
    void rejectsVowelInOnsetOrCoda() {
        assertThatThrownBy(() -> new Syllable(List.of(AO2), AO2, List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("onset");
        assertThatThrownBy(() -> new Syllable(List.of(), AO2, List.of(AO2)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("coda");
    }

    @Test
    void copiesCallerLists() {
        List<Phoneme> onset = new ArrayList<>(List.of(K));
        Syllable syllable = new Syllable(onset, AO2, List.of());

        onset.add(R);

        assertThat(syllable.onset()).containsExactly(K);
    }

    @Test
    void syllabifiedWordRequiresAtLeastOneSyllable() {
        Pronunciation pronunciation = Pronunciation.of(AO2);

        assertThatThrownBy(() -> new SyllabifiedWord(pronunciation, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void syllabifiedWordFlattensSyllables() {
        Phoneme t = Phoneme.consonant("T");
        Phoneme ah0 = Phoneme.vowel("AH", Stress.UNSTRESSED, true);
        Pronunciation pronunciation = Pronunciation.of(K, AO2, t, ah0);
        SyllabifiedWord word = new SyllabifiedWord(pronunciation, List.of(
                new Syllable(List.of(K), AO2, List.of()),
                new Syllable(List.of(t), ah0, List.of())));

        assertThat(word.syllableCount()).isEqualTo(2);
        assertThat(word.syllables().get(0).nucleus()).isEqualTo(AO2);
        assertThat(word.last().nucleus()).isEqualTo(ah0);
        assertThat(word.phonemes()).isEqualTo(pronunciation.phonemes());
        assertThat(pronunciation.toString()).isEqualTo("K AO2 T AH0");
    }
}
