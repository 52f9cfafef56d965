package com.phillippitts.wordcomplexity.presentation.controller;

import com.phillippitts.wordcomplexity.config.properties.DictionaryProperties;
import com.phillippitts.wordcomplexity.service.analysis.BatchReport;
import com.phillippitts.wordcomplexity.service.analysis.PronunciationAnalysis;
import com.phillippitts.wordcomplexity.service.analysis.WordAnalysisService;
import com.phillippitts.wordcomplexity.service.analysis.WordReport;
import com.phillippitts.wordcomplexity.service.scoring.ComplexityReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class WordComplexityControllerTest {

    private WordAnalysisService service;
    private WordComplexityController controller;

    @BeforeEach
    void setUp() {
        service = mock(WordAnalysisService.class);
        controller = new WordComplexityController(service, new DictionaryProperties(null, null, 20));
    }

    @Test
    void wordDelegatesToService() {
        WordReport report = new WordReport("cat", List.of(), List.of());
        when(service.analyzeWord("cat")).thenReturn(report);

        ResponseEntity<WordReport> response = controller.word("cat");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isSameAs(report);
    }

    @Test
    void syllabifyPassesPhonemes() {
        List<String> phonemes = List.of("K", "AE1", "T");
        PronunciationAnalysis analysis = new PronunciationAnalysis(
                phonemes, "K-AE1-T", "K-AE-T", 1, new ComplexityReport(2, List.of()));
        when(service.analyzePhonemes(phonemes)).thenReturn(analysis);

        ResponseEntity<PronunciationAnalysis> response = controller.syllabify(new SyllabifyRequest(phonemes));

        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().wcm()).isEqualTo(2);
    }

    @Test
    void sampleWithinBoundsDelegates() {
        BatchReport batch = BatchReport.of(List.of());
        when(service.analyzeSample(5)).thenReturn(batch);

        ResponseEntity<BatchReport> response = controller.sample(5);

        assertThat(response.getBody()).isSameAs(batch);
        verify(service).analyzeSample(5);
    }

    @Test
    void sampleOutsideBoundsIsRejected() {
        assertThatThrownBy(() -> controller.sample(0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> controller.sample(21))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("between 1 and 20");
        verifyNoInteractions(service);
    }
}
