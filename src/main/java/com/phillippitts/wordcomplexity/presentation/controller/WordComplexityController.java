package com.phillippitts.wordcomplexity.presentation.controller;

import com.phillippitts.wordcomplexity.config.properties.DictionaryProperties;
import com.phillippitts.wordcomplexity.service.analysis.BatchReport;
import com.phillippitts.wordcomplexity.service.analysis.PronunciationAnalysis;
import com.phillippitts.wordcomplexity.service.analysis.WordAnalysisService;
import com.phillippitts.wordcomplexity.service.analysis.WordReport;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST entry points for syllabification and WCM scoring.
 *
 * <ul>
 *   <li>{@code GET /api/words/{word}} - every dictionary transcription of a word</li>
 *   <li>{@code POST /api/syllabify} - an ad-hoc ARPAbet transcription</li>
 *   <li>{@code GET /api/sample?count=N} - N random dictionary words</li>
 * </ul>
 */
@RestController
@RequestMapping("/api")
class WordComplexityController {

    private static final Logger log = LogManager.getLogger(WordComplexityController.class);

    private final WordAnalysisService analysisService;
    private final DictionaryProperties dictionaryProperties;

    WordComplexityController(WordAnalysisService analysisService, DictionaryProperties dictionaryProperties) {
        this.analysisService = analysisService;
        this.dictionaryProperties = dictionaryProperties;
    }

    @GetMapping("/words/{word}")
    ResponseEntity<WordReport> word(@PathVariable String word) {
        log.debug("Word lookup received");
        return ResponseEntity.ok(analysisService.analyzeWord(word));
    }

    @PostMapping("/syllabify")
    ResponseEntity<PronunciationAnalysis> syllabify(@Valid @RequestBody SyllabifyRequest request) {
        return ResponseEntity.ok(analysisService.analyzePhonemes(request.phonemes()));
    }

    @GetMapping("/sample")
    ResponseEntity<BatchReport> sample(@RequestParam(defaultValue = "10") int count) {
        if (count < 1 || count > dictionaryProperties.getMaxSampleSize()) {
            throw new IllegalArgumentException("count must be between 1 and "
                    + dictionaryProperties.getMaxSampleSize() + ", got: " + count);
        }
        return ResponseEntity.ok(analysisService.analyzeSample(count));
    }
}
