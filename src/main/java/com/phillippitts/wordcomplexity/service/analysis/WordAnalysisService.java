package com.phillippitts.wordcomplexity.service.analysis;

import com.phillippitts.wordcomplexity.domain.SyllabifiedWord;
import com.phillippitts.wordcomplexity.exception.ConservationViolationException;
import com.phillippitts.wordcomplexity.exception.WordComplexityException;
import com.phillippitts.wordcomplexity.exception.WordNotFoundException;
import com.phillippitts.wordcomplexity.service.dictionary.PronunciationDictionary;
import com.phillippitts.wordcomplexity.service.dictionary.WordSampler;
import com.phillippitts.wordcomplexity.service.metrics.SyllabificationMetrics;
import com.phillippitts.wordcomplexity.service.render.SyllableRenderer;
import com.phillippitts.wordcomplexity.service.scoring.ComplexityReport;
import com.phillippitts.wordcomplexity.service.scoring.WcmScorer;
import com.phillippitts.wordcomplexity.service.syllabify.SyllabificationEngine;
import com.phillippitts.wordcomplexity.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Looks words up, syllabifies and scores every transcription, and renders the results.
 *
 * <p>Failure isolation lives here, not in the engine: a transcription that fails is
 * recorded as an {@link AnalysisFailure} and the remaining transcriptions and words are
 * still processed. {@link #analyzePhonemes(List)} is the exception: a single ad-hoc
 * transcription has nothing to continue with, so its errors propagate.
 */
@Service
public class WordAnalysisService {

    private static final Logger LOG = LogManager.getLogger(WordAnalysisService.class);

    private final PronunciationDictionary dictionary;
    private final WordSampler sampler;
    private final SyllabificationEngine engine;
    private final SyllableRenderer renderer;
    private final WcmScorer scorer;
    private final SyllabificationMetrics metrics;

    public WordAnalysisService(PronunciationDictionary dictionary,
                               WordSampler sampler,
                               SyllabificationEngine engine,
                               SyllableRenderer renderer,
                               WcmScorer scorer,
                               SyllabificationMetrics metrics) {
        this.dictionary = Objects.requireNonNull(dictionary);
        this.sampler = Objects.requireNonNull(sampler);
        this.engine = Objects.requireNonNull(engine);
        this.renderer = Objects.requireNonNull(renderer);
        this.scorer = Objects.requireNonNull(scorer);
        this.metrics = Objects.requireNonNull(metrics);
    }

    /**
     * Analyses one ad-hoc transcription.
     *
     * @throws WordComplexityException subclasses for invalid input
     */
    public PronunciationAnalysis analyzePhonemes(List<String> phonemes) {
        long start = System.nanoTime();
        try {
            PronunciationAnalysis analysis = analyze(phonemes);
            metrics.incrementSuccess();
            metrics.recordScore(analysis.wcm());
            return analysis;
        } catch (WordComplexityException e) {
            metrics.incrementFailure(e.getClass().getSimpleName());
            throw e;
        } finally {
            metrics.recordLatency(System.nanoTime() - start);
        }
    }

    /**
     * Analyses every dictionary transcription of a word.
     *
     * @throws WordNotFoundException if the dictionary has no entry
     */
    public WordReport analyzeWord(String word) {
        List<List<String>> transcriptions = dictionary.pronunciationsFor(word);
        List<PronunciationAnalysis> analyses = new ArrayList<>();
        List<AnalysisFailure> failures = new ArrayList<>();

        for (List<String> phonemes : transcriptions) {
            long start = System.nanoTime();
            try {
                PronunciationAnalysis analysis = analyze(phonemes);
                analyses.add(analysis);
                metrics.incrementSuccess();
                metrics.recordScore(analysis.wcm());
            } catch (WordComplexityException e) {
                failures.add(new AnalysisFailure(word, phonemes, e.getClass().getSimpleName(), e.getMessage()));
                metrics.incrementFailure(e.getClass().getSimpleName());
                logFailure(word, phonemes, e);
            } finally {
                metrics.recordLatency(System.nanoTime() - start);
            }
        }
        return new WordReport(word, analyses, failures);
    }

    /**
     * Analyses a list of words; missing words and failing transcriptions are reported
     * in the result and do not stop the batch.
     */
    public BatchReport analyzeAll(List<String> words) {
        List<WordReport> reports = new ArrayList<>(words.size());
        for (String word : words) {
            try {
                reports.add(analyzeWord(word));
            } catch (WordNotFoundException e) {
                LOG.info("Skipping '{}': not in dictionary", LogSanitizer.truncate(word, 40));
                metrics.incrementFailure(e.getClass().getSimpleName());
                reports.add(new WordReport(word, List.of(),
                        List.of(new AnalysisFailure(word, List.of(), e.getClass().getSimpleName(), e.getMessage()))));
            }
        }
        BatchReport batch = BatchReport.of(reports);
        LOG.info("Analysed {} word(s): {} transcription(s) ok, {} failed", words.size(), batch.analysed(), batch.failed());
        return batch;
    }

    /**
     * Analyses {@code count} distinct random dictionary words.
     *
     * @throws IllegalArgumentException if count exceeds the dictionary size
     */
    public BatchReport analyzeSample(int count) {
        return analyzeAll(sampler.sample(count));
    }

    private PronunciationAnalysis analyze(List<String> phonemes) {
        SyllabifiedWord word = engine.syllabify(phonemes);
        ComplexityReport complexity = scorer.breakdown(word);
        return new PronunciationAnalysis(
                phonemes,
                renderer.render(word, false),
                renderer.render(word, true),
                word.syllableCount(),
                complexity);
    }

    private static void logFailure(String word, List<String> phonemes, WordComplexityException e) {
        String preview = LogSanitizer.phonemes(phonemes, 80);
        if (e instanceof ConservationViolationException) {
            LOG.error("Conservation violated for '{}' [{}]", word, preview, e);
        } else {
            LOG.warn("Cannot syllabify '{}' [{}]: {}", word, preview, e.getMessage());
        }
    }
}
