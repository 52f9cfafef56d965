package com.phillippitts.wordcomplexity.service.syllabify;

import com.phillippitts.wordcomplexity.domain.Pronunciation;
import com.phillippitts.wordcomplexity.domain.Syllable;
import com.phillippitts.wordcomplexity.domain.SyllabifiedWord;
import com.phillippitts.wordcomplexity.service.phoneme.PhonemeClassifier;
import com.phillippitts.wordcomplexity.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Syllabifies ARPAbet pronunciations.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>{@link PhonemeClassifier} tags each symbol as vowel or consonant</li>
 *   <li>{@link NucleusScanner} finds the nuclei and the consonant runs between them</li>
 *   <li>{@link ClusterResolver} splits every medial run into coda and onset</li>
 *   <li>{@link SyllableAssembler} builds the syllables</li>
 *   <li>{@link ConservationCheck} confirms the syllables reproduce the input</li>
 * </ol>
 *
 * <p>Either a complete, conservation-checked {@link SyllabifiedWord} is returned or an
 * exception from {@code com.phillippitts.wordcomplexity.exception} is thrown; there are no
 * partial results. The engine holds no mutable state and is safe for concurrent use.
 */
@Service
public class SyllabificationEngine {

    private static final Logger LOG = LogManager.getLogger(SyllabificationEngine.class);

    private final PhonemeClassifier classifier;
    private final NucleusScanner scanner;
    private final ClusterResolver resolver;
    private final SyllableAssembler assembler;
    private final ConservationCheck conservationCheck;

    public SyllabificationEngine(PhonemeClassifier classifier,
                                 NucleusScanner scanner,
                                 ClusterResolver resolver,
                                 SyllableAssembler assembler,
                                 ConservationCheck conservationCheck) {
        this.classifier = Objects.requireNonNull(classifier);
        this.scanner = Objects.requireNonNull(scanner);
        this.resolver = Objects.requireNonNull(resolver);
        this.assembler = Objects.requireNonNull(assembler);
        this.conservationCheck = Objects.requireNonNull(conservationCheck);
    }

    /**
     * Classifies and syllabifies a sequence of ARPAbet symbols.
     *
     * @param symbols e.g. {@code ["AH0", "L", "AE1", "S", "K", "AH0"]}
     * @return syllabified word
     * @throws com.phillippitts.wordcomplexity.exception.UnknownPhonemeException on an invalid symbol
     * @throws com.phillippitts.wordcomplexity.exception.NoNucleusFoundException if there is no vowel
     * @throws com.phillippitts.wordcomplexity.exception.IllegalClusterException if a run has no legal split
     * @throws com.phillippitts.wordcomplexity.exception.ConservationViolationException if assembly lost phonemes
     */
    public SyllabifiedWord syllabify(List<String> symbols) {
        return syllabify(classifier.classifyAll(symbols));
    }

    public SyllabifiedWord syllabify(Pronunciation pronunciation) {
        NucleusScan scan = scanner.scan(pronunciation);

        List<ClusterSplit> splits = new ArrayList<>(scan.medialClusters().size());
        for (ConsonantCluster cluster : scan.medialClusters()) {
            splits.add(resolver.resolve(cluster));
        }

        List<Syllable> syllables = assembler.assemble(scan, splits);
        conservationCheck.verify(pronunciation, syllables).orElseThrow();

        if (LOG.isDebugEnabled()) {
            LOG.debug("Syllabified [{}] into {} syllable(s)",
                    LogSanitizer.phonemes(pronunciation.symbols(), 80), syllables.size());
        }
        return new SyllabifiedWord(pronunciation, syllables);
    }
}
