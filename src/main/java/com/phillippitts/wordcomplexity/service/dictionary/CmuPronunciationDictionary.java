package com.phillippitts.wordcomplexity.service.dictionary;

import com.phillippitts.wordcomplexity.exception.WordNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.io.Resource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Pronunciation dictionary in the CMU Pronouncing Dictionary text format.
 *
 * <p>Format:
 * <pre>
 * ;;; comment
 * ALASKA  AH0 L AE1 S K AH0
 * TOMATO  T AH0 M EY1 T OW2
 * TOMATO(1)  T AH0 M AA1 T OW2
 * PARIS  P EH1 R IH0 S # place
 * </pre>
 *
 * <p>Alternate transcriptions carry a parenthesised index and are grouped under the bare
 * headword; anything after {@code #} is a comment. Symbols are not validated here; the
 * syllabification engine rejects unknown ones per call. Lines without a transcription are
 * skipped with a warning.
 */
public class CmuPronunciationDictionary implements PronunciationDictionary {

    private static final Logger LOG = LogManager.getLogger(CmuPronunciationDictionary.class);

    private static final Pattern VARIANT_SUFFIX = Pattern.compile("\\(\\d+\\)$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Map<String, List<List<String>>> entries;

    public CmuPronunciationDictionary(Map<String, List<List<String>>> entries) {
        Map<String, List<List<String>>> copy = new LinkedHashMap<>();
        entries.forEach((word, prons) -> copy.put(normalize(word),
                prons.stream().map(List::copyOf).toList()));
        this.entries = Collections.unmodifiableMap(copy);
    }

    /**
     * Loads a dictionary from a Spring resource (classpath, file or URL).
     *
     * @throws UncheckedIOException if the resource cannot be read
     */
    public static CmuPronunciationDictionary load(Resource resource) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            CmuPronunciationDictionary dictionary = parse(reader, resource.getDescription());
            LOG.info("Loaded {} word(s) from {}", dictionary.size(), resource.getDescription());
            return dictionary;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read pronunciation dictionary " + resource.getDescription(), e);
        }
    }

    static CmuPronunciationDictionary parse(BufferedReader reader, String source) throws IOException {
        Map<String, List<List<String>>> entries = new LinkedHashMap<>();
        String line;
        int lineNumber = 0;
        int skipped = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String trimmed = stripTrailingComment(line).strip();
            if (trimmed.isEmpty() || trimmed.startsWith(";;;")) {
                continue;
            }
            String[] tokens = WHITESPACE.split(trimmed);
            if (tokens.length < 2) {
                skipped++;
                LOG.warn("Skipping malformed dictionary line {}:{}", source, lineNumber);
                continue;
            }
            String word = normalize(VARIANT_SUFFIX.matcher(tokens[0]).replaceFirst(""));
            List<String> symbols = List.copyOf(Arrays.asList(tokens).subList(1, tokens.length));
            entries.computeIfAbsent(word, w -> new ArrayList<>()).add(symbols);
        }
        if (skipped > 0) {
            LOG.warn("Skipped {} malformed line(s) in {}", skipped, source);
        }
        return new CmuPronunciationDictionary(entries);
    }

    private static String stripTrailingComment(String line) {
        int hash = line.indexOf('#');
        return hash < 0 ? line : line.substring(0, hash);
    }

    @Override
    public List<List<String>> pronunciationsFor(String word) {
        List<List<String>> prons = word == null ? null : entries.get(normalize(word));
        if (prons == null) {
            throw new WordNotFoundException(word);
        }
        return prons;
    }

    @Override
    public boolean contains(String word) {
        return word != null && entries.containsKey(normalize(word));
    }

    @Override
    public List<String> words() {
        return List.copyOf(entries.keySet());
    }

    @Override
    public int size() {
        return entries.size();
    }

    private static String normalize(String word) {
        return word.strip().toLowerCase(Locale.ROOT);
    }
}
