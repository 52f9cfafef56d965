package com.phillippitts.wordcomplexity.config.dictionary;

import com.phillippitts.wordcomplexity.config.properties.DictionaryProperties;
import com.phillippitts.wordcomplexity.service.dictionary.CmuPronunciationDictionary;
import com.phillippitts.wordcomplexity.service.dictionary.PronunciationDictionary;
import com.phillippitts.wordcomplexity.service.dictionary.WordSampler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.util.Random;

/**
 * Loads the pronunciation dictionary once at startup and builds the word sampler.
 */
@Configuration
public class DictionaryConfig {

    @Bean
    public PronunciationDictionary pronunciationDictionary(DictionaryProperties props, ResourceLoader resourceLoader) {
        Resource resource = resourceLoader.getResource(props.getLocation());
        return CmuPronunciationDictionary.load(resource);
    }

    @Bean
    public WordSampler wordSampler(PronunciationDictionary dictionary, DictionaryProperties props) {
        Random random = props.getSampleSeed() == null ? new Random() : new Random(props.getSampleSeed());
        return new WordSampler(dictionary, random);
    }
}
