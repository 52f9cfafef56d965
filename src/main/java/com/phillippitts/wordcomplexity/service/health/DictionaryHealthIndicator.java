package com.phillippitts.wordcomplexity.service.health;

import com.phillippitts.wordcomplexity.config.properties.DictionaryProperties;
import com.phillippitts.wordcomplexity.service.dictionary.PronunciationDictionary;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports whether the pronunciation dictionary loaded any words.
 *
 * <p>Exposed via /actuator/health.
 */
@Component
public class DictionaryHealthIndicator implements HealthIndicator {

    private final PronunciationDictionary dictionary;
    private final DictionaryProperties properties;

    public DictionaryHealthIndicator(PronunciationDictionary dictionary, DictionaryProperties properties) {
        this.dictionary = dictionary;
        this.properties = properties;
    }

    @Override
    public Health health() {
        int size = dictionary.size();
        Health.Builder builder = size > 0 ? Health.up() : Health.down();
        return builder
                .withDetail("location", properties.getLocation())
                .withDetail("words", size)
                .build();
    }
}
