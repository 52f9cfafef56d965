package com.phillippitts.wordcomplexity.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the pronunciation dictionary and random sampling.
 */
@Validated
@ConfigurationProperties(prefix = "dictionary")
public class DictionaryProperties {

    public static final String DEFAULT_LOCATION = "classpath:dictionary/cmudict-sample.dict";

    /** Spring resource location of a CMUdict-format file. */
    @NotBlank
    private final String location;

    /** Seed for word sampling; unset means a fresh random seed per start. */
    private final Long sampleSeed;

    /** Upper bound for a single sample request. */
    @Min(1)
    @Max(10_000)
    private final int maxSampleSize;

    @ConstructorBinding
    public DictionaryProperties(String location, Long sampleSeed, Integer maxSampleSize) {
        this.location = location == null || location.isBlank() ? DEFAULT_LOCATION : location;
        this.sampleSeed = sampleSeed;
        this.maxSampleSize = maxSampleSize == null ? 100 : maxSampleSize;
    }

    public String getLocation() {
        return location;
    }

    public Long getSampleSeed() {
        return sampleSeed;
    }

    public int getMaxSampleSize() {
        return maxSampleSize;
    }
}
