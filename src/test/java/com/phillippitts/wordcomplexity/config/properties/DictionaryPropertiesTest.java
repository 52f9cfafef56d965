package com.phillippitts.wordcomplexity.config.properties;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DictionaryPropertiesTest {

    @Test
    void appliesDefaultsWhenUnset() {
        DictionaryProperties props = new DictionaryProperties(null, null, null);

        assertThat(props.getLocation()).isEqualTo(DictionaryProperties.DEFAULT_LOCATION);
        assertThat(props.getSampleSeed()).isNull();
        assertThat(props.getMaxSampleSize()).isEqualTo(100);
    }

    @Test
    void blankLocationFallsBackToDefault() {
        assertThat(new DictionaryProperties("  ", 7L, 5).getLocation())
                .isEqualTo(DictionaryProperties.DEFAULT_LOCATION);
    }

    @Test
    void keepsExplicitValues() {
        DictionaryProperties props = new DictionaryProperties("file:/data/cmudict.dict", 42L, 500);

        assertThat(props.getLocation()).isEqualTo("file:/data/cmudict.dict");
        assertThat(props.getSampleSeed()).isEqualTo(42L);
        assertThat(props.getMaxSampleSize()).isEqualTo(500);
    }
}
