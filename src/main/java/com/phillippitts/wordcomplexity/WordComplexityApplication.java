package com.phillippitts.wordcomplexity;

import com.phillippitts.wordcomplexity.config.properties.DictionaryProperties;
import com.phillippitts.wordcomplexity.config.properties.PhonotacticProperties;
import com.phillippitts.wordcomplexity.config.properties.SyllabificationProperties;
import com.phillippitts.wordcomplexity.config.properties.WcmProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        SyllabificationProperties.class,
        PhonotacticProperties.class,
        WcmProperties.class,
        DictionaryProperties.class
})
public class WordComplexityApplication {

    public static void main(String[] args) {
        SpringApplication.run(WordComplexityApplication.class, args);
    }

}
