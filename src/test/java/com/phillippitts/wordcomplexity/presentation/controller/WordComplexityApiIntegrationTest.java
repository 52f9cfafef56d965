package com.phillippitts.wordcomplexity.presentation.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "dictionary.max-sample-size=5",
        "wcm.weights.dorsal=2"
})
@AutoConfigureMockMvc
class WordComplexityApiIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void looksUpWordWithAllTranscriptions() throws Exception {
        mockMvc.perform(get("/api/words/TOMATO"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.word").value("TOMATO"))
                .andExpect(jsonPath("$.pronunciations.length()").value(2))
                .andExpect(jsonPath("$.pronunciations[0].syllabified").value("T-AH0.M-EY1.T-OW2"))
                .andExpect(jsonPath("$.pronunciations[0].destressed").value("T-AH.M-EY.T-OW"));
    }

    @Test
    void unknownWordIs404() throws Exception {
        mockMvc.perform(get("/api/words/qwertyuiop"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("WordNotFoundException"));
    }

    @Test
    void syllabifiesAdHocPhonemesWithConfiguredWeights() throws Exception {
        mockMvc.perform(post("/api/syllabify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phonemes\":[\"K\",\"R\",\"IH1\",\"S\",\"K\",\"R\",\"AO2\",\"S\",\"IH0\",\"NG\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.syllabified").value("K-R-IH1.S-K-R-AO2.S-IH0-NG"))
                .andExpect(jsonPath("$.syllableCount").value(3))
                .andExpect(jsonPath("$.complexity.score").value(14));
    }

    @Test
    void illegalClusterIs422() throws Exception {
        mockMvc.perform(post("/api/syllabify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phonemes\":[\"AA1\",\"HH\",\"NG\",\"AA1\"]}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errorCode").value("IllegalClusterException"));
    }

    @Test
    void unknownPhonemeIs422() throws Exception {
        mockMvc.perform(post("/api/syllabify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phonemes\":[\"K\",\"AE\",\"T\"]}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errorCode").value("UnknownPhonemeException"));
    }

    @Test
    void emptyPhonemeListIs400() throws Exception {
        mockMvc.perform(post("/api/syllabify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phonemes\":[]}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void sampleReturnsRequestedWordCount() throws Exception {
        mockMvc.perform(get("/api/sample").param("count", "3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.words.length()").value(3));
    }

    @Test
    void sampleAboveConfiguredMaximumIs400() throws Exception {
        mockMvc.perform(get("/api/sample").param("count", "6"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void healthReportsDictionary() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.components.dictionary.status").value("UP"));
    }
}
