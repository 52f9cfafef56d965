package com.phillippitts.wordcomplexity.presentation.controller;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Body of {@code POST /api/syllabify}.
 *
 * @param phonemes ARPAbet symbols, e.g. {@code ["AH0", "L", "AE1", "S", "K", "AH0"]}
 */
public record SyllabifyRequest(
        @NotEmpty
        @Size(max = 64)
        List<String> phonemes
) { }
