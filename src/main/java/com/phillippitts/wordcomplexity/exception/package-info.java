/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.wordcomplexity.exception.WordComplexityException} - Base exception</li>
 *   <li>{@link com.phillippitts.wordcomplexity.exception.UnknownPhonemeException} - symbol outside
 *       the ARPAbet inventory or with a misplaced/missing stress digit</li>
 *   <li>{@link com.phillippitts.wordcomplexity.exception.NoNucleusFoundException} - pronunciation
 *       without any vowel</li>
 *   <li>{@link com.phillippitts.wordcomplexity.exception.IllegalClusterException} - medial consonant
 *       run with no legal split in the phonotactic table</li>
 *   <li>{@link com.phillippitts.wordcomplexity.exception.ConservationViolationException} - assembled
 *       syllables lost, added or reordered phonemes</li>
 *   <li>{@link com.phillippitts.wordcomplexity.exception.WordNotFoundException} - dictionary miss</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and map to HTTP responses in
 * {@code presentation.exception.GlobalExceptionHandler}. The engine never retries; batch
 * callers catch {@code WordComplexityException} per word and carry on.
 *
 * @since 1.0
 */
package com.phillippitts.wordcomplexity.exception;
