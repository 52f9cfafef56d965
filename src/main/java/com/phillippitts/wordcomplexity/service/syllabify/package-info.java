/**
 * Syllabification engine.
 *
 * <p>Data flow: symbols → {@code PhonemeClassifier} → {@link
 * com.phillippitts.wordcomplexity.service.syllabify.NucleusScanner} → {@link
 * com.phillippitts.wordcomplexity.service.syllabify.ClusterResolver} (ordered
 * {@code rule.SplitRule} list over a {@link
 * com.phillippitts.wordcomplexity.service.syllabify.PhonotacticTable}) → {@link
 * com.phillippitts.wordcomplexity.service.syllabify.SyllableAssembler} → {@link
 * com.phillippitts.wordcomplexity.service.syllabify.ConservationCheck}.
 *
 * <p>The phonotactic table and the rule list are the only configuration; both are
 * immutable once built, so a single engine instance serves all callers.
 *
 * @since 1.0
 */
package com.phillippitts.wordcomplexity.service.syllabify;
