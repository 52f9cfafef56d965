/**
 * Service layer.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.phoneme} - ARPAbet inventory and symbol classification</li>
 *   <li>{@code service.syllabify} - syllabification engine and cluster split rules</li>
 *   <li>{@code service.render} - display strings for syllabified words</li>
 *   <li>{@code service.scoring} - Word Complexity Measure criterion table and scorer</li>
 *   <li>{@code service.dictionary} - CMUdict lookup and random word sampling</li>
 *   <li>{@code service.analysis} - per-word and batch analysis with failure isolation</li>
 * </ul>
 *
 * <p>Services are stateless, use constructor injection and throw domain exceptions,
 * never HTTP exceptions.
 *
 * @since 1.0
 */
package com.phillippitts.wordcomplexity.service;
