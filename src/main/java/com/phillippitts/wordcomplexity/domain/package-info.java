/**
 * Immutable domain model: phonemes, pronunciations, syllables and syllabified words.
 *
 * <p>All types are Java records that validate their invariants in compact constructors
 * and copy their lists, so instances can be shared freely across threads.
 *
 * @since 1.0
 */
package com.phillippitts.wordcomplexity.domain;
