package com.phillippitts.wordcomplexity.service.syllabify.rule;

import com.phillippitts.wordcomplexity.service.syllabify.ClusterSplit;
import com.phillippitts.wordcomplexity.service.syllabify.ConsonantCluster;
import com.phillippitts.wordcomplexity.service.syllabify.PhonotacticTable;

import java.util.Optional;

/**
 * Strategy deciding where a medial consonant run divides between coda and onset.
 *
 * <p>Rules are evaluated as an ordered list by
 * {@link com.phillippitts.wordcomplexity.service.syllabify.ClusterResolver}; the first rule
 * returning a split wins. A rule that does not apply returns {@link Optional#empty()}.
 *
 * <p><b>Thread Safety:</b> implementations must be stateless; the only data they read is
 * the immutable {@link PhonotacticTable} passed in.
 */
public interface SplitRule {

    /**
     * @param cluster non-empty medial run with its adjacent nuclei
     * @param table   legal onsets and coda consonants
     * @return the split, or empty if this rule does not apply
     */
    Optional<ClusterSplit> apply(ConsonantCluster cluster, PhonotacticTable table);

    /** Name recorded on the splits this rule produces. */
    String name();
}
