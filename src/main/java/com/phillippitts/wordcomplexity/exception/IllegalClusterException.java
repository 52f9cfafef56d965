package com.phillippitts.wordcomplexity.exception;

import java.util.List;

/**
 * Thrown when no split rule finds a legal coda/onset division for a medial consonant run.
 * Either the word is irregular or the phonotactic table is incomplete.
 */
public class IllegalClusterException extends WordComplexityException {

    private final List<String> cluster;
    private final String precedingNucleus;
    private final String followingNucleus;

    public IllegalClusterException(List<String> cluster, String precedingNucleus, String followingNucleus) {
        super("No legal split for consonant run " + cluster
                + " between " + precedingNucleus + " and " + followingNucleus);
        this.cluster = List.copyOf(cluster);
        this.precedingNucleus = precedingNucleus;
        this.followingNucleus = followingNucleus;
    }

    public List<String> getCluster() {
        return cluster;
    }

    public String getPrecedingNucleus() {
        return precedingNucleus;
    }

    public String getFollowingNucleus() {
        return followingNucleus;
    }
}
