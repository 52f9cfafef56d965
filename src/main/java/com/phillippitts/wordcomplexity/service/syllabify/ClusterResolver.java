package com.phillippitts.wordcomplexity.service.syllabify;

import com.phillippitts.wordcomplexity.exception.IllegalClusterException;
import com.phillippitts.wordcomplexity.service.syllabify.rule.SplitRule;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Applies an ordered list of {@link SplitRule}s to a medial consonant run; first match wins.
 *
 * <p>Word-edge runs never reach the resolver: the leading run is entirely onset and the
 * trailing run entirely coda. An empty medial run yields an empty split without consulting
 * any rule.
 */
public class ClusterResolver {

    private static final Logger LOG = LogManager.getLogger(ClusterResolver.class);

    private final List<SplitRule> rules;
    private final PhonotacticTable table;

    public ClusterResolver(List<SplitRule> rules, PhonotacticTable table) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
        this.table = Objects.requireNonNull(table, "table");
        if (this.rules.isEmpty()) {
            throw new IllegalArgumentException("At least one split rule is required");
        }
    }

    /**
     * @param cluster medial run with adjacent nuclei
     * @return the split chosen by the first applicable rule
     * @throws IllegalClusterException if no rule finds a legal split
     */
    public ClusterSplit resolve(ConsonantCluster cluster) {
        if (cluster.isEmpty()) {
            return ClusterSplit.empty();
        }
        for (SplitRule rule : rules) {
            Optional<ClusterSplit> split = rule.apply(cluster, table);
            if (split.isPresent()) {
                LOG.trace("Rule {} split {} into coda={} onset={}",
                        rule.name(), cluster.symbols(), split.get().coda(), split.get().onset());
                return split.get();
            }
        }
        throw new IllegalClusterException(cluster.symbols(),
                cluster.precedingNucleus().symbol(), cluster.followingNucleus().symbol());
    }

    public List<String> ruleNames() {
        return rules.stream().map(SplitRule::name).toList();
    }

    public PhonotacticTable table() {
        return table;
    }
}
