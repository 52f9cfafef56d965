package com.phillippitts.wordcomplexity.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for word analysis.
 *
 * <p>Provides:
 * <ul>
 *   <li>Analysis latency per pronunciation</li>
 *   <li>Success count, and failure counts tagged by error kind</li>
 *   <li>Distribution of WCM scores</li>
 * </ul>
 *
 * <p>Exposed at /actuator/prometheus.
 */
@Component
public class SyllabificationMetrics {

    private static final String METRIC_PREFIX = "wordcomplexity.analysis";

    private final MeterRegistry registry;

    public SyllabificationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordLatency(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken to syllabify and score one pronunciation")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess() {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of pronunciations syllabified and scored")
                .register(registry)
                .increment();
    }

    /**
     * @param errorKind simple class name of the failure (e.g. IllegalClusterException)
     */
    public void incrementFailure(String errorKind) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of pronunciations that could not be syllabified")
                .tag("error", errorKind)
                .register(registry)
                .increment();
    }

    public void recordScore(int wcm) {
        DistributionSummary.builder(METRIC_PREFIX + ".wcm")
                .description("Word Complexity Measure of analysed pronunciations")
                .register(registry)
                .record(wcm);
    }
}
