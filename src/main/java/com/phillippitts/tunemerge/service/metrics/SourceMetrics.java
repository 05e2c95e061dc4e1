package com.phillippitts.tunemerge.service.metrics;

import com.phillippitts.tunemerge.service.match.MatcherStats;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for source calls and release matching.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Latency per source and operation</li>
 *   <li>Success/failure counts per source and operation</li>
 *   <li>Match outcomes (exact, fuzzy, new) per aggregate search</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class SourceMetrics {

    private static final String METRIC_PREFIX = "tunemerge.source";
    private static final String MATCH_RESULT = "tunemerge.match.result";

    private final MeterRegistry registry;

    public SourceMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records call latency for a source operation.
     *
     * @param source        source key (ytmusic, discogs, ...)
     * @param operation     capability method (search, searchReleases, ...)
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(String source, String operation, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken by a source call")
                .tag("source", source)
                .tag("operation", operation)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess(String source, String operation) {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of successful source calls")
                .tag("source", source)
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    /**
     * @param reason failure reason (source-error, unexpected)
     */
    public void incrementFailure(String source, String operation, String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed source calls")
                .tag("source", source)
                .tag("operation", operation)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Adds one matcher's decision counts to the match result counters.
     */
    public void recordMatchStats(MatcherStats stats) {
        matchCounter("exact").increment(stats.exactMatches());
        matchCounter("fuzzy").increment(stats.fuzzyMatches());
        matchCounter("new").increment(stats.newEntries());
    }

    private Counter matchCounter(String type) {
        return Counter.builder(MATCH_RESULT)
                .description("Number of releases by match outcome")
                .tag("type", type)
                .register(registry);
    }
}
