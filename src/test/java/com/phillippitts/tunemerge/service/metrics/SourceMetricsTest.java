package com.phillippitts.tunemerge.service.metrics;

import com.phillippitts.tunemerge.service.match.MatcherStats;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class SourceMetricsTest {

    private MeterRegistry registry;
    private SourceMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new SourceMetrics(registry);
    }

    @Test
    void shouldRecordLatencyPerSourceAndOperation() {
        metrics.recordLatency("ytmusic", "search", TimeUnit.MILLISECONDS.toNanos(100));
        metrics.recordLatency("ytmusic", "search", TimeUnit.MILLISECONDS.toNanos(150));
        metrics.recordLatency("discogs", "searchReleases", TimeUnit.MILLISECONDS.toNanos(300));

        Timer timer = registry.find("tunemerge.source.latency")
                .tag("source", "ytmusic")
                .tag("operation", "search")
                .timer();

        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(2);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(250);
    }

    @Test
    void shouldIncrementSuccessCounter() {
        metrics.incrementSuccess("pandora", "listPlaylists");
        metrics.incrementSuccess("pandora", "listPlaylists");

        Counter counter = registry.find("tunemerge.source.success")
                .tag("source", "pandora")
                .tag("operation", "listPlaylists")
                .counter();

        assertThat(counter).isNotNull();
        assertThat(counter.count()).isEqualTo(2.0);
    }

    @Test
    void shouldIsolateFailureCountersByReason() {
        metrics.incrementFailure("discogs", "searchReleases", "source-error");
        metrics.incrementFailure("discogs", "searchReleases", "source-error");
        metrics.incrementFailure("discogs", "searchReleases", "unexpected");

        Counter sourceErrors = registry.find("tunemerge.source.failure")
                .tag("source", "discogs")
                .tag("reason", "source-error")
                .counter();
        Counter unexpected = registry.find("tunemerge.source.failure")
                .tag("source", "discogs")
                .tag("reason", "unexpected")
                .counter();

        assertThat(sourceErrors).isNotNull();
        assertThat(sourceErrors.count()).isEqualTo(2.0);
        assertThat(unexpected).isNotNull();
        assertThat(unexpected.count()).isEqualTo(1.0);
    }

    @Test
    void shouldAccumulateMatchOutcomes() {
        metrics.recordMatchStats(new MatcherStats(3, 1, 2, 3));
        metrics.recordMatchStats(new MatcherStats(1, 0, 0, 1));

        assertThat(registry.get("tunemerge.match.result").tag("type", "exact").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("tunemerge.match.result").tag("type", "fuzzy").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("tunemerge.match.result").tag("type", "new").counter().count()).isEqualTo(4.0);
    }
}
