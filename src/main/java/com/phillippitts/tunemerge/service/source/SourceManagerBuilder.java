package com.phillippitts.tunemerge.service.source;

import com.phillippitts.tunemerge.service.match.DefaultReleaseMatcher;
import com.phillippitts.tunemerge.service.match.ReleaseMatcherFactory;
import com.phillippitts.tunemerge.service.metrics.SourceMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.context.ApplicationEventPublisher;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Builder for {@link DefaultSourceManager}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SourceManager manager = SourceManagerBuilder.builder()
 *     .sources(List.of(ytMusic, bandcamp))
 *     .metadataSources(List.of(discogs, musicBrainz))
 *     .executor(sourceExecutor)
 *     .matcherFactory(ReleaseMatcherFactory.withThreshold(0.9))
 *     .publisher(publisher)
 *     .metrics(metrics)
 *     .build();
 * }</pre>
 *
 * <p>Only the executor is required. Defaults: no sources, the default matcher threshold,
 * a metadata limit of {@value #DEFAULT_METADATA_LIMIT}, a publisher that drops events and
 * metrics backed by a {@link SimpleMeterRegistry}.
 */
public final class SourceManagerBuilder {

    public static final int DEFAULT_METADATA_LIMIT = 10;

    private final List<Source> sources = new ArrayList<>();
    private final List<MetadataSource> metadataSources = new ArrayList<>();
    private Executor executor;
    private ReleaseMatcherFactory matcherFactory;
    private int metadataLimit = DEFAULT_METADATA_LIMIT;
    private ApplicationEventPublisher publisher;
    private SourceMetrics metrics;

    private SourceManagerBuilder() {
        // Private constructor - use builder() factory method
    }

    public static SourceManagerBuilder builder() {
        return new SourceManagerBuilder();
    }

    /**
     * Appends primary sources; registration order is preserved.
     */
    public SourceManagerBuilder sources(List<? extends Source> values) {
        values.forEach(s -> sources.add(Objects.requireNonNull(s, "source")));
        return this;
    }

    public SourceManagerBuilder source(Source source) {
        sources.add(Objects.requireNonNull(source, "source"));
        return this;
    }

    public SourceManagerBuilder metadataSources(List<? extends MetadataSource> values) {
        values.forEach(s -> metadataSources.add(Objects.requireNonNull(s, "metadataSource")));
        return this;
    }

    public SourceManagerBuilder metadataSource(MetadataSource source) {
        metadataSources.add(Objects.requireNonNull(source, "metadataSource"));
        return this;
    }

    /**
     * @param executor executor that runs source calls (required)
     */
    public SourceManagerBuilder executor(Executor executor) {
        this.executor = executor;
        return this;
    }

    public SourceManagerBuilder matcherFactory(ReleaseMatcherFactory matcherFactory) {
        this.matcherFactory = matcherFactory;
        return this;
    }

    /**
     * @param metadataLimit releases requested from each metadata source per search (positive)
     */
    public SourceManagerBuilder metadataLimit(int metadataLimit) {
        this.metadataLimit = metadataLimit;
        return this;
    }

    public SourceManagerBuilder publisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
        return this;
    }

    public SourceManagerBuilder metrics(SourceMetrics metrics) {
        this.metrics = metrics;
        return this;
    }

    /**
     * @throws NullPointerException if no executor was set
     * @throws IllegalArgumentException if the metadata limit is not positive
     */
    public DefaultSourceManager build() {
        Objects.requireNonNull(executor, "executor is required");

        SourceMetrics effectiveMetrics = metrics != null
                ? metrics
                : new SourceMetrics(new SimpleMeterRegistry());
        ApplicationEventPublisher effectivePublisher = publisher != null
                ? publisher
                : event -> { };
        ReleaseMatcherFactory effectiveFactory = matcherFactory != null
                ? matcherFactory
                : DefaultReleaseMatcher::new;

        SourceCallExecutor calls = new SourceCallExecutor(executor, effectiveMetrics, effectivePublisher);
        return new DefaultSourceManager(sources, metadataSources, calls, effectiveFactory,
                metadataLimit, effectiveMetrics);
    }
}
