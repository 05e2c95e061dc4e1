package com.phillippitts.tunemerge.config.source;

import com.phillippitts.tunemerge.config.properties.MatcherProperties;
import com.phillippitts.tunemerge.config.properties.SearchProperties;
import com.phillippitts.tunemerge.service.enrich.AlbumEnrichmentService;
import com.phillippitts.tunemerge.service.match.ReleaseMatcherFactory;
import com.phillippitts.tunemerge.service.metrics.SourceMetrics;
import com.phillippitts.tunemerge.service.source.MetadataSource;
import com.phillippitts.tunemerge.service.source.Source;
import com.phillippitts.tunemerge.service.source.SourceCallExecutor;
import com.phillippitts.tunemerge.service.source.SourceManager;
import com.phillippitts.tunemerge.service.source.SourceManagerBuilder;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Wires every {@link Source} and {@link MetadataSource} bean in the context into the
 * {@link SourceManager}. Registration order follows bean order ({@code @Order} or
 * {@code Ordered}). Beans implementing {@link MetadataSource} are registered as metadata
 * sources only.
 */
@Configuration
public class SourceManagerConfig {

    @Bean
    public ReleaseMatcherFactory releaseMatcherFactory(MatcherProperties props) {
        return ReleaseMatcherFactory.withThreshold(props.getSimilarityThreshold());
    }

    @Bean
    public SourceCallExecutor sourceCallExecutor(@Qualifier("sourceExecutor") Executor executor,
                                                 SourceMetrics metrics,
                                                 ApplicationEventPublisher publisher) {
        return new SourceCallExecutor(executor, metrics, publisher);
    }

    @Bean
    public SourceManager sourceManager(ObjectProvider<Source> sourceBeans,
                                       @Qualifier("sourceExecutor") Executor executor,
                                       ReleaseMatcherFactory matcherFactory,
                                       SearchProperties searchProperties,
                                       SourceMetrics metrics,
                                       ApplicationEventPublisher publisher) {
        List<Source> primary = new ArrayList<>();
        List<MetadataSource> metadata = new ArrayList<>();
        sourceBeans.orderedStream().forEach(source -> {
            if (source instanceof MetadataSource m) {
                metadata.add(m);
            } else {
                primary.add(source);
            }
        });
        return SourceManagerBuilder.builder()
                .sources(primary)
                .metadataSources(metadata)
                .executor(executor)
                .matcherFactory(matcherFactory)
                .metadataLimit(searchProperties.getMetadataLimit())
                .publisher(publisher)
                .metrics(metrics)
                .build();
    }

    @Bean
    public AlbumEnrichmentService albumEnrichmentService(SourceManager sourceManager,
                                                         SourceCallExecutor sourceCallExecutor,
                                                         ReleaseMatcherFactory matcherFactory,
                                                         SearchProperties searchProperties) {
        return new AlbumEnrichmentService(sourceManager, sourceCallExecutor, matcherFactory,
                searchProperties.getEnrichmentLimit());
    }
}
