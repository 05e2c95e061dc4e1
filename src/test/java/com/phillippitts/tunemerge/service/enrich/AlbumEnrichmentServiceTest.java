package com.phillippitts.tunemerge.service.enrich;

import com.phillippitts.tunemerge.domain.CanonicalAlbum;
import com.phillippitts.tunemerge.domain.MetadataSearchQuery;
import com.phillippitts.tunemerge.domain.NormalizedRelease;
import com.phillippitts.tunemerge.domain.SourceId;
import com.phillippitts.tunemerge.domain.SourceType;
import com.phillippitts.tunemerge.service.events.SourceFailureEvent;
import com.phillippitts.tunemerge.service.match.DefaultReleaseMatcher;
import com.phillippitts.tunemerge.service.metrics.SourceMetrics;
import com.phillippitts.tunemerge.service.source.MetadataSource;
import com.phillippitts.tunemerge.service.source.SourceCallExecutor;
import com.phillippitts.tunemerge.service.source.SourceManager;
import com.phillippitts.tunemerge.testutil.EventCapturingPublisher;
import com.phillippitts.tunemerge.testutil.FakeMetadataSource;
import com.phillippitts.tunemerge.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AlbumEnrichmentServiceTest {

    private static final SourceId YT = SourceId.of(SourceType.YTMUSIC, "yt-abbey");

    private SourceManager manager;
    private SourceCallExecutor calls;
    private EventCapturingPublisher publisher;

    @BeforeEach
    void setUp() {
        manager = mock(SourceManager.class);
        publisher = new EventCapturingPublisher();
        calls = new SourceCallExecutor(new SyncExecutor(), new SourceMetrics(new SimpleMeterRegistry()), publisher);
    }

    private AlbumEnrichmentService service(MetadataSource... catalogs) {
        when(manager.getAllMetadataSources()).thenReturn(List.of(catalogs));
        return new AlbumEnrichmentService(manager, calls, DefaultReleaseMatcher::new, 1);
    }

    private static CanonicalAlbum abbeyRoad() {
        return new CanonicalAlbum("local-7", "Abbey Road", "The Beatles", null, List.of(), null,
                List.of(YT), List.of());
    }

    @Test
    void mergesMatchingReleaseIntoAlbum() {
        FakeMetadataSource discogs = new FakeMetadataSource(SourceType.DISCOGS,
                NormalizedRelease.builder("Abbey Road").artist("The Beatles").year(1969)
                        .id(SourceType.DISCOGS, "d-abbey").genres("rock").artworkUrl("discogs.jpg").build());

        EnrichmentResult result = service(discogs).enrich(abbeyRoad()).join();

        assertThat(result.matched()).isTrue();
        assertThat(result.newSourceIds()).containsExactly(SourceId.of(SourceType.DISCOGS, "d-abbey"));
        CanonicalAlbum enriched = result.enriched();
        assertThat(enriched.id()).isEqualTo("local-7");
        assertThat(enriched.year()).isEqualTo(1969);
        assertThat(enriched.genres()).containsExactly("rock");
        assertThat(enriched.artworkUrl()).isEqualTo("discogs.jpg");
        assertThat(enriched.sourceIds()).containsExactly(YT, SourceId.of(SourceType.DISCOGS, "d-abbey"));
        assertThat(result.stats().fuzzyMatches()).isEqualTo(1);
    }

    @Test
    void sendsStructuredQueryWithConfiguredLimit() {
        FakeMetadataSource musicBrainz = new FakeMetadataSource(SourceType.MUSICBRAINZ);

        service(musicBrainz).enrich(abbeyRoad()).join();

        assertThat(musicBrainz.lastQuery).isEqualTo(MetadataSearchQuery.structured("Abbey Road", "The Beatles"));
        assertThat(musicBrainz.lastLimit).isEqualTo(1);
    }

    @Test
    void failingCatalogDoesNotPreventEnrichment() {
        FakeMetadataSource broken = FakeMetadataSource.failing(SourceType.MUSICBRAINZ, "503");
        FakeMetadataSource discogs = new FakeMetadataSource(SourceType.DISCOGS,
                NormalizedRelease.builder("Abbey Road").artist("Beatles").id(SourceType.DISCOGS, "d1").build());

        EnrichmentResult result = service(broken, discogs).enrich(abbeyRoad()).join();

        assertThat(result.newSourceIds()).containsExactly(SourceId.of(SourceType.DISCOGS, "d1"));
        assertThat(publisher.eventsOfType(SourceFailureEvent.class)).hasSize(1);
    }

    @Test
    void unrelatedReleaseLeavesAlbumUnchanged() {
        FakeMetadataSource discogs = new FakeMetadataSource(SourceType.DISCOGS,
                NormalizedRelease.builder("Homogenic").artist("Björk").year(1997)
                        .id(SourceType.DISCOGS, "d-homogenic").build());

        EnrichmentResult result = service(discogs).enrich(abbeyRoad()).join();

        assertThat(result.matched()).isFalse();
        assertThat(result.enriched().sourceIds()).containsExactly(YT);
        assertThat(result.stats().newEntries()).isEqualTo(2);
    }

    @Test
    void noCatalogsMeansUnmatched() {
        CanonicalAlbum album = abbeyRoad();

        EnrichmentResult result = service().enrich(album).join();

        assertThat(result).isEqualTo(EnrichmentResult.unmatched(album));
        assertThat(result.enriched()).isSameAs(album);
    }

    @Test
    void rejectsAlbumWithoutSourceIds() {
        CanonicalAlbum orphan = new CanonicalAlbum("x", "Untitled", "Nobody", null, List.of(), null,
                List.of(), List.of());
        AlbumEnrichmentService service = service(new FakeMetadataSource(SourceType.DISCOGS));

        assertThatThrownBy(() -> service.enrich(orphan))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AlbumEnrichmentService(manager, calls, DefaultReleaseMatcher::new, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
