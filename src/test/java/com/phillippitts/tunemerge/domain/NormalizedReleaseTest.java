package com.phillippitts.tunemerge.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NormalizedReleaseTest {

    @Test
    void builderAppliesDefaults() {
        NormalizedRelease release = NormalizedRelease.builder("OK Computer")
                .artist("Radiohead")
                .id(SourceType.MUSICBRAINZ, "mb1")
                .build();

        assertThat(release.releaseType()).isEqualTo(ReleaseType.ALBUM);
        assertThat(release.confidence()).isEqualTo(1.0);
        assertThat(release.fingerprint()).isEmpty();
        assertThat(release.genres()).isEmpty();
        assertThat(release.sourceScores()).isEmpty();
        assertThat(release.year()).isNull();
        assertThat(release.primaryArtistName()).isEqualTo("Radiohead");
    }

    @Test
    void requiresAtLeastOneSourceId() {
        assertThatThrownBy(() -> NormalizedRelease.builder("OK Computer").artist("Radiohead").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("source id");
    }

    @Test
    void rejectsConfidenceOutsideUnitInterval() {
        assertThatThrownBy(() -> NormalizedRelease.builder("OK Computer")
                .id(SourceType.DISCOGS, "d1")
                .confidence(1.2)
                .build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void withFingerprintKeepsOtherFields() {
        NormalizedRelease release = NormalizedRelease.builder("OK Computer")
                .artist("Radiohead")
                .year(1997)
                .id(SourceType.DISCOGS, "d1")
                .genres(List.of("alternative"))
                .build();

        NormalizedRelease stamped = release.withFingerprint("radiohead::ok computer::1997");

        assertThat(stamped.fingerprint()).isEqualTo("radiohead::ok computer::1997");
        assertThat(stamped.withFingerprint("")).isEqualTo(release);
    }

    @Test
    void releaseWithoutArtistsHasEmptyPrimaryName() {
        NormalizedRelease release = NormalizedRelease.builder("Untitled").id(SourceType.LOCAL, "f1").build();

        assertThat(release.primaryArtistName()).isEmpty();
        assertThat(ReleaseType.fromLabel("ep")).isEqualTo(ReleaseType.EP);
        assertThat(ReleaseType.fromLabel("mixtape")).isEqualTo(ReleaseType.OTHER);
    }
}
