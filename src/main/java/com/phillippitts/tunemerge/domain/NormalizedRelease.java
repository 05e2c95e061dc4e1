package com.phillippitts.tunemerge.domain;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Release shape shared by every catalog, used as the unit of matching and merging.
 *
 * <p>{@code fingerprint} may be blank on input; the matcher recomputes it. {@code ids} is never
 * empty: a release always carries at least the id of the provider that reported it.
 *
 * @param year         release year, null when unknown
 * @param confidence   provider confidence in [0,1]
 * @param artworkUrl   cover image, null when unknown
 * @param sourceScores provider ranking weights, empty when none were reported
 */
public record NormalizedRelease(
        String fingerprint,
        String title,
        List<ReleaseArtist> artists,
        ReleaseType releaseType,
        Integer year,
        List<SourceId> ids,
        double confidence,
        List<String> genres,
        String artworkUrl,
        Map<SourceType, Integer> sourceScores
) {
    public NormalizedRelease {
        fingerprint = fingerprint == null ? "" : fingerprint;
        Objects.requireNonNull(title, "title");
        artists = artists == null ? List.of() : List.copyOf(artists);
        releaseType = releaseType == null ? ReleaseType.ALBUM : releaseType;
        ids = ids == null ? List.of() : List.copyOf(ids);
        if (ids.isEmpty()) {
            throw new IllegalArgumentException("release must carry at least one source id");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        genres = genres == null ? List.of() : List.copyOf(genres);
        sourceScores = sourceScores == null || sourceScores.isEmpty()
                ? Map.of()
                : Map.copyOf(sourceScores);
    }

    /** Name of the first credited artist, or empty when there is none. */
    public String primaryArtistName() {
        return artists.isEmpty() ? "" : artists.get(0).name();
    }

    public NormalizedRelease withFingerprint(String fp) {
        return new NormalizedRelease(fp, title, artists, releaseType, year, ids, confidence, genres,
                artworkUrl, sourceScores);
    }

    public static Builder builder(String title) {
        return new Builder(title);
    }

    /**
     * Fluent builder; defaults are album type, confidence 1.0 and no genres.
     */
    public static final class Builder {
        private final String title;
        private final List<ReleaseArtist> artists = new ArrayList<>();
        private final List<SourceId> ids = new ArrayList<>();
        private final List<String> genres = new ArrayList<>();
        private final Map<SourceType, Integer> sourceScores = new EnumMap<>(SourceType.class);
        private ReleaseType releaseType = ReleaseType.ALBUM;
        private Integer year;
        private double confidence = 1.0;
        private String artworkUrl;
        private String fingerprint = "";

        private Builder(String title) {
            this.title = title;
        }

        public Builder artist(String name, SourceId... artistIds) {
            artists.add(ReleaseArtist.of(name, artistIds));
            return this;
        }

        public Builder artists(List<ReleaseArtist> values) {
            artists.addAll(values);
            return this;
        }

        public Builder id(SourceType source, String id) {
            ids.add(SourceId.of(source, id));
            return this;
        }

        public Builder ids(List<SourceId> values) {
            ids.addAll(values);
            return this;
        }

        public Builder releaseType(ReleaseType type) {
            this.releaseType = type;
            return this;
        }

        public Builder year(Integer year) {
            this.year = year;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder genres(String... values) {
            genres.addAll(List.of(values));
            return this;
        }

        public Builder genres(List<String> values) {
            genres.addAll(values);
            return this;
        }

        public Builder artworkUrl(String url) {
            this.artworkUrl = url;
            return this;
        }

        public Builder sourceScore(SourceType source, int score) {
            sourceScores.put(source, score);
            return this;
        }

        public Builder fingerprint(String fingerprint) {
            this.fingerprint = fingerprint;
            return this;
        }

        public NormalizedRelease build() {
            return new NormalizedRelease(fingerprint, title, artists, releaseType, year, ids,
                    confidence, genres, artworkUrl, sourceScores);
        }
    }
}
