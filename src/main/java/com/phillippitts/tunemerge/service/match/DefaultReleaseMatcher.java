package com.phillippitts.tunemerge.service.match;

import com.phillippitts.tunemerge.domain.NormalizedRelease;
import com.phillippitts.tunemerge.domain.ReleaseArtist;
import com.phillippitts.tunemerge.domain.ReleaseType;
import com.phillippitts.tunemerge.domain.SourceId;
import com.phillippitts.tunemerge.domain.SourceType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Default {@link ReleaseMatcher}: fingerprint index for exact matches, linear Jaro-Winkler scan
 * for fuzzy ones.
 *
 * <p><b>Matching:</b>
 * <ol>
 *   <li>Exact: the release fingerprint equals the fingerprint of an entry or of any release
 *       already merged into it</li>
 *   <li>Fuzzy: the first entry in insertion order whose {@link ReleaseSimilarity} is at or above
 *       the threshold. The first candidate wins, not the highest-scoring one.</li>
 *   <li>Otherwise a new entry is appended</li>
 * </ol>
 *
 * <p><b>Merge rules</b> (incoming release R into entry E):
 * <ul>
 *   <li>ids: union, deduplicated by source and local id, E's ids first</li>
 *   <li>genres: set union, E's genres first</li>
 *   <li>confidence: maximum</li>
 *   <li>year: taken from R only while E has none; E's fingerprint is then recomputed and
 *       indexed alongside the old one</li>
 *   <li>artwork: R's replaces E's only when R's best-ranked source has a strictly better
 *       {@link SourceType#artworkRank()} than the source that set E's current artwork</li>
 *   <li>sourceScores: key-wise union, R's values win</li>
 * </ul>
 * Title, artists and release type always stay those of the entry's first release.
 *
 * <p>Comparisons are O(n) per release, O(n²) per batch. Intended for tens of releases per query.
 */
public final class DefaultReleaseMatcher implements ReleaseMatcher {

    private static final Logger LOG = LogManager.getLogger(DefaultReleaseMatcher.class);

    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.85;

    private static final int NO_ARTWORK_RANK = Integer.MAX_VALUE;

    private final double similarityThreshold;
    private final List<Entry> entries = new ArrayList<>();
    private final Map<String, Integer> fingerprintIndex = new HashMap<>();

    private int exactMatches;
    private int fuzzyMatches;
    private int newEntries;

    public DefaultReleaseMatcher() {
        this(DEFAULT_SIMILARITY_THRESHOLD);
    }

    /**
     * @param similarityThreshold minimum overall similarity for a fuzzy match (0.0 to 1.0)
     * @throws IllegalArgumentException if threshold is not in [0,1]
     */
    public DefaultReleaseMatcher(double similarityThreshold) {
        this.similarityThreshold = requireValidThreshold(similarityThreshold);
    }

    static double requireValidThreshold(double threshold) {
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("similarity threshold in [0,1]");
        }
        return threshold;
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    @Override
    public MatchResult match(NormalizedRelease release) {
        Objects.requireNonNull(release, "release");
        Integer idx = fingerprintIndex.get(Fingerprints.of(release));
        if (idx != null) {
            return MatchResult.exact(entries.get(idx).snapshot(), idx);
        }
        for (int i = 0; i < entries.size(); i++) {
            NormalizedRelease candidate = entries.get(i).snapshot();
            SimilarityScore sim = ReleaseSimilarity.compute(release, candidate);
            if (sim.overall() >= similarityThreshold) {
                return MatchResult.fuzzy(candidate, sim, i);
            }
        }
        return MatchResult.none();
    }

    @Override
    public NormalizedRelease add(NormalizedRelease release) {
        Objects.requireNonNull(release, "release");
        Entry entry = new Entry(release);
        entries.add(entry);
        fingerprintIndex.putIfAbsent(entry.fingerprint, entries.size() - 1);
        newEntries++;
        return entry.snapshot();
    }

    @Override
    public NormalizedRelease addOrMerge(NormalizedRelease release) {
        MatchResult result = match(release);
        switch (result.type()) {
            case EXACT -> exactMatches++;
            case FUZZY -> {
                fuzzyMatches++;
                LOG.debug("Fuzzy match '{}' -> '{}' (overall={})", release.title(),
                        result.existing().title(), result.similarity().overall());
            }
            case NEW -> {
                return add(release);
            }
        }
        Entry entry = entries.get(result.index());
        entry.merge(release);
        fingerprintIndex.putIfAbsent(Fingerprints.of(release), result.index());
        fingerprintIndex.putIfAbsent(entry.fingerprint, result.index());
        return entry.snapshot();
    }

    @Override
    public List<NormalizedRelease> getAll() {
        List<NormalizedRelease> all = new ArrayList<>(entries.size());
        for (Entry e : entries) {
            all.add(e.snapshot());
        }
        return List.copyOf(all);
    }

    @Override
    public MatcherStats getStats() {
        return new MatcherStats(entries.size(), exactMatches, fuzzyMatches, newEntries);
    }

    /**
     * Best (lowest) artwork rank among the sources that reported a release.
     */
    static int artworkRank(List<SourceId> ids) {
        int best = NO_ARTWORK_RANK;
        for (SourceId id : ids) {
            best = Math.min(best, id.source().artworkRank());
        }
        return best;
    }

    /** Mutable accumulated state for one canonical release. */
    private static final class Entry {
        private String fingerprint;
        private final String title;
        private final List<ReleaseArtist> artists;
        private final ReleaseType releaseType;
        private final Map<String, SourceId> ids = new LinkedHashMap<>();
        private final Set<String> genres = new LinkedHashSet<>();
        private final Map<SourceType, Integer> sourceScores = new EnumMap<>(SourceType.class);
        private Integer year;
        private double confidence;
        private String artworkUrl;
        private int artworkRank = NO_ARTWORK_RANK;

        Entry(NormalizedRelease base) {
            this.fingerprint = Fingerprints.of(base);
            this.title = base.title();
            this.artists = base.artists();
            this.releaseType = base.releaseType();
            this.year = base.year();
            this.confidence = base.confidence();
            for (SourceId id : base.ids()) {
                ids.putIfAbsent(id.key(), id);
            }
            genres.addAll(base.genres());
            sourceScores.putAll(base.sourceScores());
            if (base.artworkUrl() != null) {
                this.artworkUrl = base.artworkUrl();
                this.artworkRank = artworkRank(base.ids());
            }
        }

        void merge(NormalizedRelease incoming) {
            for (SourceId id : incoming.ids()) {
                ids.putIfAbsent(id.key(), id);
            }
            genres.addAll(incoming.genres());
            sourceScores.putAll(incoming.sourceScores());
            confidence = Math.max(confidence, incoming.confidence());
            if (year == null && incoming.year() != null) {
                year = incoming.year();
                fingerprint = Fingerprints.generate(Fingerprints.artistCredit(artists), title, year);
            }
            if (incoming.artworkUrl() != null) {
                int incomingRank = artworkRank(incoming.ids());
                if (artworkUrl == null || incomingRank < artworkRank) {
                    artworkUrl = incoming.artworkUrl();
                    artworkRank = incomingRank;
                }
            }
        }

        NormalizedRelease snapshot() {
            return new NormalizedRelease(fingerprint, title, artists, releaseType, year,
                    new ArrayList<>(ids.values()), confidence, new ArrayList<>(genres), artworkUrl,
                    sourceScores);
        }
    }
}
