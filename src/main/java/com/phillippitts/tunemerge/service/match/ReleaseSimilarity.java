package com.phillippitts.tunemerge.service.match;

import com.phillippitts.tunemerge.domain.NormalizedRelease;

/**
 * Fuzzy similarity between two releases.
 *
 * <p>{@code overall = 0.45 * artist + 0.55 * title}, plus a flat {@value #YEAR_BONUS} (capped at 1)
 * when both sides report the same year. Artist and title are compared with Jaro-Winkler after
 * {@link Fingerprints} normalization; the artist side uses the full credit of each release.
 */
public final class ReleaseSimilarity {

    static final double ARTIST_WEIGHT = 0.45;
    static final double TITLE_WEIGHT = 0.55;
    static final double YEAR_BONUS = 0.05;

    private ReleaseSimilarity() {
        // Utility class - prevent instantiation
    }

    public static SimilarityScore compute(NormalizedRelease a, NormalizedRelease b) {
        String artistA = Fingerprints.normalizeArtist(Fingerprints.artistCredit(a.artists()));
        String artistB = Fingerprints.normalizeArtist(Fingerprints.artistCredit(b.artists()));
        String titleA = Fingerprints.normalize(a.title());
        String titleB = Fingerprints.normalize(b.title());

        double artistSim = JaroWinkler.similarity(artistA, artistB);
        double titleSim = JaroWinkler.similarity(titleA, titleB);
        boolean yearMatch = a.year() != null && a.year().equals(b.year());

        double base = artistSim * ARTIST_WEIGHT + titleSim * TITLE_WEIGHT;
        double overall = yearMatch ? Math.min(1.0, base + YEAR_BONUS) : base;
        return new SimilarityScore(overall, artistSim, titleSim, yearMatch);
    }
}
