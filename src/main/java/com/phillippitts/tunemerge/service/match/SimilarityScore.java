package com.phillippitts.tunemerge.service.match;

/**
 * Breakdown of a fuzzy comparison between two releases. All scores are in [0,1].
 *
 * @param overall   weighted blend of artist and title similarity plus the year bonus
 * @param artist    artist-credit similarity
 * @param title     title similarity
 * @param yearMatch both releases report the same year; false when either year is unknown
 */
public record SimilarityScore(double overall, double artist, double title, boolean yearMatch) {
}
