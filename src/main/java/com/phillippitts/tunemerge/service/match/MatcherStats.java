package com.phillippitts.tunemerge.service.match;

/**
 * Counters of a matcher's decisions. {@code total} is the number of entries held.
 */
public record MatcherStats(int total, int exactMatches, int fuzzyMatches, int newEntries) {
}
