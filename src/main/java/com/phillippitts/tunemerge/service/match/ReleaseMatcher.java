package com.phillippitts.tunemerge.service.match;

import com.phillippitts.tunemerge.domain.NormalizedRelease;

import java.util.List;

/**
 * Order-dependent accumulator that deduplicates releases reported by different catalogs.
 *
 * <p>Each release either merges into the first entry it matches (exact fingerprint first, then
 * fuzzy similarity at or above the threshold, in insertion order) or becomes a new entry.
 * Feed the releases that should act as canonical bases first.
 *
 * <p><b>Thread Safety:</b> Not thread-safe. Create one matcher per operation and discard it.
 */
public interface ReleaseMatcher {

    /**
     * Finds the entry the release would merge into, without changing any state.
     */
    MatchResult match(NormalizedRelease release);

    /**
     * Appends the release as a new entry without matching.
     *
     * @return snapshot of the new entry
     */
    NormalizedRelease add(NormalizedRelease release);

    /**
     * Merges the release into its matching entry, or appends it when nothing matches.
     *
     * @return snapshot of the entry that now holds the release
     */
    NormalizedRelease addOrMerge(NormalizedRelease release);

    /**
     * Read-only snapshot of all entries in insertion order.
     */
    List<NormalizedRelease> getAll();

    MatcherStats getStats();
}
