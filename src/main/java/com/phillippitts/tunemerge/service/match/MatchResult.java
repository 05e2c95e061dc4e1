package com.phillippitts.tunemerge.service.match;

import com.phillippitts.tunemerge.domain.NormalizedRelease;

import java.util.Objects;

/**
 * Outcome of comparing a release against a matcher's entries.
 *
 * @param type       how the release matched
 * @param existing   snapshot of the matched entry, null for {@link Type#NEW}
 * @param similarity fuzzy score, only set for {@link Type#FUZZY}
 * @param index      position of the matched entry, -1 for {@link Type#NEW}
 */
public record MatchResult(Type type, NormalizedRelease existing, SimilarityScore similarity, int index) {

    public enum Type { EXACT, FUZZY, NEW }

    public MatchResult {
        Objects.requireNonNull(type, "type");
    }

    static MatchResult exact(NormalizedRelease existing, int index) {
        return new MatchResult(Type.EXACT, existing, null, index);
    }

    static MatchResult fuzzy(NormalizedRelease existing, SimilarityScore similarity, int index) {
        return new MatchResult(Type.FUZZY, existing, similarity, index);
    }

    static MatchResult none() {
        return new MatchResult(Type.NEW, null, null, -1);
    }
}
