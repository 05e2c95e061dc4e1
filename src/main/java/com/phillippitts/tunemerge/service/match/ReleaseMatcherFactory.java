package com.phillippitts.tunemerge.service.match;

/**
 * Creates a fresh matcher for each aggregate operation so no match state is shared between
 * concurrent callers.
 */
@FunctionalInterface
public interface ReleaseMatcherFactory {

    ReleaseMatcher create();

    static ReleaseMatcherFactory withThreshold(double similarityThreshold) {
        DefaultReleaseMatcher.requireValidThreshold(similarityThreshold);
        return () -> new DefaultReleaseMatcher(similarityThreshold);
    }
}
