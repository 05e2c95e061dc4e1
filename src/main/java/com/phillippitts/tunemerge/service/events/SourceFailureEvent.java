package com.phillippitts.tunemerge.service.events;

import java.time.Instant;

/**
 * Published when a source call fails during an aggregate operation and the source's
 * contribution is dropped.
 *
 * <p>PII note: do not put query text in {@code message}. Restrict to technical diagnostics.
 *
 * @param source    source key, e.g. "discogs"
 * @param operation capability method that failed, e.g. "search"
 */
public record SourceFailureEvent(
        String source,
        String operation,
        Instant at,
        String message,
        Throwable cause
) {
    public SourceFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
