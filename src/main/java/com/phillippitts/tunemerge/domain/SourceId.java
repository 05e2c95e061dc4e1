package com.phillippitts.tunemerge.domain;

import java.util.Objects;

/**
 * Provider-scoped identity of a record: which catalog reported it and under which local id.
 * Two ids are the same anchor only when both parts are equal.
 */
public record SourceId(SourceType source, String id) {

    public SourceId {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(id, "id");
    }

    public static SourceId of(SourceType source, String id) {
        return new SourceId(source, id);
    }

    /** Key used for de-duplication, e.g. {@code "discogs:123"}. */
    public String key() {
        return source.key() + ':' + id;
    }
}
