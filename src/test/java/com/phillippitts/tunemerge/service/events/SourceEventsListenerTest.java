package com.phillippitts.tunemerge.service.events;

import com.phillippitts.tunemerge.exception.SourceException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class SourceEventsListenerTest {

    @Test
    void throttlesRepeatLogsPerKey() {
        SourceEventsListener l = new SourceEventsListener();

        assertThat(l.shouldLog("discogs-searchReleases")).isTrue();
        assertThat(l.shouldLog("discogs-searchReleases")).isFalse();
        assertThat(l.shouldLog("ytmusic-search")).isTrue();
    }

    @Test
    void handlerDoesNotThrow() {
        SourceEventsListener l = new SourceEventsListener();
        SourceFailureEvent event = new SourceFailureEvent("discogs", "searchReleases", null, "429",
                new SourceException("429", "discogs"));

        assertThatCode(() -> {
            l.onSourceFailure(event);
            l.onSourceFailure(event);
        }).doesNotThrowAnyException();
        assertThat(event.at()).isNotNull();
    }
}
