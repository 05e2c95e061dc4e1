package com.phillippitts.tunemerge.service.events;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Logs dropped source contributions. Throttled per source and operation to avoid log spam
 * when a catalog is down.
 */
@Component
class SourceEventsListener {
    private static final Logger LOG = LogManager.getLogger(SourceEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onSourceFailure(SourceFailureEvent e) {
        String key = e.source() + '-' + e.operation();
        if (shouldLog(key)) {
            LOG.warn("Source {} dropped from {}: {}. Check credentials and connectivity.",
                    e.source(), e.operation(), e.message());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
