package com.phillippitts.tunemerge.service.source;

import com.phillippitts.tunemerge.exception.SourceException;
import com.phillippitts.tunemerge.service.events.SourceFailureEvent;
import com.phillippitts.tunemerge.service.metrics.SourceMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Runs blocking source calls on the source executor with timing and failure accounting.
 *
 * <p>Two join flavours:
 * <ul>
 *   <li>{@link #call}: the returned future completes with the source's result or fails with
 *       its original exception</li>
 *   <li>{@link #settle}: the returned future always completes normally. A failure is logged,
 *       published as a {@link SourceFailureEvent} and turned into an empty result, so sibling
 *       calls joined with {@code allOf} are unaffected</li>
 * </ul>
 */
public class SourceCallExecutor {
    private static final Logger LOG = LogManager.getLogger(SourceCallExecutor.class);

    static final String REASON_SOURCE_ERROR = "source-error";
    static final String REASON_UNEXPECTED = "unexpected";

    private final Executor executor;
    private final SourceMetrics metrics;
    private final ApplicationEventPublisher publisher;

    public SourceCallExecutor(Executor executor, SourceMetrics metrics, ApplicationEventPublisher publisher) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    /**
     * Runs the call asynchronously and propagates its outcome unchanged.
     */
    public <T> CompletableFuture<T> call(Source source, String operation, Supplier<T> call) {
        return CompletableFuture.supplyAsync(() -> invoke(source, operation, call), executor);
    }

    /**
     * Runs the call asynchronously; a failure or null result yields an empty optional.
     */
    public <T> CompletableFuture<Optional<T>> settle(Source source, String operation, Supplier<T> call) {
        return call(source, operation, call).handle((value, error) -> {
            if (error == null) {
                return Optional.ofNullable(value);
            }
            Throwable cause = unwrap(error);
            String key = source.getType().key();
            if (cause instanceof SourceException) {
                LOG.warn("{} {} failed: {}", key, operation, cause.getMessage());
            } else {
                LOG.error("{} {} unexpected error", key, operation, cause);
            }
            publisher.publishEvent(new SourceFailureEvent(key, operation, null,
                    String.valueOf(cause.getMessage()), cause));
            return Optional.empty();
        });
    }

    private <T> T invoke(Source source, String operation, Supplier<T> call) {
        String key = source.getType().key();
        long t0 = System.nanoTime();
        try {
            T result = call.get();
            metrics.incrementSuccess(key, operation);
            return result;
        } catch (SourceException se) {
            metrics.incrementFailure(key, operation, REASON_SOURCE_ERROR);
            throw se;
        } catch (RuntimeException re) {
            metrics.incrementFailure(key, operation, REASON_UNEXPECTED);
            throw re;
        } finally {
            metrics.recordLatency(key, operation, System.nanoTime() - t0);
        }
    }

    static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
