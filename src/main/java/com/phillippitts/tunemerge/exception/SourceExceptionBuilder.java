package com.phillippitts.tunemerge.exception;

import com.phillippitts.tunemerge.domain.SourceType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link SourceException} with contextual details.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw SourceExceptionBuilder.create("Search request failed")
 *         .source(SourceType.DISCOGS)
 *         .status(429)
 *         .operation("searchReleases")
 *         .metadata("query", query)
 *         .cause(e)
 *         .build();
 * </pre>
 *
 * <p>The final message format is
 * {@code {message} (status={code}, operation={op}, {key}={value}, ...) (source: {key})}.
 */
public final class SourceExceptionBuilder {

    private final String message;
    private String sourceKey;
    private Throwable cause;
    private Integer status;
    private String operation;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private SourceExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static SourceExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new SourceExceptionBuilder(message);
    }

    public SourceExceptionBuilder source(SourceType source) {
        this.sourceKey = source == null ? null : source.key();
        return this;
    }

    public SourceExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Sets the upstream response status (for HTTP-backed catalogs).
     */
    public SourceExceptionBuilder status(int status) {
        this.status = status;
        return this;
    }

    public SourceExceptionBuilder operation(String operation) {
        this.operation = operation;
        return this;
    }

    /**
     * Adds a key-value detail; null keys or values are ignored.
     */
    public SourceExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public SourceException build() {
        String detailedMessage = buildDetailedMessage();
        String source = sourceKey != null ? sourceKey : "unknown";
        if (cause != null) {
            return new SourceException(detailedMessage, source, cause);
        }
        return new SourceException(detailedMessage, source);
    }

    private String buildDetailedMessage() {
        StringBuilder details = new StringBuilder();
        if (status != null) {
            details.append("status=").append(status);
        }
        if (operation != null) {
            appendSeparator(details);
            details.append("operation=").append(operation);
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            appendSeparator(details);
            details.append(entry.getKey()).append('=').append(entry.getValue());
        }
        if (details.length() == 0) {
            return message;
        }
        return message + " (" + details + ")";
    }

    private static void appendSeparator(StringBuilder sb) {
        if (sb.length() > 0) {
            sb.append(", ");
        }
    }
}
