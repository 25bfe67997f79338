package io.errorqueue.exception;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class for all error queue exceptions.
 *
 * Provides:
 * - Error code for programmatic handling
 * - Structured context for debugging
 * - Timestamp for correlation with broker logs
 */
public abstract class ErrorQueueException extends RuntimeException {

    private final String code;
    private final Map<String, Object> context;
    private final Instant timestamp;

    protected ErrorQueueException(String code, String message) {
        super(message);
        this.code = code;
        this.context = new LinkedHashMap<>();
        this.timestamp = Instant.now();
    }

    protected ErrorQueueException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.context = new LinkedHashMap<>();
        this.timestamp = Instant.now();
    }

    /**
     * Add contextual information for debugging.
     * Fluent API for chaining. Null values are skipped.
     */
    public ErrorQueueException with(String key, Object value) {
        if (value != null) {
            this.context.put(key, value);
        }
        return this;
    }

    public String getCode() {
        return code;
    }

    public Map<String, Object> getContext() {
        return Map.copyOf(context);
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}
