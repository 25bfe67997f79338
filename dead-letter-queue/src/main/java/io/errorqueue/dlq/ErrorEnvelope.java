package io.errorqueue.dlq;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Diagnostic record published to the error queue for one failed delivery.
 * Carries everything needed to understand and replay the failure by hand.
 */
public class ErrorEnvelope {

    private String routingKey;
    private String exchange;
    private String exception;
    private String message;
    private LocalDateTime dateTime;
    private Map<String, Object> basicProperties = Collections.emptyMap();

    private ErrorEnvelope() {}

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Captures a failed delivery. The body is decoded as UTF-8, which is lossy for
     * binary payloads; the exception is kept with its full stack trace and causes.
     */
    public static ErrorEnvelope capture(Delivery delivery, Throwable exception) {
        return builder()
                .routingKey(delivery.getRoutingKey())
                .exchange(delivery.getExchange())
                .exception(describe(exception))
                .message(new String(delivery.getBody(), StandardCharsets.UTF_8))
                .dateTime(LocalDateTime.now())
                .basicProperties(delivery.getProperties())
                .build();
    }

    static String describe(Throwable exception) {
        if (exception == null) {
            return "null";
        }
        StringWriter out = new StringWriter();
        exception.printStackTrace(new PrintWriter(out));
        return out.toString();
    }

    public String getRoutingKey() { return routingKey; }
    public String getExchange() { return exchange; }
    public String getException() { return exception; }
    public String getMessage() { return message; }
    public LocalDateTime getDateTime() { return dateTime; }
    public Map<String, Object> getBasicProperties() { return basicProperties; }

    public static class Builder {
        private String routingKey;
        private String exchange;
        private String exception;
        private String message;
        private LocalDateTime dateTime;
        private Map<String, Object> basicProperties = Collections.emptyMap();

        public Builder routingKey(String routingKey) {
            this.routingKey = routingKey;
            return this;
        }

        public Builder exchange(String exchange) {
            this.exchange = exchange;
            return this;
        }

        public Builder exception(String exception) {
            this.exception = exception;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder dateTime(LocalDateTime dateTime) {
            this.dateTime = dateTime;
            return this;
        }

        public Builder basicProperties(Map<String, Object> basicProperties) {
            this.basicProperties = basicProperties == null
                    ? Collections.emptyMap()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(basicProperties));
            return this;
        }

        /**
         * Creates a new envelope on each call; later builder calls do not affect it.
         */
        public ErrorEnvelope build() {
            ErrorEnvelope envelope = new ErrorEnvelope();
            envelope.routingKey = routingKey;
            envelope.exchange = exchange;
            envelope.exception = exception;
            envelope.message = message;
            envelope.dateTime = dateTime;
            envelope.basicProperties = basicProperties;
            return envelope;
        }
    }
}
