package io.errorqueue.exception;

import java.util.Objects;

/**
 * Broker connectivity failures, classified at the client boundary.
 *
 * {@link Kind#UNREACHABLE} is raised when a connection cannot be established at all;
 * {@link Kind#INTERRUPTED} when an established connection or channel is closed by the
 * broker in the middle of an operation.
 */
public class BrokerException extends TechnicalException {

    public enum Kind {
        UNREACHABLE,
        INTERRUPTED
    }

    private final Kind kind;
    private final String reason;

    public BrokerException(Kind kind, String message, String reason, Throwable cause) {
        super("BROKER_" + Objects.requireNonNull(kind, "kind").name(), message, cause);
        this.kind = kind;
        this.reason = reason;
    }

    public static BrokerException unreachable(String host, String virtualHost, String username, Throwable cause) {
        BrokerException exception = new BrokerException(
                Kind.UNREACHABLE,
                String.format("Broker at '%s' (virtual host '%s') is unreachable", host, virtualHost),
                cause == null ? null : cause.getMessage(),
                cause
        );
        exception.with("host", host);
        exception.with("virtualHost", virtualHost);
        exception.with("username", username);
        return exception;
    }

    public static BrokerException interrupted(String reason, Throwable cause) {
        return new BrokerException(
                Kind.INTERRUPTED,
                "Broker operation interrupted: " + reason,
                reason,
                cause
        );
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Reason reported by the broker or the client library, may be null.
     */
    public String getReason() {
        return reason;
    }
}
