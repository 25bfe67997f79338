package io.errorqueue.dlq;

/**
 * What happens to the declaration state when a closed connection is replaced.
 */
public enum ReconnectPolicy {

    /**
     * Declarations survive reconnection. The error queue and exchange are assumed to
     * still exist on the broker; if they were deleted externally, publishes go to an
     * unbound exchange (or fail) until the process restarts.
     */
    KEEP_DECLARATIONS,

    /**
     * Declarations are redone once on the first handled failure after a reconnect.
     */
    REDECLARE
}
