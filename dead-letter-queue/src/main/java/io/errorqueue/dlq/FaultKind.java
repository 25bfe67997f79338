package io.errorqueue.dlq;

import io.errorqueue.exception.BrokerException;

/**
 * Classification of everything that can go wrong while redirecting a failed delivery.
 */
public enum FaultKind {

    /** No connection could be established. */
    UNREACHABLE_BROKER,

    /** The connection or channel was closed during declare or publish. */
    OPERATION_INTERRUPTED,

    /** Anything else: serialization, resource exhaustion, programming errors. */
    UNEXPECTED;

    public static FaultKind classify(Throwable fault) {
        if (fault instanceof BrokerException) {
            return switch (((BrokerException) fault).getKind()) {
                case UNREACHABLE -> UNREACHABLE_BROKER;
                case INTERRUPTED -> OPERATION_INTERRUPTED;
            };
        }
        return UNEXPECTED;
    }
}
