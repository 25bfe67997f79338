package io.errorqueue.dlq.amqp;

import com.rabbitmq.client.ShutdownSignalException;

import io.errorqueue.exception.BrokerException;

/**
 * Maps client library failures during channel operations to broker interruptions.
 */
final class AmqpFaults {

    private AmqpFaults() {}

    static BrokerException interrupted(Exception e) {
        ShutdownSignalException signal = shutdownSignalOf(e);
        String reason = signal != null ? signal.getMessage() : e.getMessage();
        return BrokerException.interrupted(reason, e);
    }

    private static ShutdownSignalException shutdownSignalOf(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof ShutdownSignalException) {
                return (ShutdownSignalException) current;
            }
            current = current.getCause();
        }
        return null;
    }
}
