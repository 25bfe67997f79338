package io.errorqueue.dlq;

/**
 * A long-lived broker connection, shared by all threads reporting errors.
 */
public interface BrokerConnection extends AutoCloseable {

    boolean isOpen();

    /**
     * Opens a session for a single declare/publish sequence. Sessions are not shared
     * between threads.
     *
     * @throws io.errorqueue.exception.BrokerException of kind {@code INTERRUPTED} if the
     *         connection was closed underneath us
     */
    BrokerSession openSession();

    @Override
    void close();
}
