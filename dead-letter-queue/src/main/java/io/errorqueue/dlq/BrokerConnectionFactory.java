package io.errorqueue.dlq;

import io.errorqueue.exception.BrokerException;

/**
 * Opens connections to the broker the error queue lives on.
 *
 * The endpoint getters are only used to build diagnostics when the broker cannot be
 * reached.
 */
public interface BrokerConnectionFactory {

    /**
     * @throws BrokerException of kind {@code UNREACHABLE} when no connection can be established
     */
    BrokerConnection createConnection();

    String getHost();

    String getVirtualHost();

    String getUsername();
}
