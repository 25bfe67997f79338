package io.errorqueue.dlq.amqp;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;

import io.errorqueue.dlq.BrokerConnection;
import io.errorqueue.dlq.BrokerConnectionFactory;
import io.errorqueue.exception.BrokerException;
import io.errorqueue.exception.ConfigurationException;

/**
 * Opens RabbitMQ connections for the error reporter.
 *
 * Automatic recovery of the client library is switched off: the reporter notices a
 * closed connection on the next failure and opens a new one itself.
 */
public class AmqpConnectionFactory implements BrokerConnectionFactory {

    private static final Logger log = LoggerFactory.getLogger(AmqpConnectionFactory.class);

    public static final String DEFAULT_CONNECTION_NAME = "error-queue-reporter";

    private final ConnectionFactory factory;
    private final String connectionName;

    public AmqpConnectionFactory(ConnectionFactory factory) {
        this(factory, DEFAULT_CONNECTION_NAME);
    }

    public AmqpConnectionFactory(ConnectionFactory factory, String connectionName) {
        this.factory = factory;
        this.connectionName = connectionName;
        factory.setAutomaticRecoveryEnabled(false);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public BrokerConnection createConnection() {
        try {
            Connection connection = factory.newConnection(connectionName);
            log.info("Opened error reporter connection to {}:{}{}",
                    factory.getHost(), factory.getPort(), factory.getVirtualHost());
            return new AmqpBrokerConnection(connection);
        } catch (IOException | TimeoutException e) {
            throw BrokerException.unreachable(getHost(), getVirtualHost(), getUsername(), e);
        }
    }

    @Override
    public String getHost() {
        return factory.getHost();
    }

    @Override
    public String getVirtualHost() {
        return factory.getVirtualHost();
    }

    @Override
    public String getUsername() {
        return factory.getUsername();
    }

    public int getPort() {
        return factory.getPort();
    }

    public static class Builder {
        private String host = ConnectionFactory.DEFAULT_HOST;
        private int port = ConnectionFactory.DEFAULT_AMQP_PORT;
        private String virtualHost = ConnectionFactory.DEFAULT_VHOST;
        private String username = ConnectionFactory.DEFAULT_USER;
        private String password = ConnectionFactory.DEFAULT_PASS;
        private int connectionTimeoutMs = ConnectionFactory.DEFAULT_CONNECTION_TIMEOUT;
        private int handshakeTimeoutMs = ConnectionFactory.DEFAULT_HANDSHAKE_TIMEOUT;
        private String connectionName = DEFAULT_CONNECTION_NAME;

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder virtualHost(String virtualHost) {
            this.virtualHost = virtualHost;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder connectionTimeoutMs(int connectionTimeoutMs) {
            this.connectionTimeoutMs = connectionTimeoutMs;
            return this;
        }

        public Builder handshakeTimeoutMs(int handshakeTimeoutMs) {
            this.handshakeTimeoutMs = handshakeTimeoutMs;
            return this;
        }

        public Builder connectionName(String connectionName) {
            this.connectionName = connectionName;
            return this;
        }

        public AmqpConnectionFactory build() {
            if (host == null || host.isBlank()) {
                throw ConfigurationException.blank("host");
            }
            if (port < 1 || port > 65535) {
                throw ConfigurationException.outOfRange("port", port, 1, 65535);
            }
            if (connectionTimeoutMs < 0) {
                throw ConfigurationException.outOfRange("connectionTimeoutMs", connectionTimeoutMs, 0, Integer.MAX_VALUE);
            }
            if (handshakeTimeoutMs < 0) {
                throw ConfigurationException.outOfRange("handshakeTimeoutMs", handshakeTimeoutMs, 0, Integer.MAX_VALUE);
            }

            ConnectionFactory factory = new ConnectionFactory();
            factory.setHost(host);
            factory.setPort(port);
            factory.setVirtualHost(virtualHost);
            factory.setUsername(username);
            factory.setPassword(password);
            factory.setConnectionTimeout(connectionTimeoutMs);
            factory.setHandshakeTimeout(handshakeTimeoutMs);
            return new AmqpConnectionFactory(factory, connectionName);
        }
    }
}
