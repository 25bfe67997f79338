package io.errorqueue.dlq.amqp;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ShutdownSignalException;

import io.errorqueue.dlq.BrokerConnection;
import io.errorqueue.dlq.BrokerSession;
import io.errorqueue.exception.BrokerException;

class AmqpBrokerConnection implements BrokerConnection {

    private static final Logger log = LoggerFactory.getLogger(AmqpBrokerConnection.class);

    private final Connection connection;

    AmqpBrokerConnection(Connection connection) {
        this.connection = connection;
    }

    @Override
    public boolean isOpen() {
        return connection.isOpen();
    }

    @Override
    public BrokerSession openSession() {
        try {
            Channel channel = connection.createChannel();
            if (channel == null) {
                throw BrokerException.interrupted("no channel available on connection " + connection, null);
            }
            return new AmqpBrokerSession(channel);
        } catch (IOException | ShutdownSignalException e) {
            throw AmqpFaults.interrupted(e);
        }
    }

    @Override
    public void close() {
        if (!connection.isOpen()) {
            return;
        }
        try {
            connection.close();
        } catch (IOException | ShutdownSignalException e) {
            log.debug("Connection already closing: {}", e.getMessage());
        }
    }
}
