package io.errorqueue.dlq.amqp;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ShutdownSignalException;

import io.errorqueue.dlq.BrokerSession;

class AmqpBrokerSession implements BrokerSession {

    private static final Logger log = LoggerFactory.getLogger(AmqpBrokerSession.class);

    static final int PERSISTENT_DELIVERY_MODE = 2;
    static final int TRANSIENT_DELIVERY_MODE = 1;

    private final Channel channel;

    AmqpBrokerSession(Channel channel) {
        this.channel = channel;
    }

    @Override
    public void declareQueue(String queue, boolean durable, boolean exclusive, boolean autoDelete) {
        try {
            channel.queueDeclare(queue, durable, exclusive, autoDelete, null);
        } catch (IOException | ShutdownSignalException e) {
            throw AmqpFaults.interrupted(e);
        }
    }

    @Override
    public void declareDirectExchange(String exchange, boolean durable) {
        try {
            channel.exchangeDeclare(exchange, BuiltinExchangeType.DIRECT, durable);
        } catch (IOException | ShutdownSignalException e) {
            throw AmqpFaults.interrupted(e);
        }
    }

    @Override
    public void bindQueue(String queue, String exchange, String routingKey) {
        try {
            channel.queueBind(queue, exchange, routingKey);
        } catch (IOException | ShutdownSignalException e) {
            throw AmqpFaults.interrupted(e);
        }
    }

    @Override
    public void publish(String exchange, String routingKey, boolean persistent, String contentType, byte[] body) {
        AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder()
                .deliveryMode(persistent ? PERSISTENT_DELIVERY_MODE : TRANSIENT_DELIVERY_MODE)
                .contentType(contentType)
                .build();
        try {
            channel.basicPublish(exchange, routingKey, properties, body);
        } catch (IOException | ShutdownSignalException e) {
            throw AmqpFaults.interrupted(e);
        }
    }

    @Override
    public void close() {
        if (!channel.isOpen()) {
            return;
        }
        try {
            channel.close();
        } catch (IOException | TimeoutException | ShutdownSignalException e) {
            // The connection went away underneath the channel; nothing left to release.
            log.debug("Channel already closing: {}", e.getMessage());
        }
    }
}
