package io.errorqueue.dlq;

/**
 * Per-call channel over a {@link BrokerConnection}.
 *
 * Every operation may throw {@link io.errorqueue.exception.BrokerException} of kind
 * {@code INTERRUPTED} when the broker closes the channel or connection mid-operation.
 */
public interface BrokerSession extends AutoCloseable {

    void declareQueue(String queue, boolean durable, boolean exclusive, boolean autoDelete);

    void declareDirectExchange(String exchange, boolean durable);

    void bindQueue(String queue, String exchange, String routingKey);

    void publish(String exchange, String routingKey, boolean persistent, String contentType, byte[] body);

    @Override
    void close();
}
