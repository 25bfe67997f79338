package io.errorqueue.dlq.amqp;

import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.LongString;

import io.errorqueue.dlq.Delivery;

/**
 * Builds {@link Delivery} snapshots from what the RabbitMQ client hands a consumer.
 */
public final class AmqpDeliveries {

    private AmqpDeliveries() {}

    public static Delivery from(com.rabbitmq.client.Delivery delivery) {
        return from(delivery.getEnvelope(), delivery.getProperties(), delivery.getBody());
    }

    public static Delivery from(Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
        Delivery.Builder builder = Delivery.builder()
                .routingKey(envelope.getRoutingKey())
                .exchange(envelope.getExchange())
                .body(body);
        if (properties != null) {
            builder.properties(snapshot(properties));
        }
        return builder.build();
    }

    /**
     * Set properties only, in AMQP declaration order. Header values are converted to
     * plain Java types so the snapshot serializes as readable JSON.
     */
    static Map<String, Object> snapshot(AMQP.BasicProperties properties) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        putIfSet(snapshot, "contentType", properties.getContentType());
        putIfSet(snapshot, "contentEncoding", properties.getContentEncoding());
        if (properties.getHeaders() != null) {
            snapshot.put("headers", plain(properties.getHeaders()));
        }
        putIfSet(snapshot, "deliveryMode", properties.getDeliveryMode());
        putIfSet(snapshot, "priority", properties.getPriority());
        putIfSet(snapshot, "correlationId", properties.getCorrelationId());
        putIfSet(snapshot, "replyTo", properties.getReplyTo());
        putIfSet(snapshot, "expiration", properties.getExpiration());
        putIfSet(snapshot, "messageId", properties.getMessageId());
        if (properties.getTimestamp() != null) {
            snapshot.put("timestamp", properties.getTimestamp().toInstant());
        }
        putIfSet(snapshot, "type", properties.getType());
        putIfSet(snapshot, "userId", properties.getUserId());
        putIfSet(snapshot, "appId", properties.getAppId());
        putIfSet(snapshot, "clusterId", properties.getClusterId());
        return snapshot;
    }

    private static void putIfSet(Map<String, Object> snapshot, String name, Object value) {
        if (value != null) {
            snapshot.put(name, value);
        }
    }

    private static Object plain(Object value) {
        if (value instanceof LongString) {
            return value.toString();
        }
        if (value instanceof Date) {
            return ((Date) value).toInstant();
        }
        if (value instanceof Map) {
            Map<String, Object> converted = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((k, v) -> converted.put(String.valueOf(k), plain(v)));
            return converted;
        }
        if (value instanceof List) {
            List<Object> converted = new ArrayList<>();
            ((List<?>) value).forEach(v -> converted.add(plain(v)));
            return converted;
        }
        return value;
    }
}
