package io.errorqueue.dlq;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A message handed to a consumer callback: where it was routed from, its raw body and
 * a snapshot of the broker-level properties it carried.
 *
 * Immutable. The body is copied on the way in and on the way out.
 */
public final class Delivery {

    private final String routingKey;
    private final String exchange;
    private final byte[] body;
    private final Map<String, Object> properties;

    private Delivery(Builder builder) {
        this.routingKey = builder.routingKey;
        this.exchange = builder.exchange;
        this.body = builder.body == null ? new byte[0] : builder.body.clone();
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(builder.properties));
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getRoutingKey() { return routingKey; }
    public String getExchange() { return exchange; }
    public byte[] getBody() { return body.clone(); }
    public Map<String, Object> getProperties() { return properties; }

    @Override
    public String toString() {
        return "Delivery{exchange='" + exchange + "', routingKey='" + routingKey
                + "', bodyLength=" + body.length + "}";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Delivery)) return false;
        Delivery other = (Delivery) o;
        return Objects.equals(routingKey, other.routingKey)
                && Objects.equals(exchange, other.exchange)
                && Arrays.equals(body, other.body)
                && properties.equals(other.properties);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(routingKey, exchange, properties) + Arrays.hashCode(body);
    }

    public static class Builder {
        private String routingKey = "";
        private String exchange = "";
        private byte[] body;
        private final Map<String, Object> properties = new LinkedHashMap<>();

        public Builder routingKey(String routingKey) {
            this.routingKey = routingKey;
            return this;
        }

        public Builder exchange(String exchange) {
            this.exchange = exchange;
            return this;
        }

        public Builder body(byte[] body) {
            this.body = body;
            return this;
        }

        /**
         * Records one broker property. Null values are left out of the snapshot.
         */
        public Builder property(String name, Object value) {
            if (value != null) {
                this.properties.put(name, value);
            }
            return this;
        }

        public Builder properties(Map<String, ?> properties) {
            properties.forEach(this::property);
            return this;
        }

        public Delivery build() {
            return new Delivery(this);
        }
    }
}
