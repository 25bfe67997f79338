package io.errorqueue.spring.autoconfigure;

import org.springframework.boot.context.properties.ConfigurationProperties;

import io.errorqueue.dlq.ReconnectPolicy;

/**
 * Configuration properties for the error queue reporter.
 *
 * Example application.yml:
 * <pre>
 * error-queue:
 *   enabled: true
 *   host: rabbit-1.internal
 *   port: 5672
 *   virtual-host: /orders
 *   username: order-service
 *   password: secret
 *   connection-timeout-ms: 10000
 *   handshake-timeout-ms: 10000
 *   reconnect-policy: KEEP_DECLARATIONS
 *   metrics:
 *     enabled: true
 *     name: orders
 * </pre>
 */
@ConfigurationProperties(prefix = "error-queue")
public class ErrorQueueProperties {

    private boolean enabled = true;
    private String host = "localhost";
    private int port = 5672;
    private String virtualHost = "/";
    private String username = "guest";
    private String password = "guest";
    private int connectionTimeoutMs = 60000;
    private int handshakeTimeoutMs = 10000;
    private String connectionName = "error-queue-reporter";
    private ReconnectPolicy reconnectPolicy = ReconnectPolicy.KEEP_DECLARATIONS;
    private MetricsProperties metrics = new MetricsProperties();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getVirtualHost() {
        return virtualHost;
    }

    public void setVirtualHost(String virtualHost) {
        this.virtualHost = virtualHost;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public int getConnectionTimeoutMs() {
        return connectionTimeoutMs;
    }

    public void setConnectionTimeoutMs(int connectionTimeoutMs) {
        this.connectionTimeoutMs = connectionTimeoutMs;
    }

    public int getHandshakeTimeoutMs() {
        return handshakeTimeoutMs;
    }

    public void setHandshakeTimeoutMs(int handshakeTimeoutMs) {
        this.handshakeTimeoutMs = handshakeTimeoutMs;
    }

    public String getConnectionName() {
        return connectionName;
    }

    public void setConnectionName(String connectionName) {
        this.connectionName = connectionName;
    }

    public ReconnectPolicy getReconnectPolicy() {
        return reconnectPolicy;
    }

    public void setReconnectPolicy(ReconnectPolicy reconnectPolicy) {
        this.reconnectPolicy = reconnectPolicy;
    }

    public MetricsProperties getMetrics() {
        return metrics;
    }

    public void setMetrics(MetricsProperties metrics) {
        this.metrics = metrics;
    }

    public static class MetricsProperties {
        private boolean enabled = true;
        private String name = "default";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }
    }
}
